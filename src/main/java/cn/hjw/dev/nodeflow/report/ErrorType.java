package cn.hjw.dev.nodeflow.report;

/**
 * 节点级错误类型
 */
public enum ErrorType {
    // 执行器抛出异常
    RUNTIME,
    // 超过节点或工作流时限
    TIMEOUT,
    // 输出了未声明的端口
    MALFORMED_OUTPUT,
    // 连线上的转换器执行失败
    TRANSFORMATION,
    // 连线两端类型无法连接
    CONNECTION,
    // 必填输入缺失
    MISSING_INPUT,
    // 依赖节点失败或被跳过
    UPSTREAM_FAILED,
    // fail-fast 模式下因其他节点失败而停止调度
    ABORTED,
    // 外部取消
    CANCELLED
}
