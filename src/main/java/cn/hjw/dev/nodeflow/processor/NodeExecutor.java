package cn.hjw.dev.nodeflow.processor;

import java.util.Map;

/**
 * 节点执行器接口
 * 每种节点类型注册一个实现，编排器不关心其内部逻辑
 */
@FunctionalInterface
public interface NodeExecutor {

    /**
     * 执行节点逻辑
     * @param inputs  已解析 (并完成类型转换) 的输入，Key 为输入端口ID
     * @param config  节点静态配置
     * @param context 执行上下文
     * @return 输出，Key 为输出端口ID
     * @throws Exception 执行异常
     */
    Map<String, Object> execute(Map<String, Object> inputs, Map<String, Object> config, NodeContext context) throws Exception;
}
