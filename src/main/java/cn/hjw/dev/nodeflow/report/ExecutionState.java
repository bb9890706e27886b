package cn.hjw.dev.nodeflow.report;

/**
 * 执行请求的状态机: VALIDATING -> SCHEDULING -> RUNNING -> {COMPLETED | FAILED | CANCELLED}
 */
public enum ExecutionState {
    VALIDATING,
    SCHEDULING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
