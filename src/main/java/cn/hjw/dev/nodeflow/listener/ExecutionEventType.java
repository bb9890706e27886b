package cn.hjw.dev.nodeflow.listener;

public enum ExecutionEventType {
    EXECUTION_STARTED,
    NODE_STARTED,
    NODE_COMPLETED,
    NODE_FAILED,
    NODE_SKIPPED,
    EXECUTION_COMPLETED,
    EXECUTION_FAILED,
    EXECUTION_CANCELLED
}
