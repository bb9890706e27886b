package cn.hjw.dev.nodeflow.report;

public enum TerminationReason {
    VALIDATION,
    NODE_FAILURE,
    TIMEOUT,
    CANCELLED
}
