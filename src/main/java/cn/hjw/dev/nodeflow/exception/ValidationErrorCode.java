package cn.hjw.dev.nodeflow.exception;

public enum ValidationErrorCode {
    DUPLICATE_NODE_ID,
    UNKNOWN_NODE_TYPE,
    MISSING_CONFIG,
    DANGLING_EDGE,
    UNKNOWN_PORT,
    DUPLICATE_INPUT_BINDING,
    CYCLE_DETECTED
}
