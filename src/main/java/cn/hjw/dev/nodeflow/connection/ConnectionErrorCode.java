package cn.hjw.dev.nodeflow.connection;

/**
 * 连接被拒绝的原因
 */
public enum ConnectionErrorCode {
    UNKNOWN_SOURCE_TYPE,
    UNKNOWN_TARGET_TYPE,
    NO_TRANSFORMATION_PATH
}
