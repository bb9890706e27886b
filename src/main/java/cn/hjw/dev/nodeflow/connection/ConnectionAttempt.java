package cn.hjw.dev.nodeflow.connection;

import lombok.Builder;
import lombok.Getter;

/**
 * 一次端口连接尝试 (源节点端口 -> 目标节点端口)
 */
@Getter
@Builder
public class ConnectionAttempt {
    private final String sourceNodeId;
    private final String sourcePortId;
    private final String sourceDataType;
    private final String targetNodeId;
    private final String targetPortId;
    private final String targetDataType;

    public String describe() {
        return sourceNodeId + "." + sourcePortId + " (" + sourceDataType + ") -> "
                + targetNodeId + "." + targetPortId + " (" + targetDataType + ")";
    }
}
