package cn.hjw.dev.nodeflow.graph;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * 连线: sourceNode.sourcePort -> targetNode.targetPort
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class WorkflowEdge {
    @NonNull
    private final String sourceNodeId;
    @NonNull
    private final String sourcePort;
    @NonNull
    private final String targetNodeId;
    @NonNull
    private final String targetPort;

    @Override
    public String toString() {
        return sourceNodeId + "." + sourcePort + " -> " + targetNodeId + "." + targetPort;
    }
}
