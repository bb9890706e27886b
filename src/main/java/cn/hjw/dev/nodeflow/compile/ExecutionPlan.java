package cn.hjw.dev.nodeflow.compile;

import cn.hjw.dev.nodeflow.component.ComponentDescriptor;
import cn.hjw.dev.nodeflow.graph.WorkflowEdge;
import cn.hjw.dev.nodeflow.graph.WorkflowNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 校验通过的执行计划
 */
@Getter
@RequiredArgsConstructor
public class ExecutionPlan {

    private final String workflowId;

    // 拓扑序
    private final List<String> order;

    private final Map<String, WorkflowNode> nodes;

    private final Map<String, ComponentDescriptor> descriptors;

    // Key=NodeId, Value=指向它的连线 (声明顺序)
    private final Map<String, List<WorkflowEdge>> inboundEdges;

    // Key=NodeId, Value=去重后的父节点
    private final Map<String, List<String>> nodeParentsMap;

    public List<WorkflowEdge> inbound(String nodeId) {
        return inboundEdges.getOrDefault(nodeId, List.of());
    }

    public List<String> parents(String nodeId) {
        return nodeParentsMap.getOrDefault(nodeId, List.of());
    }
}
