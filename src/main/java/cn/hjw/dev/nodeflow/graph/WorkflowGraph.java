package cn.hjw.dev.nodeflow.graph;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 工作流定义：节点 + 连线
 * 每次执行请求构建一次，执行期间不可修改; 重新提交需要新建实例
 */
@Getter
public class WorkflowGraph {

    private final String id;

    private final List<WorkflowNode> nodes;

    private final List<WorkflowEdge> edges;

    public WorkflowGraph(String id, List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        this.id = id != null ? id : "workflow-" + UUID.randomUUID();
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 流式构建器 (声明顺序即同层节点的默认执行顺序)
     */
    public static class Builder {

        private String id;
        private final List<WorkflowNode> nodes = new ArrayList<>();
        private final List<WorkflowEdge> edges = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder node(String nodeId, String typeId) {
            return node(nodeId, typeId, Map.of());
        }

        public Builder node(String nodeId, String typeId, Map<String, Object> config) {
            nodes.add(new WorkflowNode(nodeId, typeId, config));
            return this;
        }

        /**
         * 添加连线: sourceNode.sourcePort -> targetNode.targetPort
         */
        public Builder edge(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {
            edges.add(new WorkflowEdge(sourceNodeId, sourcePort, targetNodeId, targetPort));
            return this;
        }

        public WorkflowGraph build() {
            return new WorkflowGraph(id, nodes, edges);
        }
    }
}
