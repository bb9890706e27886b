package cn.hjw.dev.nodeflow.report;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * 执行报告：一次执行请求的最终不可变快照
 * perNode 总是会填充 (校验失败时为空列表)
 */
@Getter
@Builder
@ToString(of = {"executionId", "workflowId", "state", "reason", "success", "durationMs"})
public class ExecutionReport {

    private final String executionId;

    private final String workflowId;

    private final ExecutionState state;

    // 仅当没有节点失败、也没有节点被跳过时为 true
    private final boolean success;

    private final TerminationReason reason;

    @Singular("record")
    private final List<ExecutionRecord> perNode;

    @Singular
    private final List<String> errors;

    @Singular
    private final List<String> warnings;

    private final long durationMs;

    public Optional<ExecutionRecord> record(String nodeId) {
        return perNode.stream().filter(r -> r.getNodeId().equals(nodeId)).findFirst();
    }

    public NodeStatus statusOf(String nodeId) {
        return record(nodeId).map(ExecutionRecord::getStatus)
                .orElseThrow(() -> new IllegalArgumentException("No record for node [" + nodeId + "]"));
    }

    public long count(NodeStatus status) {
        return perNode.stream().filter(r -> r.getStatus() == status).count();
    }
}
