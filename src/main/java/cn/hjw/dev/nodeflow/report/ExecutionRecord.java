package cn.hjw.dev.nodeflow.report;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * 单个节点的执行记录 (报告中的不可变快照)
 */
@Getter
@Builder
@ToString(exclude = {"inputs", "outputs"})
public class ExecutionRecord {

    private final String nodeId;

    private final String typeId;

    private final NodeStatus status;

    @Builder.Default
    private final Map<String, Object> inputs = Map.of();

    @Builder.Default
    private final Map<String, Object> outputs = Map.of();

    private final NodeError error;

    private final long durationMs;

    public Object output(String portId) {
        return outputs.get(portId);
    }

    public Object input(String portId) {
        return inputs.get(portId);
    }
}
