package cn.hjw.dev.nodeflow.listener;

import cn.hjw.dev.nodeflow.report.ExecutionRecord;
import cn.hjw.dev.nodeflow.report.ExecutionReport;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 执行生命周期事件
 * 节点事件携带节点记录快照，执行结束事件携带最终报告
 */
@Getter
@Builder
@ToString(of = {"type", "executionId", "nodeId"})
public class ExecutionEvent {

    private final ExecutionEventType type;

    private final String executionId;

    private final String workflowId;

    // 仅节点事件
    private final String nodeId;

    private final ExecutionRecord record;

    // 仅执行结束事件
    private final ExecutionReport report;

    @Builder.Default
    private final long timestamp = System.currentTimeMillis();
}
