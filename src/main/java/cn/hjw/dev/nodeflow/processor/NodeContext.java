package cn.hjw.dev.nodeflow.processor;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;

/**
 * 节点执行上下文
 * 只暴露日志、节点ID和工作流ID，节点无法访问其他节点或编排器内部状态
 */
@Getter
@RequiredArgsConstructor
public class NodeContext {
    private final String nodeId;
    private final String workflowId;
    private final String executionId;
    private final Logger logger;
}
