package cn.hjw.dev.nodeflow;

import cn.hjw.dev.nodeflow.config.ExecutionOptions;
import cn.hjw.dev.nodeflow.engine.WorkflowExecution;
import cn.hjw.dev.nodeflow.graph.WorkflowGraph;
import cn.hjw.dev.nodeflow.report.ExecutionReport;

import java.util.Map;

public interface WorkflowSubmission {

    /**
     * 提交工作流并立即返回执行句柄
     * @param workflow 工作流定义
     * @param inputs   顶层输入，可为空
     * @param options  执行选项
     * @return 执行句柄
     * @throws cn.hjw.dev.nodeflow.exception.WorkflowValidationException 执行前校验失败
     */
    WorkflowExecution submit(WorkflowGraph workflow, Map<String, Object> inputs, ExecutionOptions options);

    /**
     * 执行工作流并等待报告
     */
    default ExecutionReport execute(WorkflowGraph workflow, Map<String, Object> inputs, ExecutionOptions options) {
        return submit(workflow, inputs, options).await();
    }

    default ExecutionReport execute(WorkflowGraph workflow) {
        return execute(workflow, Map.of(), ExecutionOptions.defaults());
    }
}
