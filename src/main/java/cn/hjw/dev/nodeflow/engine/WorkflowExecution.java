package cn.hjw.dev.nodeflow.engine;

import cn.hjw.dev.nodeflow.exception.NodeflowRuntimeException;
import cn.hjw.dev.nodeflow.executor.WorkflowRun;
import cn.hjw.dev.nodeflow.report.ExecutionReport;
import cn.hjw.dev.nodeflow.report.TerminationReason;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 已提交执行的句柄，可等待报告或取消
 */
public class WorkflowExecution {

    private final WorkflowRun run;

    private final CompletableFuture<ExecutionReport> report;

    WorkflowExecution(WorkflowRun run, CompletableFuture<ExecutionReport> report) {
        this.run = run;
        this.report = report;
    }

    public String getExecutionId() {
        return run.getExecutionId();
    }

    public String getWorkflowId() {
        return run.getWorkflowId();
    }

    /**
     * 请求取消：在途调用被中断，未开始的节点不再执行，报告以 CANCELLED 结束
     * @return 已被中断过或报告已开始生成时返回 false
     */
    public boolean cancel() {
        return run.interrupt(TerminationReason.CANCELLED);
    }

    public boolean isDone() {
        return report.isDone();
    }

    /**
     * 阻塞等待最终报告
     */
    public ExecutionReport await() {
        try {
            return report.join();
        } catch (CompletionException e) {
            throw new NodeflowRuntimeException("Execution [" + getExecutionId() + "] failed in the engine", e.getCause());
        }
    }

    public ExecutionReport await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return report.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new NodeflowRuntimeException("Execution [" + getExecutionId() + "] failed in the engine", e.getCause());
        }
    }

    public CompletableFuture<ExecutionReport> toCompletableFuture() {
        return report.copy();
    }
}
