package cn.hjw.dev.nodeflow.exception;

// 执行引擎自身的故障 (非节点失败)，由 WorkflowExecution.await 抛出
public class NodeflowRuntimeException extends RuntimeException {

    public NodeflowRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

}
