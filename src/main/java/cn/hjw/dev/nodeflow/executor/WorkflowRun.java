package cn.hjw.dev.nodeflow.executor;

import cn.hjw.dev.nodeflow.compile.ExecutionPlan;
import cn.hjw.dev.nodeflow.component.ComponentDescriptor;
import cn.hjw.dev.nodeflow.component.InputPort;
import cn.hjw.dev.nodeflow.connection.ConnectionAttempt;
import cn.hjw.dev.nodeflow.connection.ConnectionResult;
import cn.hjw.dev.nodeflow.connection.ConnectionValidator;
import cn.hjw.dev.nodeflow.graph.WorkflowEdge;
import cn.hjw.dev.nodeflow.graph.WorkflowNode;
import cn.hjw.dev.nodeflow.listener.ExecutionEvent;
import cn.hjw.dev.nodeflow.listener.ExecutionEventType;
import cn.hjw.dev.nodeflow.listener.ExecutionListener;
import cn.hjw.dev.nodeflow.listener.ExecutionListeners;
import cn.hjw.dev.nodeflow.processor.NodeContext;
import cn.hjw.dev.nodeflow.report.ErrorType;
import cn.hjw.dev.nodeflow.report.ExecutionRecord;
import cn.hjw.dev.nodeflow.report.ExecutionReport;
import cn.hjw.dev.nodeflow.report.ExecutionState;
import cn.hjw.dev.nodeflow.report.NodeError;
import cn.hjw.dev.nodeflow.report.NodeStatus;
import cn.hjw.dev.nodeflow.report.TerminationReason;
import cn.hjw.dev.nodeflow.transform.TransformationException;
import cn.hjw.dev.nodeflow.transform.Transformer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次工作流执行
 * 按拓扑序为每个节点构建一个 Future，挂在其父节点的 Future 之后，在调度线程池中运行。
 * 互不连通的节点可以并发执行; 节点之间唯一的数据通道是经连接校验器解析后的输入输出。
 */
@Slf4j
public class WorkflowRun {

    @Getter
    private final String executionId;

    @Getter
    private final String workflowId;

    private final ExecutionPlan plan;
    private final Map<String, Object> workflowInputs;
    private final boolean failFast;
    private final long nodeTimeoutMs;
    private final ConnectionValidator validator;
    private final NodeRunner runner;
    private final ExecutorService workerPool;
    private final List<ExecutionListener> listeners;

    private final long startedAt = System.currentTimeMillis();

    // 节点运行状态 (按拓扑序)
    private final Map<String, NodeRun> runs = new LinkedHashMap<>();

    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

    // fail-fast 模式下第一个失败的节点
    private final AtomicReference<String> failedFirst = new AtomicReference<>();

    // 工作流级中断原因: 超时或取消
    private final AtomicReference<TerminationReason> interruption = new AtomicReference<>();

    // 中断与生成报告互斥: 报告开始生成后不再接受中断
    private final Object lifecycle = new Object();
    private boolean finishing;

    private volatile Long workflowTimeoutMs;

    public WorkflowRun(String executionId, String workflowId, ExecutionPlan plan, Map<String, Object> workflowInputs,
                       boolean failFast, long nodeTimeoutMs, ConnectionValidator validator,
                       NodeRunner runner, ExecutorService workerPool, List<ExecutionListener> listeners) {
        this.executionId = executionId;
        this.workflowId = workflowId;
        this.plan = plan;
        this.workflowInputs = workflowInputs == null ? Map.of() : Map.copyOf(workflowInputs);
        this.failFast = failFast;
        this.nodeTimeoutMs = nodeTimeoutMs;
        this.validator = validator;
        this.runner = runner;
        this.workerPool = workerPool;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        for (String nodeId : plan.getOrder()) {
            runs.put(nodeId, new NodeRun(nodeId, plan.getNodes().get(nodeId).getTypeId()));
        }
    }

    /**
     * 启动执行
     * @param timeoutMs 工作流整体超时，为空表示不限制
     * @return 所有节点结束后完成的报告
     */
    public CompletableFuture<ExecutionReport> start(Long timeoutMs) {
        this.workflowTimeoutMs = timeoutMs;
        fire(ExecutionEvent.builder().type(ExecutionEventType.EXECUTION_STARTED)
                .executionId(executionId).workflowId(workflowId).build());

        // 1. 拓扑序保证父节点的 Future 已经存在
        Map<String, CompletableFuture<Void>> futureRegistry = new HashMap<>();
        for (String nodeId : plan.getOrder()) {
            List<String> parentIds = plan.parents(nodeId);
            CompletableFuture<Void> currentFuture;
            if (parentIds.isEmpty()) {
                currentFuture = CompletableFuture.runAsync(() -> runNodeSafely(nodeId), workerPool);
            } else {
                CompletableFuture<?>[] parentFutures = parentIds.stream()
                        .map(futureRegistry::get)
                        .toArray(CompletableFuture[]::new);
                currentFuture = CompletableFuture.allOf(parentFutures)
                        .thenRunAsync(() -> runNodeSafely(nodeId), workerPool);
            }
            futureRegistry.put(nodeId, currentFuture);
        }

        // 2. 全局等待 (Barrier)
        CompletableFuture<Void> allDone = CompletableFuture.allOf(futureRegistry.values().toArray(new CompletableFuture[0]));
        CompletableFuture<Void> guarded = allDone.copy();
        if (timeoutMs != null && timeoutMs > 0) {
            guarded = guarded.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        }

        // 3. 超时后中断所有在途节点，等它们落定后再生成报告
        return guarded
                .handle((v, ex) -> {
                    if (ex != null && unwrap(ex) instanceof TimeoutException) {
                        interrupt(TerminationReason.TIMEOUT);
                    }
                    return null;
                })
                .thenCompose(v -> allDone.handle((v2, ex) -> {
                    if (ex != null) {
                        log.error("Execution [{}] ended with an engine fault: {}", executionId, unwrap(ex).toString());
                    }
                    return finish();
                }));
    }

    /**
     * 以超时或取消中断执行: 尚未开始的节点不再运行，在途调用被中断
     * @return 是否是第一次中断; 已中断或报告已开始生成时为 false
     */
    public boolean interrupt(TerminationReason reason) {
        synchronized (lifecycle) {
            if (finishing || interruption.get() != null) {
                return false;
            }
            interruption.set(reason);
        }
        log.info("Execution [{}] interrupted: {}", executionId, reason);
        for (NodeRun run : runs.values()) {
            run.interruptWorker();
        }
        return true;
    }

    private void runNodeSafely(String nodeId) {
        NodeRun run = runs.get(nodeId);
        try {
            runNode(nodeId, run);
        } catch (Throwable t) {
            log.error("Node [{}] hit an unexpected engine error", nodeId, t);
            run.fail(new NodeError(ErrorType.RUNTIME, "Engine error: " + t, t), 0);
        } finally {
            // 中断只针对本节点的调用，不能带到线程池的下一个任务
            if (Thread.interrupted()) {
                log.debug("Cleared interrupt flag after node [{}]", nodeId);
            }
        }
    }

    private void runNode(String nodeId, NodeRun run) {
        // 1. 工作流已被中断
        TerminationReason stop = interruption.get();
        if (stop != null) {
            run.skip(stoppedBeforeStart(stop));
            return;
        }

        // 2. 级联剪枝：任一父节点未成功，当前节点跳过
        for (String parentId : plan.parents(nodeId)) {
            NodeRun parent = runs.get(parentId);
            if (parent.status != NodeStatus.SUCCEEDED) {
                log.info("Node [{}] skipped because parent [{}] is {}.", nodeId, parentId, parent.status);
                run.skip(NodeError.of(ErrorType.UPSTREAM_FAILED,
                        "Dependency [" + parentId + "] " + parent.status.name().toLowerCase(Locale.ROOT)));
                return;
            }
        }

        // 3. fail-fast：已有节点失败，停止调度
        String failed = failedFirst.get();
        if (failFast && failed != null) {
            log.info("Node [{}] skipped, execution stopped after node [{}] failed.", nodeId, failed);
            run.skip(NodeError.of(ErrorType.ABORTED, "Execution stopped after node [" + failed + "] failed"));
            return;
        }

        WorkflowNode node = plan.getNodes().get(nodeId);
        ComponentDescriptor descriptor = plan.getDescriptors().get(nodeId);

        // 4. 绑定当前线程，此后的输入转换与执行都能被超时或取消中断
        if (!run.attach()) {
            run.skip(stoppedBeforeStart(interruption.get()));
            return;
        }
        try {
            executeAttached(nodeId, run, node, descriptor);
        } finally {
            run.detachWorker();
        }
    }

    private void executeAttached(String nodeId, NodeRun run, WorkflowNode node, ComponentDescriptor descriptor) {
        // 5. 解析输入
        Map<String, Object> inputs = new LinkedHashMap<>();
        Set<String> boundPorts = new HashSet<>();
        for (WorkflowEdge edge : plan.inbound(nodeId)) {
            boundPorts.add(edge.getTargetPort());
            NodeError edgeError = resolveEdge(edge, descriptor, inputs);
            if (edgeError == null) {
                continue;
            }
            TerminationReason stop = interruption.get();
            if (stop != null) {
                recordInterrupted(nodeId, run, stop, edgeError.getCause(), 0);
            } else if (edgeError.getType() == ErrorType.TRANSFORMATION) {
                recordFailure(nodeId, run, edgeError, 0);
            } else {
                log.info("Node [{}] skipped: {}", nodeId, edgeError.getMessage());
                run.skip(edgeError);
            }
            return;
        }
        bindWorkflowInputs(nodeId, descriptor, boundPorts, inputs);

        for (InputPort port : descriptor.getInputPorts()) {
            if (port.isRequired() && inputs.get(port.getId()) == null) {
                log.info("Node [{}] skipped: required input [{}] has no value", nodeId, port.getId());
                run.skip(NodeError.of(ErrorType.MISSING_INPUT, "Required input [" + port.getId() + "] has no value"));
                return;
            }
        }

        // 6. 执行
        run.markRunning(inputs);
        NodeContext context = new NodeContext(nodeId, workflowId, executionId,
                LoggerFactory.getLogger("cn.hjw.dev.nodeflow.node." + descriptor.getTypeId()));
        NodeRunResult result = runner.run(descriptor, node.getConfig(), inputs, timeoutFor(descriptor), context);

        if (result.isSuccess()) {
            run.succeed(result.getOutputs(), result.getDurationMs());
            log.debug("Node [{}] succeeded in {} ms", nodeId, result.getDurationMs());
            return;
        }

        NodeError error = result.getError();
        TerminationReason stop = interruption.get();
        if (error.getType() == ErrorType.CANCELLED && stop != null) {
            recordInterrupted(nodeId, run, stop, error.getCause(), result.getDurationMs());
        } else {
            recordFailure(nodeId, run, error, result.getDurationMs());
        }
    }

    /**
     * 节点在途时工作流被中断: 取消记为跳过，超时记为失败
     */
    private void recordInterrupted(String nodeId, NodeRun run, TerminationReason stop, Throwable cause, long durationMs) {
        log.info("Node [{}] interrupted by {}", nodeId, stop);
        if (stop == TerminationReason.CANCELLED) {
            run.skip(new NodeError(ErrorType.CANCELLED, "Execution was cancelled while the node was running", cause), durationMs);
        } else {
            run.fail(new NodeError(ErrorType.TIMEOUT, "Workflow timed out after " + workflowTimeoutMs + " ms", cause), durationMs);
        }
    }

    /**
     * 通过连接校验器解析一条入边，成功时把值写入 inputs
     * @return 导致节点不能执行的错误，成功为 null
     */
    private NodeError resolveEdge(WorkflowEdge edge, ComponentDescriptor target, Map<String, Object> inputs) {
        ComponentDescriptor source = plan.getDescriptors().get(edge.getSourceNodeId());
        String producedType = source.findOutput(edge.getSourcePort()).orElseThrow().getDataType();
        String expectedType = target.findInput(edge.getTargetPort()).orElseThrow().getDataType();

        ConnectionResult connection = validator.validatePorts(ConnectionAttempt.builder()
                .sourceNodeId(edge.getSourceNodeId())
                .sourcePortId(edge.getSourcePort())
                .sourceDataType(producedType)
                .targetNodeId(edge.getTargetNodeId())
                .targetPortId(edge.getTargetPort())
                .targetDataType(expectedType)
                .build());
        if (!connection.getWarnings().isEmpty()) {
            log.warn("Connection warnings for {}: {}", edge, connection.getWarnings());
            warnings.addAll(connection.getWarnings());
        }
        if (!connection.canConnect()) {
            StringBuilder message = new StringBuilder(String.join("; ", connection.getErrors()));
            if (!connection.getSuggestions().isEmpty()) {
                message.append(" (").append(String.join("; ", connection.getSuggestions())).append(')');
            }
            return NodeError.of(ErrorType.CONNECTION, message.toString());
        }

        Map<String, Object> upstreamOutputs = runs.get(edge.getSourceNodeId()).outputs;
        if (!upstreamOutputs.containsKey(edge.getSourcePort())) {
            log.debug("Upstream port {}.{} produced no value", edge.getSourceNodeId(), edge.getSourcePort());
            return null;
        }
        Object value = upstreamOutputs.get(edge.getSourcePort());
        Optional<Transformer> transformer = connection.transformer();
        if (transformer.isPresent() && value != null) {
            try {
                value = transformer.get().apply(value);
            } catch (TransformationException e) {
                return new NodeError(ErrorType.TRANSFORMATION, "Edge " + edge + ": " + e.getMessage(), e);
            }
        }
        inputs.put(edge.getTargetPort(), value);
        return null;
    }

    /**
     * 顶层输入只绑定到没有入边的端口: "nodeId.portId" 优先于 "portId"
     */
    private void bindWorkflowInputs(String nodeId, ComponentDescriptor descriptor, Set<String> boundPorts,
                                    Map<String, Object> inputs) {
        for (InputPort port : descriptor.getInputPorts()) {
            if (boundPorts.contains(port.getId())) {
                continue;
            }
            String qualified = nodeId + "." + port.getId();
            if (workflowInputs.containsKey(qualified)) {
                inputs.put(port.getId(), workflowInputs.get(qualified));
            } else if (workflowInputs.containsKey(port.getId())) {
                inputs.put(port.getId(), workflowInputs.get(port.getId()));
            }
        }
    }

    private void recordFailure(String nodeId, NodeRun run, NodeError error, long durationMs) {
        run.fail(error, durationMs);
        log.warn("Node [{}] failed: {}", nodeId, error);
        if (failFast && failedFirst.compareAndSet(null, nodeId)) {
            log.info("Fail-fast: execution [{}] stops scheduling after node [{}] failed.", executionId, nodeId);
        }
    }

    private long timeoutFor(ComponentDescriptor descriptor) {
        return descriptor.getTimeoutMs() != null ? descriptor.getTimeoutMs() : nodeTimeoutMs;
    }

    private NodeError stoppedBeforeStart(TerminationReason reason) {
        if (reason == TerminationReason.CANCELLED) {
            return NodeError.of(ErrorType.CANCELLED, "Execution was cancelled before the node started");
        }
        return NodeError.of(ErrorType.ABORTED, "Workflow timed out before the node started");
    }

    private ExecutionReport finish() {
        List<ExecutionRecord> records = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        boolean anyFailed = false;
        boolean anySkipped = false;
        for (NodeRun run : runs.values()) {
            ExecutionRecord record = run.snapshot();
            records.add(record);
            anyFailed |= record.getStatus() == NodeStatus.FAILED;
            anySkipped |= record.getStatus() == NodeStatus.SKIPPED;
            if (record.getError() != null) {
                errors.add("Node [" + record.getNodeId() + "] " + record.getStatus().name().toLowerCase(Locale.ROOT)
                        + ": " + record.getError());
            }
        }

        TerminationReason stop;
        synchronized (lifecycle) {
            finishing = true;
            stop = interruption.get();
        }
        ExecutionState state;
        TerminationReason reason;
        if (stop == TerminationReason.CANCELLED) {
            state = ExecutionState.CANCELLED;
            reason = TerminationReason.CANCELLED;
        } else if (stop == TerminationReason.TIMEOUT) {
            state = ExecutionState.FAILED;
            reason = TerminationReason.TIMEOUT;
        } else if (anyFailed) {
            state = ExecutionState.FAILED;
            reason = TerminationReason.NODE_FAILURE;
        } else {
            state = ExecutionState.COMPLETED;
            reason = null;
        }

        List<String> warningSnapshot;
        synchronized (warnings) {
            warningSnapshot = new ArrayList<>(new LinkedHashSet<>(warnings));
        }
        long duration = System.currentTimeMillis() - startedAt;
        log.info("Execution [{}] of workflow [{}] reached {} in {} ms", executionId, workflowId, state, duration);

        ExecutionReport report = ExecutionReport.builder()
                .executionId(executionId)
                .workflowId(workflowId)
                .state(state)
                .reason(reason)
                .success(state == ExecutionState.COMPLETED && !anySkipped)
                .perNode(records)
                .errors(errors)
                .warnings(warningSnapshot)
                .durationMs(duration)
                .build();
        fire(ExecutionEvent.builder().type(terminalEvent(state))
                .executionId(executionId).workflowId(workflowId).report(report).build());
        return report;
    }

    private static ExecutionEventType terminalEvent(ExecutionState state) {
        if (state == ExecutionState.COMPLETED) {
            return ExecutionEventType.EXECUTION_COMPLETED;
        }
        return state == ExecutionState.CANCELLED ? ExecutionEventType.EXECUTION_CANCELLED : ExecutionEventType.EXECUTION_FAILED;
    }

    private void fire(ExecutionEvent event) {
        if (!listeners.isEmpty()) {
            ExecutionListeners.fire(listeners, event);
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * 节点运行状态，只由驱动该节点的线程修改
     */
    private class NodeRun {
        private final String nodeId;
        private final String typeId;

        private volatile NodeStatus status = NodeStatus.PENDING;
        private volatile Map<String, Object> inputs = Map.of();
        private volatile Map<String, Object> outputs = Map.of();
        private volatile NodeError error;
        private volatile long durationMs;

        // 驱动本节点的调度线程 (输入转换与执行期间)
        private Thread worker;

        NodeRun(String nodeId, String typeId) {
            this.nodeId = nodeId;
            this.typeId = typeId;
        }

        synchronized boolean attach() {
            if (interruption.get() != null) {
                return false;
            }
            worker = Thread.currentThread();
            return true;
        }

        void markRunning(Map<String, Object> resolvedInputs) {
            inputs = Collections.unmodifiableMap(new LinkedHashMap<>(resolvedInputs));
            status = NodeStatus.RUNNING;
            nodeEvent(ExecutionEventType.NODE_STARTED);
        }

        synchronized void detachWorker() {
            worker = null;
        }

        synchronized void interruptWorker() {
            if (worker != null) {
                worker.interrupt();
            }
        }

        void succeed(Map<String, Object> producedOutputs, long duration) {
            outputs = producedOutputs;
            durationMs = duration;
            status = NodeStatus.SUCCEEDED;
            nodeEvent(ExecutionEventType.NODE_COMPLETED);
        }

        void fail(NodeError nodeError, long duration) {
            error = nodeError;
            durationMs = duration;
            status = NodeStatus.FAILED;
            nodeEvent(ExecutionEventType.NODE_FAILED);
        }

        void skip(NodeError reason) {
            skip(reason, 0);
        }

        void skip(NodeError reason, long duration) {
            error = reason;
            durationMs = duration;
            status = NodeStatus.SKIPPED;
            nodeEvent(ExecutionEventType.NODE_SKIPPED);
        }

        private void nodeEvent(ExecutionEventType type) {
            fire(ExecutionEvent.builder().type(type).executionId(executionId).workflowId(workflowId)
                    .nodeId(nodeId).record(record(status, error)).build());
        }

        /**
         * 报告用快照: 从未结束的节点记为被跳过
         */
        ExecutionRecord snapshot() {
            NodeStatus current = status;
            if (current.isTerminal()) {
                return record(current, error);
            }
            return record(NodeStatus.SKIPPED, NodeError.of(ErrorType.ABORTED, "Node was never scheduled"));
        }

        private ExecutionRecord record(NodeStatus current, NodeError currentError) {
            return ExecutionRecord.builder()
                    .nodeId(nodeId)
                    .typeId(typeId)
                    .status(current)
                    .inputs(inputs)
                    .outputs(outputs)
                    .error(currentError)
                    .durationMs(durationMs)
                    .build();
        }
    }
}
