package cn.hjw.dev.nodeflow.engine;

import cn.hjw.dev.nodeflow.WorkflowSubmission;
import cn.hjw.dev.nodeflow.compile.ExecutionPlan;
import cn.hjw.dev.nodeflow.compile.GraphBuilder;
import cn.hjw.dev.nodeflow.component.ComponentDirectory;
import cn.hjw.dev.nodeflow.config.ExecutionOptions;
import cn.hjw.dev.nodeflow.config.OrchestratorConfig;
import cn.hjw.dev.nodeflow.connection.ConnectionValidator;
import cn.hjw.dev.nodeflow.connection.StaticCompatibilityRules;
import cn.hjw.dev.nodeflow.executor.NodeRunner;
import cn.hjw.dev.nodeflow.executor.WorkflowRun;
import cn.hjw.dev.nodeflow.exception.WorkflowValidationException;
import cn.hjw.dev.nodeflow.graph.WorkflowGraph;
import cn.hjw.dev.nodeflow.listener.ExecutionEvent;
import cn.hjw.dev.nodeflow.listener.ExecutionEventType;
import cn.hjw.dev.nodeflow.listener.ExecutionListener;
import cn.hjw.dev.nodeflow.listener.ExecutionListeners;
import cn.hjw.dev.nodeflow.report.ExecutionReport;
import cn.hjw.dev.nodeflow.report.ExecutionState;
import cn.hjw.dev.nodeflow.transform.TransformerCatalog;
import cn.hjw.dev.nodeflow.type.TypeRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 执行编排器
 * VALIDATING -> SCHEDULING -> RUNNING -> {COMPLETED | FAILED | CANCELLED}
 * 类型注册表、转换器目录和连接校验器在构造时注入，进程内各一份。
 */
@Slf4j
public class ExecutionOrchestrator implements WorkflowSubmission, AutoCloseable {

    private final GraphBuilder graphBuilder;
    private final ConnectionValidator validator;
    private final NodeRunner runner;
    private final ExecutorService workerPool;
    private final OrchestratorConfig config;

    private final boolean ownsWorkerPool;
    private final boolean ownsRunner;

    private final Map<String, WorkflowExecution> runningExecutions = new ConcurrentHashMap<>();

    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();

    public ExecutionOrchestrator(ComponentDirectory directory, ConnectionValidator validator) {
        this(directory, validator, OrchestratorConfig.defaults());
    }

    /**
     * 按配置中的缓存 TTL 与最大跳数构建连接校验器 (默认静态兼容规则)
     */
    public ExecutionOrchestrator(ComponentDirectory directory, TypeRegistry types, TransformerCatalog catalog,
                                 OrchestratorConfig config) {
        this(directory, new ConnectionValidator(types, catalog, StaticCompatibilityRules.defaults(),
                config.getConnectionCacheTtl(), config.getMaxTransformHops(), Clock.systemUTC()), config);
    }

    public ExecutionOrchestrator(ComponentDirectory directory, ConnectionValidator validator, OrchestratorConfig config) {
        this.graphBuilder = new GraphBuilder(directory);
        this.validator = validator;
        this.config = config;
        this.ownsWorkerPool = config.getWorkerPool() == null;
        this.workerPool = ownsWorkerPool ? newDaemonPool() : config.getWorkerPool();
        this.ownsRunner = config.getRunnerPool() == null;
        this.runner = ownsRunner ? new NodeRunner() : new NodeRunner(config.getRunnerPool());
    }

    @Override
    public WorkflowExecution submit(WorkflowGraph workflow, Map<String, Object> inputs, ExecutionOptions options) {
        ExecutionOptions effective = options != null ? options : ExecutionOptions.defaults();
        String executionId = "exec-" + UUID.randomUUID();
        String workflowId = effective.getWorkflowId() != null ? effective.getWorkflowId() : workflow.getId();

        // 1. 校验，失败直接抛出，不执行任何节点
        log.info("Execution [{}] of workflow [{}]: {}", executionId, workflowId, ExecutionState.VALIDATING);
        ExecutionPlan plan;
        try {
            plan = graphBuilder.build(workflow);
        } catch (WorkflowValidationException e) {
            ExecutionListeners.fire(listeners, ExecutionEvent.builder().type(ExecutionEventType.EXECUTION_FAILED)
                    .executionId(executionId).workflowId(workflowId).report(e.getReport()).build());
            throw e;
        }

        // 2. 调度
        log.info("Execution [{}]: {} {} node(s), order {}", executionId, ExecutionState.SCHEDULING,
                plan.getOrder().size(), plan.getOrder());
        long nodeTimeout = effective.getNodeTimeoutMs() != null ? effective.getNodeTimeoutMs() : config.getDefaultNodeTimeoutMs();
        Long workflowTimeout = effective.getTimeoutMs() != null ? effective.getTimeoutMs() : config.getDefaultWorkflowTimeoutMs();
        WorkflowRun run = new WorkflowRun(executionId, workflowId, plan, inputs, effective.isFailFast(),
                nodeTimeout, validator, runner, workerPool, listeners);

        // 3. 运行
        log.info("Execution [{}]: {} (failFast={}, timeoutMs={})", executionId, ExecutionState.RUNNING,
                effective.isFailFast(), workflowTimeout);
        CompletableFuture<ExecutionReport> report = run.start(workflowTimeout);
        WorkflowExecution execution = new WorkflowExecution(run, report);
        runningExecutions.put(executionId, execution);
        report.whenComplete((r, ex) -> runningExecutions.remove(executionId));
        return execution;
    }

    /**
     * 注册执行事件监听器，对之后提交的执行生效
     */
    public ExecutionOrchestrator addListener(ExecutionListener listener) {
        listeners.add(listener);
        return this;
    }

    public boolean removeListener(ExecutionListener listener) {
        return listeners.remove(listener);
    }

    /**
     * 尚未结束的执行
     */
    public Set<String> runningExecutions() {
        return Set.copyOf(runningExecutions.keySet());
    }

    public Optional<WorkflowExecution> findExecution(String executionId) {
        return Optional.ofNullable(runningExecutions.get(executionId));
    }

    public ConnectionValidator getValidator() {
        return validator;
    }

    @Override
    public void close() {
        runningExecutions.values().forEach(WorkflowExecution::cancel);
        if (ownsWorkerPool) {
            workerPool.shutdownNow();
        }
        if (ownsRunner) {
            runner.shutdown();
        }
    }

    private static ExecutorService newDaemonPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "nodeflow-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
