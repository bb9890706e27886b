package cn.hjw.dev.nodeflow.executor;

import cn.hjw.dev.nodeflow.component.ComponentDescriptor;
import cn.hjw.dev.nodeflow.processor.NodeContext;
import cn.hjw.dev.nodeflow.report.ErrorType;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 节点运行器
 * 在独立线程中调用节点执行器，施加硬性超时，把异常转换为结构化失败。
 * 不做自动重试。
 */
@Slf4j
public class NodeRunner {

    private final ExecutorService runnerPool;

    public NodeRunner() {
        this(newDaemonPool());
    }

    public NodeRunner(ExecutorService runnerPool) {
        this.runnerPool = runnerPool;
    }

    /**
     * 执行一个节点
     * @param descriptor 组件描述
     * @param config     节点静态配置
     * @param inputs     已解析的输入
     * @param timeoutMs  超时 (毫秒)，<= 0 表示不限制
     * @param context    执行上下文
     * @return 执行结果，从不抛出异常
     */
    public NodeRunResult run(ComponentDescriptor descriptor, Map<String, Object> config,
                             Map<String, Object> inputs, long timeoutMs, NodeContext context) {
        long start = System.currentTimeMillis();
        Map<String, Object> isolatedInputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        Map<String, Object> isolatedConfig = Collections.unmodifiableMap(new LinkedHashMap<>(config));

        Future<Map<String, Object>> invocation;
        try {
            invocation = runnerPool.submit(() -> descriptor.getExecutor().execute(isolatedInputs, isolatedConfig, context));
        } catch (RuntimeException e) {
            return NodeRunResult.failed(ErrorType.RUNTIME, "Executor could not be scheduled: " + e.getMessage(), e, elapsed(start));
        }

        Map<String, Object> outputs;
        try {
            outputs = timeoutMs > 0 ? invocation.get(timeoutMs, TimeUnit.MILLISECONDS) : invocation.get();
        } catch (TimeoutException e) {
            invocation.cancel(true);
            log.warn("Node [{}] timed out after {} ms", context.getNodeId(), timeoutMs);
            return NodeRunResult.failed(ErrorType.TIMEOUT, "Execution timed out after " + timeoutMs + " ms", e, elapsed(start));
        } catch (InterruptedException e) {
            // 调用方被中断 (取消或工作流超时)
            invocation.cancel(true);
            Thread.currentThread().interrupt();
            return NodeRunResult.failed(ErrorType.CANCELLED, "Execution was interrupted", e, elapsed(start));
        } catch (CancellationException e) {
            return NodeRunResult.failed(ErrorType.CANCELLED, "Execution was cancelled", e, elapsed(start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Node [{}] executor threw {}: {}", context.getNodeId(), cause.getClass().getSimpleName(), cause.getMessage());
            return NodeRunResult.failed(ErrorType.RUNTIME, describe(cause), cause, elapsed(start));
        }

        if (outputs == null) {
            outputs = Map.of();
        }
        List<String> undeclared = outputs.keySet().stream()
                .filter(port -> descriptor.findOutput(port).isEmpty())
                .collect(Collectors.toList());
        if (!undeclared.isEmpty()) {
            return NodeRunResult.failed(ErrorType.MALFORMED_OUTPUT,
                    "Executor returned undeclared output ports " + undeclared, null, elapsed(start));
        }
        return NodeRunResult.succeeded(Collections.unmodifiableMap(new LinkedHashMap<>(outputs)), elapsed(start));
    }

    public void shutdown() {
        runnerPool.shutdownNow();
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }

    private static ExecutorService newDaemonPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "nodeflow-runner-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
