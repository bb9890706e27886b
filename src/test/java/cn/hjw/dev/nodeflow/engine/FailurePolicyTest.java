package cn.hjw.dev.nodeflow.engine;

import cn.hjw.dev.nodeflow.component.InMemoryComponentDirectory;
import cn.hjw.dev.nodeflow.config.ExecutionOptions;
import cn.hjw.dev.nodeflow.config.OrchestratorConfig;
import cn.hjw.dev.nodeflow.graph.WorkflowGraph;
import cn.hjw.dev.nodeflow.report.ErrorType;
import cn.hjw.dev.nodeflow.report.ExecutionReport;
import cn.hjw.dev.nodeflow.report.ExecutionState;
import cn.hjw.dev.nodeflow.report.NodeStatus;
import cn.hjw.dev.nodeflow.report.TerminationReason;
import cn.hjw.dev.nodeflow.support.TestComponents;
import cn.hjw.dev.nodeflow.type.BuiltinTypes;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 失败策略：fail-fast 与 best-effort、级联跳过、连线与输入问题
 */
@Slf4j
public class FailurePolicyTest {

    private final AtomicInteger counted = new AtomicInteger();

    private InMemoryComponentDirectory directory;

    private ExecutionOrchestrator orchestrator;

    @BeforeEach
    public void setUp() {
        directory = new InMemoryComponentDirectory()
                .register(TestComponents.constant())
                .register(TestComponents.doubler())
                .register(TestComponents.failing("bad"))
                .register(TestComponents.passThrough("pass", BuiltinTypes.STRING))
                .register(TestComponents.passThrough("addr", BuiltinTypes.ADDRESS))
                .register(TestComponents.counting("count", counted));
        orchestrator = new ExecutionOrchestrator(directory, TestComponents.builtinValidator());
    }

    @AfterEach
    public void tearDown() {
        orchestrator.close();
    }

    /**
     * A -> B -> C，B 抛出异常：A 成功，B 失败，C 被跳过
     */
    @Test
    public void testFailFastSkipsDownstream() {
        WorkflowGraph workflow = WorkflowGraph.builder()
                .node("A", "const", Map.of("value", "hello"))
                .node("B", "bad")
                .node("C", "pass")
                .edge("A", "out", "B", "in")
                .edge("B", "out", "C", "in")
                .build();

        ExecutionReport report = orchestrator.execute(workflow);
        log.info("fail-fast 报告: {} errors={}", report, report.getErrors());

        Assertions.assertEquals(NodeStatus.SUCCEEDED, report.statusOf("A"));
        Assertions.assertEquals(NodeStatus.FAILED, report.statusOf("B"));
        Assertions.assertEquals(ErrorType.RUNTIME, report.record("B").orElseThrow().getError().getType());
        Assertions.assertEquals(NodeStatus.SKIPPED, report.statusOf("C"));
        Assertions.assertEquals(ErrorType.UPSTREAM_FAILED, report.record("C").orElseThrow().getError().getType());

        Assertions.assertEquals(ExecutionState.FAILED, report.getState());
        Assertions.assertEquals(TerminationReason.NODE_FAILURE, report.getReason());
        Assertions.assertFalse(report.isSuccess());
    }

    /**
     * best-effort 下，与失败分支无关的 D 照常成功
     */
    @Test
    public void testBestEffortRunsIndependentBranch() {
        WorkflowGraph workflow = WorkflowGraph.builder()
                .node("A", "const", Map.of("value", "hello"))
                .node("B", "bad")
                .node("C", "pass")
                .node("D", "const", Map.of("value", "independent"))
                .edge("A", "out", "B", "in")
                .edge("B", "out", "C", "in")
                .build();

        ExecutionReport report = orchestrator.execute(workflow, Map.of(), ExecutionOptions.bestEffort());

        Assertions.assertEquals(NodeStatus.SUCCEEDED, report.statusOf("A"));
        Assertions.assertEquals(NodeStatus.FAILED, report.statusOf("B"));
        Assertions.assertEquals(NodeStatus.SKIPPED, report.statusOf("C"));
        Assertions.assertEquals(NodeStatus.SUCCEEDED, report.statusOf("D"));
        Assertions.assertEquals("independent", report.record("D").orElseThrow().output("out"));
        Assertions.assertEquals(ExecutionState.FAILED, report.getState());
    }

    /**
     * 单线程调度：失败节点之后才轮到的独立节点在 fail-fast 下不再执行
     */
    @Test
    public void testFailFastAbortsNodesNotYetStarted() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try (ExecutionOrchestrator serial = new ExecutionOrchestrator(directory, TestComponents.builtinValidator(),
                OrchestratorConfig.builder().workerPool(single).build())) {
            WorkflowGraph workflow = WorkflowGraph.builder()
                    .node("X", "bad")
                    .node("Y", "count")
                    .build();

            ExecutionReport report = serial.execute(workflow);

            Assertions.assertEquals(NodeStatus.FAILED, report.statusOf("X"));
            Assertions.assertEquals(NodeStatus.SKIPPED, report.statusOf("Y"));
            Assertions.assertEquals(ErrorType.ABORTED, report.record("Y").orElseThrow().getError().getType());
            Assertions.assertEquals(0, counted.get());
        } finally {
            single.shutdownNow();
        }
    }

    /**
     * number -> address 无转换路径：目标节点跳过，不触发 fail-fast
     */
    @Test
    public void testIncompatibleConnectionSkipsNode() {
        WorkflowGraph workflow = WorkflowGraph.builder()
                .node("c", "const", Map.of("value", "3"))
                .node("d", "double")
                .node("a", "addr")
                .node("other", "count")
                .edge("c", "out", "d", "in")
                .edge("d", "result", "a", "in")
                .build();

        ExecutionReport report = orchestrator.execute(workflow);
        log.info("连线错误: {}", report.getErrors());

        Assertions.assertEquals(NodeStatus.SUCCEEDED, report.statusOf("d"));
        Assertions.assertEquals(NodeStatus.SKIPPED, report.statusOf("a"));
        Assertions.assertEquals(ErrorType.CONNECTION, report.record("a").orElseThrow().getError().getType());
        Assertions.assertEquals(NodeStatus.SUCCEEDED, report.statusOf("other"));
        Assertions.assertEquals(ExecutionState.COMPLETED, report.getState());
        Assertions.assertFalse(report.isSuccess());
    }

    @Test
    public void testMissingRequiredInputSkipsNode() {
        WorkflowGraph workflow = WorkflowGraph.builder()
                .node("d", "double")
                .build();

        ExecutionReport report = orchestrator.execute(workflow);

        Assertions.assertEquals(NodeStatus.SKIPPED, report.statusOf("d"));
        Assertions.assertEquals(ErrorType.MISSING_INPUT, report.record("d").orElseThrow().getError().getType());
        Assertions.assertFalse(report.isSuccess());
    }

    /**
     * 顶层输入: "nodeId.portId" 优先于 "portId"
     */
    @Test
    public void testWorkflowInputsBindUnconnectedPorts() {
        WorkflowGraph workflow = WorkflowGraph.builder()
                .node("d1", "double")
                .node("d2", "double")
                .build();

        ExecutionReport report = orchestrator.execute(workflow, Map.of("in", 1.0, "d2.in", 5.0), ExecutionOptions.defaults());

        Assertions.assertTrue(report.isSuccess());
        Assertions.assertEquals(2.0, report.record("d1").orElseThrow().output("result"));
        Assertions.assertEquals(10.0, report.record("d2").orElseThrow().output("result"));
    }

    /**
     * "abc" 无法转换为数字：目标节点以 TRANSFORMATION 失败
     */
    @Test
    public void testTransformerFailureFailsNode() {
        WorkflowGraph workflow = WorkflowGraph.builder()
                .node("c", "const", Map.of("value", "abc"))
                .node("d", "double")
                .edge("c", "out", "d", "in")
                .build();

        ExecutionReport report = orchestrator.execute(workflow);

        Assertions.assertEquals(NodeStatus.FAILED, report.statusOf("d"));
        Assertions.assertEquals(ErrorType.TRANSFORMATION, report.record("d").orElseThrow().getError().getType());
        Assertions.assertEquals(ExecutionState.FAILED, report.getState());
        Assertions.assertEquals(1, report.count(NodeStatus.SUCCEEDED));
    }
}
