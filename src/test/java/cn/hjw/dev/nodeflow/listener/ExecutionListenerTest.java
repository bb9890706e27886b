package cn.hjw.dev.nodeflow.listener;

import cn.hjw.dev.nodeflow.component.InMemoryComponentDirectory;
import cn.hjw.dev.nodeflow.engine.ExecutionOrchestrator;
import cn.hjw.dev.nodeflow.exception.WorkflowValidationException;
import cn.hjw.dev.nodeflow.graph.WorkflowGraph;
import cn.hjw.dev.nodeflow.report.ExecutionReport;
import cn.hjw.dev.nodeflow.report.NodeStatus;
import cn.hjw.dev.nodeflow.support.TestComponents;
import cn.hjw.dev.nodeflow.type.BuiltinTypes;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 生命周期事件：执行开始 -> 各节点开始/结束 -> 执行结束
 */
@Slf4j
public class ExecutionListenerTest {

    private final List<String> events = new CopyOnWriteArrayList<>();

    private final List<ExecutionEvent> received = new CopyOnWriteArrayList<>();

    private final ExecutionListener recorder = event -> {
        received.add(event);
        events.add(event.getNodeId() == null ? event.getType().name() : event.getType() + ":" + event.getNodeId());
    };

    private ExecutionOrchestrator orchestrator;

    @BeforeEach
    public void setUp() {
        InMemoryComponentDirectory directory = new InMemoryComponentDirectory()
                .register(TestComponents.constant())
                .register(TestComponents.doubler())
                .register(TestComponents.failing("bad"))
                .register(TestComponents.passThrough("pass", BuiltinTypes.STRING));
        orchestrator = new ExecutionOrchestrator(directory, TestComponents.builtinValidator()).addListener(recorder);
    }

    @AfterEach
    public void tearDown() {
        orchestrator.close();
    }

    @Test
    public void testEventOrderForChain() {
        WorkflowGraph workflow = WorkflowGraph.builder()
                .node("n1", "const", Map.of("value", "42"))
                .node("n2", "double")
                .edge("n1", "out", "n2", "in")
                .build();

        ExecutionReport report = orchestrator.execute(workflow);
        log.info("事件序列: {}", events);

        Assertions.assertEquals(List.of(
                "EXECUTION_STARTED",
                "NODE_STARTED:n1",
                "NODE_COMPLETED:n1",
                "NODE_STARTED:n2",
                "NODE_COMPLETED:n2",
                "EXECUTION_COMPLETED"), events);

        ExecutionEvent n2Done = received.get(4);
        Assertions.assertEquals(NodeStatus.SUCCEEDED, n2Done.getRecord().getStatus());
        Assertions.assertEquals(84.0, n2Done.getRecord().output("result"));
        Assertions.assertEquals(NodeStatus.RUNNING, received.get(3).getRecord().getStatus());

        ExecutionEvent last = received.get(received.size() - 1);
        Assertions.assertEquals(report.getExecutionId(), last.getExecutionId());
        Assertions.assertEquals(report.getState(), last.getReport().getState());
    }

    /**
     * fail-fast：失败节点发 NODE_FAILED，下游发 NODE_SKIPPED，最后是 EXECUTION_FAILED
     */
    @Test
    public void testEventsOnFailure() {
        WorkflowGraph workflow = WorkflowGraph.builder()
                .node("A", "const", Map.of("value", "x"))
                .node("B", "bad")
                .node("C", "pass")
                .edge("A", "out", "B", "in")
                .edge("B", "out", "C", "in")
                .build();

        orchestrator.execute(workflow);

        Assertions.assertEquals(List.of(
                "EXECUTION_STARTED",
                "NODE_STARTED:A",
                "NODE_COMPLETED:A",
                "NODE_STARTED:B",
                "NODE_FAILED:B",
                "NODE_SKIPPED:C",
                "EXECUTION_FAILED"), events);
    }

    @Test
    public void testValidationFailureIsReported() {
        WorkflowGraph workflow = WorkflowGraph.builder().node("x", "mystery").build();

        Assertions.assertThrows(WorkflowValidationException.class, () -> orchestrator.execute(workflow));

        Assertions.assertEquals(List.of("EXECUTION_FAILED"), events);
        Assertions.assertTrue(received.get(0).getReport().getPerNode().isEmpty());
    }

    /**
     * 监听器抛出异常不影响执行; 移除后不再收到事件
     */
    @Test
    public void testFaultyListenerAndRemoval() {
        ExecutionListener faulty = event -> {
            throw new IllegalStateException("listener bug");
        };
        orchestrator.addListener(faulty);
        WorkflowGraph workflow = WorkflowGraph.builder().node("n", "const", Map.of("value", "v")).build();

        ExecutionReport report = orchestrator.execute(workflow);
        Assertions.assertTrue(report.isSuccess());
        Assertions.assertEquals(4, events.size());

        Assertions.assertTrue(orchestrator.removeListener(recorder));
        orchestrator.execute(workflow);
        Assertions.assertEquals(4, events.size());
    }
}
