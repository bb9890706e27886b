package cn.hjw.dev.nodeflow.processor;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
public class RetryingNodeExecutorTest {

    private final NodeContext context = new NodeContext("flaky", "wf", "exec-test",
            LoggerFactory.getLogger("cn.hjw.dev.nodeflow.node.flaky"));

    /**
     * 前两次失败，第三次成功
     */
    @Test
    public void testRetryUntilSuccess() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        NodeExecutor flaky = (inputs, config, ctx) -> {
            if (attempts.incrementAndGet() < 3) {
                throw new RuntimeException("Network Error");
            }
            return Map.of("out", "ok");
        };

        Map<String, Object> outputs = new RetryingNodeExecutor(flaky, 3, 10).execute(Map.of(), Map.of(), context);

        Assertions.assertEquals("ok", outputs.get("out"));
        Assertions.assertEquals(3, attempts.get());
    }

    @Test
    public void testRetriesExhausted() {
        AtomicInteger attempts = new AtomicInteger();
        NodeExecutor broken = (inputs, config, ctx) -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("attempt " + attempts.get());
        };

        IllegalStateException ex = Assertions.assertThrows(IllegalStateException.class,
                () -> new RetryingNodeExecutor(broken, 2, 0).execute(Map.of(), Map.of(), context));

        Assertions.assertEquals(3, attempts.get());
        Assertions.assertEquals("attempt 3", ex.getMessage());
    }

    @Test
    public void testInterruptIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        NodeExecutor interrupted = (inputs, config, ctx) -> {
            attempts.incrementAndGet();
            throw new InterruptedException("cancelled");
        };

        Assertions.assertThrows(InterruptedException.class,
                () -> new RetryingNodeExecutor(interrupted, 5, 0).execute(Map.of(), Map.of(), context));
        Assertions.assertEquals(1, attempts.get());
        // 清除中断标记，避免影响后续测试
        Assertions.assertTrue(Thread.interrupted());
    }

    /**
     * maxRetries = 0 时只调用一次，异常原样抛出
     */
    @Test
    public void testZeroRetriesCallsOnce() {
        AtomicInteger attempts = new AtomicInteger();
        NodeExecutor broken = (inputs, config, ctx) -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("bad input");
        };

        IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
                () -> new RetryingNodeExecutor(broken, 0, 1000).execute(Map.of(), Map.of(), context));

        Assertions.assertEquals(1, attempts.get());
        Assertions.assertEquals("bad input", ex.getMessage());
    }

    @Test
    public void testNegativeSettingsRejected() {
        NodeExecutor noop = (inputs, config, ctx) -> Map.of();

        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetryingNodeExecutor(noop, -1, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetryingNodeExecutor(noop, 0, -5));
    }
}
