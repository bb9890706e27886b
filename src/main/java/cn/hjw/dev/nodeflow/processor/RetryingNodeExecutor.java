package cn.hjw.dev.nodeflow.processor;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 重试装饰器
 * 运行器本身从不重试; 需要重试的组件在注册时自行包装执行器
 */
@Slf4j
public class RetryingNodeExecutor implements NodeExecutor {

    private final NodeExecutor delegate;
    private final int maxRetries;
    private final long retryBackoffMillis;

    public RetryingNodeExecutor(NodeExecutor delegate, int maxRetries, long retryBackoffMillis) {
        if (maxRetries < 0 || retryBackoffMillis < 0) {
            throw new IllegalArgumentException("maxRetries and retryBackoffMillis must not be negative");
        }
        this.delegate = delegate;
        this.maxRetries = maxRetries;
        this.retryBackoffMillis = retryBackoffMillis;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs, Map<String, Object> config, NodeContext context) throws Exception {
        int attempts = maxRetries + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return delegate.execute(inputs, config, context);
            } catch (InterruptedException e) {
                // 取消与超时优先于重试
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                if (attempt >= attempts) {
                    log.error("Node [{}] gave up after {} attempt(s): {}", context.getNodeId(), attempt, e.toString());
                    throw e;
                }
                log.warn("Node [{}] attempt {}/{} threw {}, next try in {} ms",
                        context.getNodeId(), attempt, attempts, e.toString(), retryBackoffMillis);
                pause();
            }
        }
    }

    private void pause() throws InterruptedException {
        if (retryBackoffMillis > 0) {
            TimeUnit.MILLISECONDS.sleep(retryBackoffMillis);
        }
    }
}
