package cn.hjw.dev.nodeflow.config;

import cn.hjw.dev.nodeflow.connection.ConnectionValidator;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * 编排器配置
 */
@Getter
@Builder
public class OrchestratorConfig {

    // 调度线程池，为空时由编排器创建
    private ExecutorService workerPool;

    // 节点执行线程池，为空时由运行器创建
    private ExecutorService runnerPool;

    @Builder.Default
    private long defaultNodeTimeoutMs = 30_000L;

    // 为空表示不限制
    private Long defaultWorkflowTimeoutMs;

    // --- 连接校验 (编排器自行构建校验器时使用) ---
    @Builder.Default
    private Duration connectionCacheTtl = ConnectionValidator.DEFAULT_CACHE_TTL;

    @Builder.Default
    private int maxTransformHops = ConnectionValidator.DEFAULT_MAX_HOPS;

    public static OrchestratorConfig defaults() {
        return OrchestratorConfig.builder().build();
    }
}
