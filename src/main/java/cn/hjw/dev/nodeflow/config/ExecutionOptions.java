package cn.hjw.dev.nodeflow.config;

import lombok.Builder;
import lombok.Getter;

/**
 * 单次执行的选项
 */
@Getter
@Builder
public class ExecutionOptions {

    // --- 失败策略 ---
    // true: 任一节点失败后停止调度; false: 继续执行独立分支，只跳过失败节点的下游
    @Builder.Default
    private boolean failFast = true;

    // --- 超时配置 (毫秒) ---
    // 工作流整体超时，为空时使用编排器默认值 (可能无限制)
    private Long timeoutMs;

    // 单节点超时，为空时使用编排器默认值; 组件自带超时优先
    private Long nodeTimeoutMs;

    // 工作流ID，为空时使用图的ID
    private String workflowId;

    public static ExecutionOptions defaults() {
        return ExecutionOptions.builder().build();
    }

    public static ExecutionOptions bestEffort() {
        return ExecutionOptions.builder().failFast(false).build();
    }
}
