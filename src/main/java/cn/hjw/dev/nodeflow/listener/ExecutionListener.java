package cn.hjw.dev.nodeflow.listener;

/**
 * 执行事件监听器
 * 在驱动节点的调度线程上同步回调，实现应尽快返回
 */
@FunctionalInterface
public interface ExecutionListener {

    /**
     * @param event 生命周期事件
     */
    void onEvent(ExecutionEvent event);
}
