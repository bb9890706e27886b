package cn.hjw.dev.nodeflow.listener;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public final class ExecutionListeners {

    private ExecutionListeners() {
    }

    /**
     * 依次通知所有监听器; 监听器抛出的异常只记录日志，不影响执行
     */
    public static void fire(List<ExecutionListener> listeners, ExecutionEvent event) {
        for (ExecutionListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Execution listener {} failed on {}", listener, event, e);
            }
        }
    }
}
