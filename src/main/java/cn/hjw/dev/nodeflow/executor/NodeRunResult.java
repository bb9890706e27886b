package cn.hjw.dev.nodeflow.executor;

import cn.hjw.dev.nodeflow.report.ErrorType;
import cn.hjw.dev.nodeflow.report.NodeError;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * 单次节点调用的结果
 */
@Getter
@RequiredArgsConstructor
public class NodeRunResult {

    private final boolean success;

    private final Map<String, Object> outputs;

    private final NodeError error;

    private final long durationMs;

    static NodeRunResult succeeded(Map<String, Object> outputs, long durationMs) {
        return new NodeRunResult(true, outputs, null, durationMs);
    }

    static NodeRunResult failed(ErrorType type, String message, Throwable cause, long durationMs) {
        return new NodeRunResult(false, Map.of(), new NodeError(type, message, cause), durationMs);
    }
}
