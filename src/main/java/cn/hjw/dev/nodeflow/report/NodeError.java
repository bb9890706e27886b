package cn.hjw.dev.nodeflow.report;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 节点错误诊断
 */
@Getter
@RequiredArgsConstructor
public class NodeError {

    private final ErrorType type;

    private final String message;

    private final Throwable cause;

    public static NodeError of(ErrorType type, String message) {
        return new NodeError(type, message, null);
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
