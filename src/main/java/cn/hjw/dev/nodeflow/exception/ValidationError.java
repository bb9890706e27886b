package cn.hjw.dev.nodeflow.exception;

import lombok.Getter;

import java.util.List;

/**
 * 执行前的致命校验错误
 */
@Getter
public class ValidationError {

    private final ValidationErrorCode code;

    private final String message;

    // 涉及的节点
    private final List<String> nodeIds;

    public ValidationError(ValidationErrorCode code, String message, List<String> nodeIds) {
        this.code = code;
        this.message = message;
        this.nodeIds = List.copyOf(nodeIds);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
