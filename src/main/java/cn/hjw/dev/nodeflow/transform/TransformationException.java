package cn.hjw.dev.nodeflow.transform;

import lombok.Getter;

/**
 * 类型转换失败
 */
@Getter
public class TransformationException extends Exception {

    private final String transformerId;

    public TransformationException(String transformerId, String message, Throwable cause) {
        super(message, cause);
        this.transformerId = transformerId;
    }
}
