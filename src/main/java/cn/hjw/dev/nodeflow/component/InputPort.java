package cn.hjw.dev.nodeflow.component;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 输入端口
 */
@Getter
@Builder
@ToString
public class InputPort {
    @NonNull
    private final String id;
    @NonNull
    private final String dataType;
    private final boolean required;

    public static InputPort of(String id, String dataType) {
        return InputPort.builder().id(id).dataType(dataType).build();
    }

    public static InputPort required(String id, String dataType) {
        return InputPort.builder().id(id).dataType(dataType).required(true).build();
    }
}
