package cn.hjw.dev.nodeflow.component;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 输出端口
 */
@Getter
@ToString
@RequiredArgsConstructor(staticName = "of")
public class OutputPort {
    @NonNull
    private final String id;
    @NonNull
    private final String dataType;
}
