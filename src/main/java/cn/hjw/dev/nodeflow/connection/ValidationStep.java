package cn.hjw.dev.nodeflow.connection;

import cn.hjw.dev.nodeflow.transform.Transformer;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 转换路径上的一跳
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ValidationStep {
    private final String fromType;
    private final String toType;
    private final Transformer transformer;
}
