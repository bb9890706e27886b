package cn.hjw.dev.nodeflow.transform;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 成对的类型转换器: fromType -> toType
 * 对编排器来说是纯函数，转换器内部的副作用由作者自行负责
 */
@Getter
@Builder
@ToString(of = {"id", "fromType", "toType", "cost", "lossy"})
public class Transformer {

    @NonNull
    private final String id;

    private final String name;

    @NonNull
    private final String fromType;

    @NonNull
    private final String toType;

    @Builder.Default
    private final double cost = 1;

    // 是否丢失信息 (如精度)
    private final boolean lossy;

    // 是否可能较慢 (例如需要远程调用)
    private final boolean asynchronous;

    @NonNull
    private final TransformFunction function;

    /**
     * 执行转换，任何异常统一包装为 {@link TransformationException}
     */
    public Object apply(Object value) throws TransformationException {
        try {
            return function.apply(value);
        } catch (TransformationException e) {
            throw e;
        } catch (Exception e) {
            throw new TransformationException(id,
                    "Transformer [" + id + "] failed converting " + fromType + " -> " + toType + ": " + e.getMessage(), e);
        }
    }
}
