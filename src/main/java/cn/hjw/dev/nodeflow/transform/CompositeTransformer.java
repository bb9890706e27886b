package cn.hjw.dev.nodeflow.transform;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 将多跳路径上的转换器组合为一个转换器
 */
public final class CompositeTransformer {

    private CompositeTransformer() {
    }

    /**
     * 组合转换链。单步直接返回该转换器; 任一步失败即短路
     */
    public static Transformer of(List<Transformer> chain) {
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("Cannot compose an empty transformer chain");
        }
        if (chain.size() == 1) {
            return chain.get(0);
        }
        List<Transformer> steps = List.copyOf(chain);
        String id = "composite:" + steps.stream().map(Transformer::getId).collect(Collectors.joining(">"));
        String route = steps.stream().map(Transformer::getFromType).collect(Collectors.joining(" -> "))
                + " -> " + steps.get(steps.size() - 1).getToType();

        return Transformer.builder()
                .id(id)
                .name("Composite " + route)
                .fromType(steps.get(0).getFromType())
                .toType(steps.get(steps.size() - 1).getToType())
                .cost(steps.stream().mapToDouble(Transformer::getCost).sum())
                .lossy(steps.stream().anyMatch(Transformer::isLossy))
                .asynchronous(steps.stream().anyMatch(Transformer::isAsynchronous))
                .function(value -> {
                    Object current = value;
                    for (int i = 0; i < steps.size(); i++) {
                        Transformer step = steps.get(i);
                        try {
                            current = step.apply(current);
                        } catch (TransformationException e) {
                            throw new TransformationException(id,
                                    "Step " + (i + 1) + "/" + steps.size() + " of " + route + " failed: " + e.getMessage(), e);
                        }
                    }
                    return current;
                })
                .build();
    }
}
