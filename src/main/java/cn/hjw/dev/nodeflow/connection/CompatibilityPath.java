package cn.hjw.dev.nodeflow.connection;

import cn.hjw.dev.nodeflow.transform.Transformer;
import lombok.Getter;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 两个类型之间的一条转换路径 (临时对象，不持久化)
 */
@Getter
public class CompatibilityPath {

    /**
     * 优选顺序：得分高者优先，其次跳数少，再次总成本低
     */
    public static final Comparator<CompatibilityPath> PREFERENCE = Comparator
            .comparingDouble(CompatibilityPath::score).reversed()
            .thenComparingInt(CompatibilityPath::getHopCount)
            .thenComparingDouble(CompatibilityPath::getTotalCost);

    private final List<ValidationStep> steps;

    private final double totalCost;

    public CompatibilityPath(List<ValidationStep> steps) {
        this.steps = List.copyOf(steps);
        this.totalCost = this.steps.stream()
                .mapToDouble(step -> step.getTransformer() == null ? 0 : step.getTransformer().getCost())
                .sum();
    }

    public static CompatibilityPath direct() {
        return new CompatibilityPath(List.of());
    }

    public int getHopCount() {
        return steps.size();
    }

    public long lossyStepCount() {
        return transformers().stream().filter(Transformer::isLossy).count();
    }

    public boolean isLossy() {
        return lossyStepCount() > 0;
    }

    public boolean hasAsynchronousStep() {
        return transformers().stream().anyMatch(Transformer::isAsynchronous);
    }

    public List<Transformer> transformers() {
        return steps.stream()
                .map(ValidationStep::getTransformer)
                .filter(t -> t != null)
                .collect(Collectors.toList());
    }

    /**
     * 0.4/(1+cost) + 0.4/(1+hops)，含有损步骤时减半
     */
    public double score() {
        double score = 0.4 / (1 + totalCost) + 0.4 / (1 + getHopCount());
        return isLossy() ? score * 0.5 : score;
    }

    /**
     * 零跳为 1.0; 否则 max(0.3, 1 - 0.2*hops)，每个有损步骤再减 0.3，最低为 0
     */
    public double confidence() {
        if (steps.isEmpty()) {
            return 1.0;
        }
        double confidence = Math.max(0.3, 1.0 - 0.2 * getHopCount()) - 0.3 * lossyStepCount();
        return Math.max(0, confidence);
    }

    /**
     * 例如 string -> object -> array
     */
    public String describe() {
        if (steps.isEmpty()) {
            return "(direct)";
        }
        return steps.stream().map(ValidationStep::getFromType).collect(Collectors.joining(" -> "))
                + " -> " + steps.get(steps.size() - 1).getToType();
    }

    @Override
    public String toString() {
        return describe() + " [cost=" + totalCost + "]";
    }
}
