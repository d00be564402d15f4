package xyz.firestige.rollback.domain.health.condition;

import java.util.Objects;

/**
 * 阈值条件：function(args) comparison threshold
 * <p>
 * 例：failure_count(backend, 5) >= 3
 */
public final class ThresholdCondition implements RuleCondition {

    private final ConditionFunction function;
    private final ConditionArguments arguments;
    private final Comparison comparison;
    private final double threshold;

    public ThresholdCondition(ConditionFunction function, ConditionArguments arguments,
                              Comparison comparison, double threshold) {
        this.function = Objects.requireNonNull(function, "function cannot be null");
        this.arguments = Objects.requireNonNull(arguments, "arguments cannot be null");
        this.comparison = Objects.requireNonNull(comparison, "comparison cannot be null");
        this.threshold = threshold;
        function.validate(arguments);
    }

    public static ThresholdCondition failureCount(String service, int window, Comparison comparison, double threshold) {
        return new ThresholdCondition(ConditionFunction.FAILURE_COUNT,
                ConditionArguments.forService(service, window), comparison, threshold);
    }

    @Override
    public boolean evaluate(MetricQuery query) {
        double value = function.apply(query, arguments);
        if (Double.isNaN(value)) {
            return false;
        }
        return comparison.test(value, threshold);
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder(function.getCode()).append('(');
        if (arguments.service() != null) {
            sb.append(arguments.service()).append(", ");
        } else if (!arguments.services().isEmpty()) {
            sb.append(arguments.services()).append(", ");
        }
        if (arguments.checkType() != null) {
            sb.append(arguments.checkType().getCode()).append(", ");
        }
        sb.append(arguments.window()).append(") ").append(comparison.getSymbol()).append(' ');
        sb.append(threshold == Math.rint(threshold) ? String.valueOf((long) threshold) : String.valueOf(threshold));
        return sb.toString();
    }

    public ConditionFunction getFunction() {
        return function;
    }

    public ConditionArguments getArguments() {
        return arguments;
    }

    public Comparison getComparison() {
        return comparison;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public String toString() {
        return describe();
    }
}
