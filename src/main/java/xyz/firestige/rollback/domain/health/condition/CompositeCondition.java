package xyz.firestige.rollback.domain.health.condition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 组合条件：AND / OR
 */
public final class CompositeCondition implements RuleCondition {

    public enum Operator {
        AND, OR
    }

    private final Operator operator;
    private final List<RuleCondition> children;

    public CompositeCondition(Operator operator, List<RuleCondition> children) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("组合条件至少需要一个子条件");
        }
        this.operator = operator;
        this.children = List.copyOf(children);
    }

    public static CompositeCondition allOf(RuleCondition... conditions) {
        return new CompositeCondition(Operator.AND, List.of(conditions));
    }

    public static CompositeCondition anyOf(RuleCondition... conditions) {
        return new CompositeCondition(Operator.OR, List.of(conditions));
    }

    @Override
    public boolean evaluate(MetricQuery query) {
        if (operator == Operator.AND) {
            return children.stream().allMatch(c -> c.evaluate(query));
        }
        return children.stream().anyMatch(c -> c.evaluate(query));
    }

    @Override
    public String describe() {
        return children.stream()
                .map(RuleCondition::describe)
                .collect(Collectors.joining(" " + operator.name() + " ", "(", ")"));
    }

    public Operator getOperator() {
        return operator;
    }

    public List<RuleCondition> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return describe();
    }
}
