package xyz.firestige.rollback.domain.health.condition;

/**
 * 规则条件（结构化，由解释器求值）
 */
public interface RuleCondition {

    boolean evaluate(MetricQuery query);

    /**
     * 可读描述，用于日志和告警
     */
    String describe();
}
