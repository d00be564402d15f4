package xyz.firestige.rollback.infrastructure.health;

import xyz.firestige.rollback.config.properties.HealthMonitorProperties.ConditionDefinition;
import xyz.firestige.rollback.config.properties.HealthMonitorProperties.RuleDefinition;
import xyz.firestige.rollback.domain.health.MonitoringRule;
import xyz.firestige.rollback.domain.health.condition.Comparison;
import xyz.firestige.rollback.domain.health.condition.CompositeCondition;
import xyz.firestige.rollback.domain.health.condition.ConditionArguments;
import xyz.firestige.rollback.domain.health.condition.ConditionFunction;
import xyz.firestige.rollback.domain.health.condition.RuleCondition;
import xyz.firestige.rollback.domain.health.condition.ThresholdCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * 把配置中的结构化条件翻译成 {@link RuleCondition}
 * <p>
 * 配置错误（未注册的函数、缺少参数、未知运算符）在启动时抛出 IllegalStateException
 */
public final class RuleConditionFactory {

    private RuleConditionFactory() {
    }

    public static List<MonitoringRule> createRules(List<RuleDefinition> definitions) {
        List<MonitoringRule> rules = new ArrayList<>();
        for (int i = 0; i < definitions.size(); i++) {
            RuleDefinition def = definitions.get(i);
            RuleCondition condition;
            try {
                condition = createCondition(def.getCondition());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(String.format(
                        "监控规则 %s 的条件配置无效: %s", def.getRuleId(), e.getMessage()), e);
            }
            rules.add(new MonitoringRule(def.getRuleId(), def.getName(), condition, def.getAction(),
                    def.getPriority(), def.getCooldownMinutes(), def.isEnabled(), i, def.getServices()));
        }
        return rules;
    }

    public static RuleCondition createCondition(ConditionDefinition def) {
        if (def == null) {
            throw new IllegalArgumentException("缺少条件定义");
        }
        String type = def.getType() == null ? "threshold" : def.getType().toLowerCase();
        switch (type) {
            case "threshold":
                return createThreshold(def);
            case "all":
            case "and":
                return new CompositeCondition(CompositeCondition.Operator.AND, createChildren(def));
            case "any":
            case "or":
                return new CompositeCondition(CompositeCondition.Operator.OR, createChildren(def));
            default:
                throw new IllegalArgumentException("未知的条件类型: " + def.getType());
        }
    }

    private static RuleCondition createThreshold(ConditionDefinition def) {
        if (def.getFunction() == null) {
            throw new IllegalArgumentException("阈值条件缺少 function");
        }
        if (def.getThreshold() == null) {
            throw new IllegalArgumentException("阈值条件缺少 threshold");
        }
        ConditionFunction function = ConditionFunction.fromCode(def.getFunction());
        ConditionArguments arguments = new ConditionArguments(
                def.getService(), def.getCheckType(), def.getWindow(), def.getServices());
        return new ThresholdCondition(function, arguments, Comparison.parse(def.getOperator()), def.getThreshold());
    }

    private static List<RuleCondition> createChildren(ConditionDefinition def) {
        List<RuleCondition> children = new ArrayList<>();
        for (ConditionDefinition child : def.getConditions()) {
            children.add(createCondition(child));
        }
        return children;
    }
}
