package xyz.firestige.rollback.infrastructure.health;

import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.MonitoringRule;
import xyz.firestige.rollback.domain.health.RuleAction;
import xyz.firestige.rollback.domain.health.condition.Comparison;
import xyz.firestige.rollback.domain.health.condition.CompositeCondition;
import xyz.firestige.rollback.domain.health.condition.ConditionArguments;
import xyz.firestige.rollback.domain.health.condition.ConditionFunction;
import xyz.firestige.rollback.domain.health.condition.ThresholdCondition;

import java.util.List;

/**
 * 未配置规则时使用的内置规则
 */
public final class DefaultMonitoringRules {

    public static final String CRITICAL_FAILURE_ROLLBACK = "critical_failure_rollback";
    public static final String MULTIPLE_SERVICE_DEGRADATION = "multiple_service_degradation";
    public static final String SYSTEM_RESOURCE_ALERT = "system_resource_alert";

    private DefaultMonitoringRules() {
    }

    public static List<MonitoringRule> create() {
        MonitoringRule criticalFailure = new MonitoringRule(
                CRITICAL_FAILURE_ROLLBACK, "关键服务连续失败",
                CompositeCondition.anyOf(
                        ThresholdCondition.failureCount("backend", 5, Comparison.GTE, 3),
                        ThresholdCondition.failureCount("frontend", 5, Comparison.GTE, 3)),
                RuleAction.ROLLBACK, 1, 30, true, 0, List.of("backend", "frontend"));

        // 每个服务只看最近一次样本
        MonitoringRule degradation = new MonitoringRule(
                MULTIPLE_SERVICE_DEGRADATION, "多个服务同时降级",
                new ThresholdCondition(ConditionFunction.FAILING_SERVICES,
                        new ConditionArguments(null, null, 1, List.of()), Comparison.GTE, 2),
                RuleAction.ROLLBACK, 1, 20, true, 1, List.of());

        MonitoringRule resource = new MonitoringRule(
                SYSTEM_RESOURCE_ALERT, "系统资源使用率过高",
                new ThresholdCondition(ConditionFunction.LATEST_VALUE,
                        new ConditionArguments("system", CheckType.SYSTEM_RESOURCE, 1, List.of()), Comparison.GT, 90),
                RuleAction.ALERT, 2, 15, true, 2, List.of("system"));

        return List.of(criticalFailure, degradation, resource);
    }
}
