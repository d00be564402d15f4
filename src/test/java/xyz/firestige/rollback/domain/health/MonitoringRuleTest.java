package xyz.firestige.rollback.domain.health;

import org.junit.jupiter.api.Test;
import xyz.firestige.rollback.domain.health.condition.Comparison;
import xyz.firestige.rollback.domain.health.condition.ThresholdCondition;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 监控规则冷却
 */
class MonitoringRuleTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 8, 5, 10, 0);

    private MonitoringRule rule(String id, int priority, int cooldown, int order) {
        return new MonitoringRule(id, id, ThresholdCondition.failureCount("backend", 5, Comparison.GTE, 3),
                RuleAction.ROLLBACK, priority, cooldown, true, order, List.of("backend"));
    }

    @Test
    void tryFire_respectsCooldown() {
        MonitoringRule rule = rule("critical", 1, 30, 0);

        assertThat(rule.tryFire(T0)).isTrue();
        assertThat(rule.tryFire(T0.plusMinutes(15))).isFalse();
        assertThat(rule.tryFire(T0.plusMinutes(31))).isTrue();
        assertThat(rule.getLastFiredAt()).isEqualTo(T0.plusMinutes(31));
    }

    @Test
    void zeroCooldown_firesEveryTime() {
        MonitoringRule rule = rule("noisy", 1, 0, 0);

        assertThat(rule.tryFire(T0)).isTrue();
        assertThat(rule.tryFire(T0)).isTrue();
    }

    @Test
    void restoredLastFiredAt_keepsCooldownAcrossRestart() {
        MonitoringRule rule = rule("critical", 1, 30, 0);
        rule.restoreLastFiredAt(T0);

        assertThat(rule.isInCooldown(T0.plusMinutes(10))).isTrue();
        assertThat(rule.tryFire(T0.plusMinutes(10))).isFalse();
    }

    @Test
    void negativeCooldown_isRejected() {
        assertThatThrownBy(() -> rule("bad", 1, -1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void evaluationOrder_priorityThenDeclaration() {
        List<MonitoringRule> rules = new ArrayList<>(List.of(
                rule("alert", 2, 15, 0),
                rule("second", 1, 20, 2),
                rule("first", 1, 30, 1)));

        rules.sort(MonitoringRule.EVALUATION_ORDER);

        assertThat(rules).extracting(MonitoringRule::getRuleId).containsExactly("first", "second", "alert");
    }
}
