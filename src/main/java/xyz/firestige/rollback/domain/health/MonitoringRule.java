package xyz.firestige.rollback.domain.health;

import xyz.firestige.rollback.domain.health.condition.RuleCondition;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 监控规则：condition → action
 * <p>
 * 不变式：上次触发后 cooldownMinutes 内不会再次触发。
 * 冷却判断与 lastFiredAt 更新在同一把锁内完成，重入评估不会重复触发。
 */
public class MonitoringRule {

    /**
     * 评估顺序：priority 升序，相同 priority 按声明顺序
     */
    public static final Comparator<MonitoringRule> EVALUATION_ORDER =
            Comparator.comparingInt(MonitoringRule::getPriority)
                    .thenComparingInt(MonitoringRule::getDeclarationOrder);

    private final String ruleId;
    private final String name;
    private final RuleCondition condition;
    private final RuleAction action;
    private final int priority;
    private final int cooldownMinutes;
    private final boolean enabled;
    private final int declarationOrder;

    /**
     * 动作涉及的服务（preserve_logs 的日志范围、告警上下文）
     */
    private final List<String> services;

    private LocalDateTime lastFiredAt;

    public MonitoringRule(String ruleId, String name, RuleCondition condition, RuleAction action,
                          int priority, int cooldownMinutes, boolean enabled, int declarationOrder,
                          List<String> services) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId cannot be null");
        this.name = name != null ? name : ruleId;
        this.condition = Objects.requireNonNull(condition, "condition cannot be null");
        this.action = Objects.requireNonNull(action, "action cannot be null");
        if (cooldownMinutes < 0) {
            throw new IllegalArgumentException("cooldownMinutes 不能为负数: " + cooldownMinutes);
        }
        this.priority = priority;
        this.cooldownMinutes = cooldownMinutes;
        this.enabled = enabled;
        this.declarationOrder = declarationOrder;
        this.services = services == null ? List.of() : List.copyOf(services);
    }

    /**
     * 原子地判断冷却并记录触发时间
     *
     * @return true 表示本次允许触发（lastFiredAt 已更新为 now）
     */
    public synchronized boolean tryFire(LocalDateTime now) {
        if (isInCooldown(now)) {
            return false;
        }
        this.lastFiredAt = now;
        return true;
    }

    /**
     * 当前是否处于冷却期
     */
    public synchronized boolean isInCooldown(LocalDateTime now) {
        if (lastFiredAt == null) {
            return false;
        }
        return Duration.between(lastFiredAt, now).compareTo(Duration.ofMinutes(cooldownMinutes)) < 0;
    }

    /**
     * 启动时从持久化状态恢复
     */
    public synchronized void restoreLastFiredAt(LocalDateTime lastFiredAt) {
        this.lastFiredAt = lastFiredAt;
    }

    public synchronized LocalDateTime getLastFiredAt() {
        return lastFiredAt;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getName() {
        return name;
    }

    public RuleCondition getCondition() {
        return condition;
    }

    public RuleAction getAction() {
        return action;
    }

    public int getPriority() {
        return priority;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getDeclarationOrder() {
        return declarationOrder;
    }

    public List<String> getServices() {
        return services;
    }

    @Override
    public String toString() {
        return "MonitoringRule{" +
                "ruleId='" + ruleId + '\'' +
                ", condition=" + condition.describe() +
                ", action=" + action +
                ", priority=" + priority +
                ", cooldownMinutes=" + cooldownMinutes +
                '}';
    }
}
