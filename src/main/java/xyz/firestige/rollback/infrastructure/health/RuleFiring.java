package xyz.firestige.rollback.infrastructure.health;

import xyz.firestige.rollback.domain.health.HealthReport;
import xyz.firestige.rollback.domain.health.MonitoringRule;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;

import java.time.LocalDateTime;

/**
 * 一次规则触发的上下文
 *
 * @param report 触发时刻的健康报告
 */
public record RuleFiring(MonitoringRule rule, DeploymentId deploymentId, HealthReport report, LocalDateTime firedAt) {
}
