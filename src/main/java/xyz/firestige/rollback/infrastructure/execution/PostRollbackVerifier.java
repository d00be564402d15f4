package xyz.firestige.rollback.infrastructure.execution;

import xyz.firestige.rollback.domain.health.HealthReport;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;

/**
 * 回滚后健康校验（由健康监控提供新鲜的健康报告）
 */
@FunctionalInterface
public interface PostRollbackVerifier {

    HealthReport verify(DeploymentId deploymentId);
}
