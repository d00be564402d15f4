package xyz.firestige.rollback.domain.execution;

import xyz.firestige.rollback.domain.shared.vo.DeploymentId;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * 回滚触发器（不可变）
 * <p>
 * 每次回滚请求（人工或规则触发）创建一次，被唯一的一个 RollbackExecution 引用
 */
public record RollbackTrigger(
        String triggerId,
        TriggerReason reason,
        String triggeredBy,
        DeploymentId deploymentId,
        String message,
        LocalDateTime createdAt) {

    public static final String MANUAL_OPERATOR = "manual_operator";
    public static final String HEALTH_MONITOR = "health_monitor";

    public RollbackTrigger {
        Objects.requireNonNull(triggerId, "triggerId cannot be null");
        Objects.requireNonNull(reason, "reason cannot be null");
        Objects.requireNonNull(deploymentId, "deploymentId cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        if (triggeredBy == null || triggeredBy.isBlank()) {
            triggeredBy = "unknown";
        }
        if (message == null) {
            message = "";
        }
    }

    public static RollbackTrigger of(TriggerReason reason, String triggeredBy, DeploymentId deploymentId,
                                     String message, LocalDateTime createdAt) {
        return new RollbackTrigger(newTriggerId(), reason, triggeredBy, deploymentId, message, createdAt);
    }

    /**
     * 人工触发
     */
    public static RollbackTrigger manual(DeploymentId deploymentId, String message, LocalDateTime createdAt) {
        return of(TriggerReason.MANUAL, MANUAL_OPERATOR, deploymentId, message, createdAt);
    }

    /**
     * 健康监控规则触发
     */
    public static RollbackTrigger healthCheckFailure(DeploymentId deploymentId, String message, LocalDateTime createdAt) {
        return of(TriggerReason.HEALTH_CHECK_FAILURE, HEALTH_MONITOR, deploymentId, message, createdAt);
    }

    private static String newTriggerId() {
        return "trg-" + UUID.randomUUID();
    }
}
