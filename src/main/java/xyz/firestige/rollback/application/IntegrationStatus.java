package xyz.firestige.rollback.application;

import java.time.LocalDateTime;

/**
 * 对外暴露的集成状态
 *
 * @param healthStatus   最近一次报告的整体状态（还没有报告时为 unknown）
 * @param lastReportTime 最近一次报告时间，可能为 null
 */
public record IntegrationStatus(
        boolean integrationRunning,
        String deploymentId,
        String environment,
        String healthStatus,
        int activeRollbacks,
        long totalRollbacks,
        boolean autoRollbackEnabled,
        LocalDateTime lastReportTime) {
}
