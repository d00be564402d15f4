package xyz.firestige.rollback.infrastructure.adapter;

import xyz.firestige.rollback.domain.health.HealthStatus;

/**
 * 适配器对单个目标的回滚后自检结果
 */
public record HealthSignal(String targetName, HealthStatus status, String message) {

    public static HealthSignal healthy(String targetName, String message) {
        return new HealthSignal(targetName, HealthStatus.HEALTHY, message);
    }

    public static HealthSignal critical(String targetName, String message) {
        return new HealthSignal(targetName, HealthStatus.CRITICAL, message);
    }

    public static HealthSignal unknown(String targetName, String message) {
        return new HealthSignal(targetName, HealthStatus.UNKNOWN, message);
    }
}
