package xyz.firestige.rollback.domain.health;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 一次探测的结果（创建后只读）
 *
 * @param value 与检查类型相关的数值：http 为延迟毫秒，system_resource 为百分比，custom 为脚本输出
 */
public record HealthCheckResult(
        String checkId,
        String service,
        CheckType checkType,
        HealthStatus status,
        double value,
        LocalDateTime timestamp,
        String message) {

    public HealthCheckResult {
        Objects.requireNonNull(checkId, "checkId cannot be null");
        Objects.requireNonNull(service, "service cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }

    public static HealthCheckResult of(HealthCheckDefinition check, HealthStatus status, double value,
                                       LocalDateTime timestamp, String message) {
        return new HealthCheckResult(check.getCheckId(), check.getService(), check.getType(),
                status, value, timestamp, message);
    }
}
