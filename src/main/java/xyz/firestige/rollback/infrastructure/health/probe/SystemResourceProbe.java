package xyz.firestige.rollback.infrastructure.health.probe;

import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckDefinition;
import xyz.firestige.rollback.domain.health.HealthCheckResult;
import xyz.firestige.rollback.domain.health.HealthStatus;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * system_resource：使用率 ≥ critical 为 critical，≥ warning 为 warning
 * <p>
 * 未配置阈值时使用默认值：cpu 80/95，memory 80/95，disk 85/95
 */
public class SystemResourceProbe implements HealthProbe {

    static final Map<String, double[]> DEFAULT_THRESHOLDS = Map.of(
            "cpu", new double[]{80, 95},
            "memory", new double[]{80, 95},
            "disk", new double[]{85, 95});

    private final ResourceSampler sampler;
    private final Clock clock;

    public SystemResourceProbe(ResourceSampler sampler, Clock clock) {
        this.sampler = sampler;
        this.clock = clock;
    }

    @Override
    public CheckType getType() {
        return CheckType.SYSTEM_RESOURCE;
    }

    @Override
    public HealthCheckResult probe(HealthCheckDefinition check) {
        LocalDateTime now = LocalDateTime.now(clock);
        String resource = check.getResource() != null ? check.getResource().toLowerCase() : "";
        double value;
        try {
            value = sampler.sample(resource, check.getPath());
        } catch (Exception e) {
            return HealthCheckResult.of(check, HealthStatus.CRITICAL, -1, now, "资源采样失败: " + e.getMessage());
        }
        if (Double.isNaN(value)) {
            return HealthCheckResult.of(check, HealthStatus.UNKNOWN, -1, now, resource + " 暂无采样数据");
        }
        double[] defaults = DEFAULT_THRESHOLDS.getOrDefault(resource, new double[]{80, 95});
        double warning = check.getThresholdWarning() != null ? check.getThresholdWarning() : defaults[0];
        double critical = check.getThresholdCritical() != null ? check.getThresholdCritical() : defaults[1];

        String message = String.format("%s 使用率 %.1f%%", resource, value);
        if (value >= critical) {
            return HealthCheckResult.of(check, HealthStatus.CRITICAL, value, now, message);
        }
        if (value >= warning) {
            return HealthCheckResult.of(check, HealthStatus.WARNING, value, now, message);
        }
        return HealthCheckResult.of(check, HealthStatus.HEALTHY, value, now, message);
    }
}
