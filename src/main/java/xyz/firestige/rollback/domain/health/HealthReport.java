package xyz.firestige.rollback.domain.health;

import xyz.firestige.rollback.domain.shared.vo.DeploymentId;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 某一时刻跨服务的健康汇总
 *
 * @param services       service → 最近一次检查合成的状态
 * @param failedChecks   最近结果为 critical 的检查 id
 * @param warnings       最近结果为 warning 的检查 id
 * @param failureCounts  service → 保留窗口内的失败样本数
 */
public record HealthReport(
        DeploymentId deploymentId,
        HealthStatus overallStatus,
        Map<String, HealthStatus> services,
        List<String> failedChecks,
        List<String> warnings,
        Map<String, Integer> failureCounts,
        List<String> recommendations,
        LocalDateTime generatedAt) {

    public HealthReport {
        services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
        failedChecks = List.copyOf(failedChecks);
        warnings = List.copyOf(warnings);
        failureCounts = Collections.unmodifiableMap(new LinkedHashMap<>(failureCounts));
        recommendations = List.copyOf(recommendations);
    }

    public boolean isHealthy() {
        return overallStatus == HealthStatus.HEALTHY;
    }

    /**
     * 整体状态由服务状态合成：任一 critical 则 critical，否则任一 warning 则 warning，否则 healthy
     */
    public static HealthStatus deriveOverall(Map<String, HealthStatus> services) {
        boolean anyCritical = services.values().stream().anyMatch(s -> s == HealthStatus.CRITICAL);
        if (anyCritical) {
            return HealthStatus.CRITICAL;
        }
        boolean anyWarning = services.values().stream().anyMatch(s -> s == HealthStatus.WARNING);
        return anyWarning ? HealthStatus.WARNING : HealthStatus.HEALTHY;
    }
}
