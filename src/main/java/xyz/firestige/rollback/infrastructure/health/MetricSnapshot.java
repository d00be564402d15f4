package xyz.firestige.rollback.infrastructure.health;

import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckResult;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.health.condition.MetricQuery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * 指标存储的不可变快照
 */
public class MetricSnapshot implements MetricQuery {

    private final Map<String, List<HealthCheckResult>> byService = new LinkedHashMap<>();
    private final Map<String, HealthCheckResult> latestByCheck = new LinkedHashMap<>();
    private final long version;

    MetricSnapshot(List<HealthCheckResult> results, long version) {
        this.version = version;
        List<HealthCheckResult> sorted = new ArrayList<>(results);
        // 稳定排序，同一时间戳保持写入顺序
        sorted.sort(Comparator.comparing(HealthCheckResult::timestamp));
        for (HealthCheckResult result : sorted) {
            byService.computeIfAbsent(result.service(), k -> new ArrayList<>()).add(result);
            latestByCheck.put(result.checkId(), result);
        }
    }

    @Override
    public int getFailureCount(String service, int windowSize) {
        return (int) getRecentResults(service, windowSize).stream()
                .filter(r -> r.status().isFailure())
                .count();
    }

    @Override
    public OptionalDouble getLatestValue(String service, CheckType checkType) {
        List<HealthCheckResult> samples = byService.getOrDefault(service, List.of());
        for (int i = samples.size() - 1; i >= 0; i--) {
            HealthCheckResult r = samples.get(i);
            if (checkType == null || r.checkType() == checkType) {
                return OptionalDouble.of(r.value());
            }
        }
        return OptionalDouble.empty();
    }

    @Override
    public Optional<HealthStatus> getLatestStatus(String service) {
        List<HealthCheckResult> samples = byService.getOrDefault(service, List.of());
        return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(samples.size() - 1).status());
    }

    @Override
    public List<HealthCheckResult> getRecentResults(String service, int n) {
        List<HealthCheckResult> samples = byService.getOrDefault(service, List.of());
        int from = Math.max(0, samples.size() - Math.max(n, 0));
        return Collections.unmodifiableList(samples.subList(from, samples.size()));
    }

    @Override
    public Set<String> getServices() {
        return Collections.unmodifiableSet(byService.keySet());
    }

    /**
     * 保留窗口内 service 的失败样本总数
     */
    public int getTotalFailures(String service) {
        return getFailureCount(service, Integer.MAX_VALUE);
    }

    /**
     * 每个检查最近一次的结果
     */
    public Map<String, HealthCheckResult> getLatestByCheck() {
        return Collections.unmodifiableMap(latestByCheck);
    }

    /**
     * service 的合成状态：该服务各检查最近一次结果中最严重的
     */
    public Optional<HealthStatus> getServiceStatus(String service) {
        return latestByCheck.values().stream()
                .filter(r -> r.service().equals(service))
                .map(HealthCheckResult::status)
                .reduce(HealthStatus::worse);
    }

    public long getVersion() {
        return version;
    }

    public boolean isEmpty() {
        return byService.isEmpty();
    }
}
