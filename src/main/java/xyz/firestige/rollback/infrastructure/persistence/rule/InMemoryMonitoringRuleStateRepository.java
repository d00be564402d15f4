package xyz.firestige.rollback.infrastructure.persistence.rule;

import xyz.firestige.rollback.domain.health.MonitoringRuleStateRepository;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 规则触发状态内存实现（重启后丢失）
 */
public class InMemoryMonitoringRuleStateRepository implements MonitoringRuleStateRepository {

    private final Map<String, LocalDateTime> lastFired = new ConcurrentHashMap<>();

    @Override
    public Optional<LocalDateTime> findLastFiredAt(String ruleId) {
        return Optional.ofNullable(lastFired.get(ruleId));
    }

    @Override
    public void saveLastFiredAt(String ruleId, LocalDateTime lastFiredAt) {
        lastFired.put(ruleId, lastFiredAt);
    }

    @Override
    public Map<String, LocalDateTime> findAll() {
        return Map.copyOf(lastFired);
    }
}
