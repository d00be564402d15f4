package xyz.firestige.rollback.domain.health;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * 规则触发状态仓储
 * <p>
 * lastFiredAt 必须跨重启保留，否则短暂重启窗口内规则会忘记冷却而重复触发回滚
 */
public interface MonitoringRuleStateRepository {

    Optional<LocalDateTime> findLastFiredAt(String ruleId);

    void saveLastFiredAt(String ruleId, LocalDateTime lastFiredAt);

    Map<String, LocalDateTime> findAll();
}
