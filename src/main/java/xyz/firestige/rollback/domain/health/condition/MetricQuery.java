package xyz.firestige.rollback.domain.health.condition;

import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckResult;
import xyz.firestige.rollback.domain.health.HealthStatus;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * 规则条件可读取的指标视图
 * <p>
 * 实现必须是一致的快照：一次规则评估期间不会看到新写入的样本
 */
public interface MetricQuery {

    /**
     * service 最近 windowSize 个样本中非 healthy 的数量
     */
    int getFailureCount(String service, int windowSize);

    /**
     * service 最近一次指定类型检查的数值；checkType 为 null 时取任意类型
     */
    OptionalDouble getLatestValue(String service, CheckType checkType);

    /**
     * service 最近一次检查的状态
     */
    Optional<HealthStatus> getLatestStatus(String service);

    /**
     * service 最近的 n 个样本（时间正序）
     */
    List<HealthCheckResult> getRecentResults(String service, int n);

    /**
     * 有样本的服务集合
     */
    Set<String> getServices();
}
