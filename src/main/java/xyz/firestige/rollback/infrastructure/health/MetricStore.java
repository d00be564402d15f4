package xyz.firestige.rollback.infrastructure.health;

import xyz.firestige.rollback.domain.health.HealthCheckResult;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 滚动指标存储
 * <p>
 * 按 checkId 保存最近 retention 内的结果，只追加和淘汰。
 * 读取通过 snapshot() 复制出一份不可变视图，规则评估期间不受新写入影响。
 */
public class MetricStore {

    private final Map<String, Deque<HealthCheckResult>> results = new LinkedHashMap<>();
    private final Duration retention;
    private final Clock clock;
    private long sequence;

    public MetricStore(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    public synchronized void record(HealthCheckResult result) {
        results.computeIfAbsent(result.checkId(), k -> new ArrayDeque<>()).addLast(result);
        sequence++;
    }

    public synchronized void recordAll(List<HealthCheckResult> batch) {
        batch.forEach(this::record);
    }

    /**
     * 淘汰早于 now - retention 的结果
     *
     * @return 淘汰的条数
     */
    public synchronized int evictExpired() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(retention);
        int evicted = 0;
        for (Deque<HealthCheckResult> deque : results.values()) {
            while (!deque.isEmpty() && deque.peekFirst().timestamp().isBefore(cutoff)) {
                deque.removeFirst();
                evicted++;
            }
        }
        results.values().removeIf(Deque::isEmpty);
        return evicted;
    }

    public synchronized MetricSnapshot snapshot() {
        List<HealthCheckResult> all = new ArrayList<>();
        results.values().forEach(all::addAll);
        return new MetricSnapshot(all, sequence);
    }

    public synchronized int size() {
        return results.values().stream().mapToInt(Deque::size).sum();
    }

    public Duration getRetention() {
        return retention;
    }
}
