package xyz.firestige.rollback.infrastructure.metrics;

import java.time.Duration;

/**
 * 指标注册接口（与具体监控系统解耦）
 * <p>
 * 指标名统一使用 snake_case，例如 rollback_completed、rollback_step_duration
 */
public interface MetricsRegistry {

    void incrementCounter(String name);

    void setGauge(String name, double value);

    /**
     * 记录一次耗时（执行总耗时、单步耗时）
     */
    void recordDuration(String name, Duration duration);
}
