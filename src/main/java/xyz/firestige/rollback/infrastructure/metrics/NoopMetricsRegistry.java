package xyz.firestige.rollback.infrastructure.metrics;

import java.time.Duration;

/**
 * 未接入 Micrometer 时的空实现
 */
public class NoopMetricsRegistry implements MetricsRegistry {
    @Override
    public void incrementCounter(String name) { }

    @Override
    public void setGauge(String name, double value) { }

    @Override
    public void recordDuration(String name, Duration duration) { }
}
