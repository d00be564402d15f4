package xyz.firestige.rollback.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer 实现
 * <p>
 * 所有指标带 deployment 标签；Gauge 由本类持有最新值，避免被 MeterRegistry 的弱引用回收
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    static final String DEPLOYMENT_TAG = "deployment";

    private final MeterRegistry registry;
    private final Tags commonTags;
    private final ConcurrentMap<String, AtomicLong> gaugeBits = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry, String deploymentId) {
        this.registry = registry;
        this.commonTags = Tags.of(DEPLOYMENT_TAG, deploymentId);
    }

    @Override
    public void incrementCounter(String name) {
        Counter.builder(name).tags(commonTags).register(registry).increment();
    }

    @Override
    public void setGauge(String name, double value) {
        AtomicLong bits = gaugeBits.computeIfAbsent(name, n -> {
            AtomicLong holder = new AtomicLong();
            Gauge.builder(n, holder, h -> Double.longBitsToDouble(h.get()))
                    .tags(commonTags)
                    .register(registry);
            return holder;
        });
        bits.set(Double.doubleToLongBits(value));
    }

    @Override
    public void recordDuration(String name, Duration duration) {
        if (duration == null || duration.isNegative()) {
            return;
        }
        Timer.builder(name).tags(commonTags).register(registry).record(duration);
    }
}
