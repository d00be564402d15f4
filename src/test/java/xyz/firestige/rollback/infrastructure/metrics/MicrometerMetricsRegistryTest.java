package xyz.firestige.rollback.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerMetricsRegistryTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final MicrometerMetricsRegistry metrics = new MicrometerMetricsRegistry(meterRegistry, "deploy-1");

    @Test
    void counters_areTaggedWithDeployment() {
        metrics.incrementCounter("rollback_initiated");
        metrics.incrementCounter("rollback_initiated");

        assertThat(meterRegistry.get("rollback_initiated").tag("deployment", "deploy-1").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void gauge_keepsLatestValue() {
        metrics.setGauge("rollback_active", 3);
        metrics.setGauge("rollback_active", 1);

        assertThat(meterRegistry.get("rollback_active").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void durations_areRecordedAndNegativeOnesIgnored() {
        metrics.recordDuration("rollback_step_duration", Duration.ofSeconds(2));
        metrics.recordDuration("rollback_step_duration", Duration.ofSeconds(-1));

        assertThat(meterRegistry.get("rollback_step_duration").timer().count()).isEqualTo(1);
        assertThat(meterRegistry.get("rollback_step_duration").timer().totalTime(TimeUnit.SECONDS)).isEqualTo(2.0);
    }
}
