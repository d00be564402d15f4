package xyz.firestige.rollback.infrastructure.health.probe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckDefinition;
import xyz.firestige.rollback.domain.health.HealthCheckResult;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.support.MutableClock;

import static org.assertj.core.api.Assertions.assertThat;

@DisabledOnOs(OS.WINDOWS)
class CustomCommandProbeTest {

    private final CustomCommandProbe probe = new CustomCommandProbe(MutableClock.startingAt("2025-08-05T10:00:00"));

    private static HealthCheckDefinition command(String command) {
        HealthCheckDefinition check = new HealthCheckDefinition("queue_depth", "backend", CheckType.CUSTOM);
        check.setCommand(command);
        check.setTimeoutSeconds(10);
        check.setThresholdWarning(80.0);
        check.setThresholdCritical(95.0);
        return check;
    }

    @Test
    void numericOutput_isComparedWithThresholds() {
        HealthCheckResult result = probe.probe(command("echo 85"));

        assertThat(result.status()).isEqualTo(HealthStatus.WARNING);
        assertThat(result.value()).isEqualTo(85.0);
    }

    @Test
    void largeOutput_doesNotBlockUntilTimeout() {
        HealthCheckResult result = probe.probe(command("seq 1 200000"));

        assertThat(result.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(result.value()).isEqualTo(1.0);
    }

    @Test
    void nonZeroExit_isCritical() {
        HealthCheckResult result = probe.probe(command("echo 1; exit 3"));

        assertThat(result.status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(result.message()).contains("退出码 3");
    }
}
