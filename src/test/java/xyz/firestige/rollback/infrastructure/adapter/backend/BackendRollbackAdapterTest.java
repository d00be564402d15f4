package xyz.firestige.rollback.infrastructure.adapter.backend;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;
import xyz.firestige.rollback.domain.execution.RollbackStrategy;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.ServiceType;
import xyz.firestige.rollback.domain.execution.StepOutcome;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;
import xyz.firestige.rollback.infrastructure.adapter.AdapterContext;
import xyz.firestige.rollback.infrastructure.adapter.PlannedStep;
import xyz.firestige.rollback.infrastructure.adapter.PlannedSteps;
import xyz.firestige.rollback.infrastructure.adapter.StepResult;
import xyz.firestige.rollback.infrastructure.external.DeploymentPlatformClient;
import xyz.firestige.rollback.infrastructure.external.HttpHealthClient;
import xyz.firestige.rollback.infrastructure.external.HttpProbeResponse;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackendRollbackAdapterTest {

    private DeploymentPlatformClient platform;
    private HttpHealthClient healthClient;
    private BackendRollbackAdapter adapter;

    @BeforeEach
    void setUp() {
        platform = mock(DeploymentPlatformClient.class);
        healthClient = mock(HttpHealthClient.class);
        adapter = new BackendRollbackAdapter(platform, healthClient);
    }

    private static RollbackTarget target(RollbackStrategy strategy, Map<String, Object> options) {
        return RollbackTarget.of("backend-api", ServiceType.BACKEND, "production", strategy, options);
    }

    private static AdapterContext context(RollbackTarget target) {
        return new AdapterContext(ExecutionId.ofTrusted("exec-test"), target);
    }

    private static List<String> names(PlannedSteps planned) {
        return planned.steps().stream().map(PlannedStep::name).toList();
    }

    @Test
    void blueGreen_plansSwitchThenValidate() {
        RollbackTarget target = target(RollbackStrategy.BLUE_GREEN, Map.of(
                "target_environment", "blue",
                "failed_environment", "green",
                "health_check_url", "http://blue/health"));

        assertThat(names(adapter.plan(target))).containsExactly("switch-traffic", "validate-health");
    }

    @Test
    void blueGreen_withoutPreserve_addsTeardown() {
        RollbackTarget target = target(RollbackStrategy.BLUE_GREEN, Map.of(
                "target_environment", "blue",
                "failed_environment", "green",
                "preserve_failed_environment", "false",
                "health_check_url", "http://blue/health"));

        PlannedSteps planned = adapter.plan(target);

        assertThat(names(planned)).containsExactly("switch-traffic", "validate-health", "teardown-environment");
        StepResult result = adapter.execute(planned.steps().get(2), context(target));
        assertThat(result.isSuccess()).isTrue();
        verify(platform).teardownEnvironment("green");
    }

    @Test
    void blueGreen_failedHealthCheck_keepsFailedEnvironment() {
        RollbackTarget target = target(RollbackStrategy.BLUE_GREEN, Map.of(
                "target_environment", "blue",
                "failed_environment", "green",
                "health_check_url", "http://blue/health"));
        when(healthClient.check(eq("http://blue/health"), any(Duration.class)))
                .thenReturn(new HttpProbeResponse(503, 12, "down"));
        List<PlannedStep> steps = adapter.plan(target).steps();

        StepResult switched = adapter.execute(steps.get(0), context(target));
        StepResult validated = adapter.execute(steps.get(1), context(target));

        assertThat(switched.isSuccess()).isTrue();
        verify(platform).switchTraffic("blue", "");
        assertThat(validated.outcome()).isEqualTo(StepOutcome.FAILED);
        assertThat(validated.isRetryable()).isFalse();
        assertThat(validated.error().errorType()).isEqualTo(ErrorType.VERIFICATION_ERROR);
        assertThat(validated.message()).contains("503").contains("green 已保留");
        verify(platform, never()).teardownEnvironment(anyString());
    }

    @Test
    void rolling_splitsInstancesIntoBatches() {
        when(platform.listInstances("orders")).thenReturn(List.of("i-1", "i-2", "i-3", "i-4", "i-5"));
        when(healthClient.check(anyString(), any(Duration.class))).thenReturn(new HttpProbeResponse(200, 5, "ok"));
        RollbackTarget target = target(RollbackStrategy.ROLLING, Map.of(
                "service_name", "orders",
                "target_version", "v1.2.3",
                "health_check_url", "http://orders/health",
                "batch_size", 2,
                "batch_delay_seconds", 0));

        PlannedSteps planned = adapter.plan(target);

        assertThat(names(planned)).containsExactly(
                "replace-batch-1", "health-check-batch-1",
                "replace-batch-2", "health-check-batch-2",
                "replace-batch-3", "health-check-batch-3");
        AdapterContext ctx = context(target);
        List<String> messages = planned.steps().stream().map(step -> adapter.execute(step, ctx))
                .peek(result -> assertThat(result.isSuccess()).isTrue())
                .map(StepResult::message)
                .toList();
        assertThat(messages).contains("第 1 批健康检查通过", "第 3 批实例已替换: [i-5]");
        verify(platform).replaceInstance("i-1", "v1.2.3");
        verify(platform).replaceInstance("i-5", "v1.2.3");
    }

    @Test
    void rolling_batchHealthFailure_isFatal() {
        when(platform.listInstances("backend-api")).thenReturn(List.of("i-1", "i-2"));
        when(healthClient.check(anyString(), any(Duration.class))).thenReturn(new HttpProbeResponse(500, 5, "err"));
        RollbackTarget target = target(RollbackStrategy.ROLLING, Map.of(
                "target_version", "v1.2.3",
                "health_check_url", "http://backend/health",
                "batch_size", 1,
                "batch_delay_seconds", 0));
        PlannedStep healthStep = adapter.plan(target).steps().get(1);

        StepResult result = adapter.execute(healthStep, context(target));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.isRetryable()).isFalse();
        assertThat(result.message()).contains("终止剩余批次");
    }

    @Test
    void immediate_replacesAllInstancesInOneBatch() {
        when(platform.listInstances("backend-api")).thenReturn(List.of("i-1", "i-2", "i-3"));
        RollbackTarget target = target(RollbackStrategy.IMMEDIATE, Map.of("target_version", "v1.2.3"));

        assertThat(names(adapter.plan(target))).containsExactly("replace-batch-1");
    }

    @Test
    void noInstances_failsPlan() {
        when(platform.listInstances("backend-api")).thenReturn(List.of());
        RollbackTarget target = target(RollbackStrategy.IMMEDIATE, Map.of("target_version", "v1.2.3"));

        PlannedSteps planned = adapter.plan(target);

        assertThat(planned.isFailed()).isTrue();
        assertThat(planned.steps()).isEmpty();
        assertThat(planned.error().errorType()).isEqualTo(ErrorType.BUSINESS_ERROR);
    }

    @Test
    void unreachablePlatform_isRetryableNetworkError() {
        RollbackTarget target = target(RollbackStrategy.BLUE_GREEN, Map.of(
                "target_environment", "blue",
                "health_check_url", "http://blue/health"));
        doThrow(new ResourceAccessException("connection refused"))
                .when(platform).switchTraffic(anyString(), anyString());

        StepResult result = adapter.execute(adapter.plan(target).steps().get(0), context(target));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.isRetryable()).isTrue();
        assertThat(result.error().errorType()).isEqualTo(ErrorType.NETWORK_ERROR);
    }

    @Test
    void validate_reportsMissingAndMalformedOptions() {
        Map<String, Object> options = new HashMap<>();
        options.put("batch_size", "abc");
        options.put("batch_delay_seconds", -1);

        List<String> errors = adapter.validate(target(RollbackStrategy.ROLLING, options));

        assertThat(errors).anyMatch(e -> e.contains("target_version"))
                .anyMatch(e -> e.contains("health_check_url"))
                .anyMatch(e -> e.contains("batch_size"))
                .anyMatch(e -> e.contains("batch_delay_seconds"));
        assertThat(adapter.validate(target(RollbackStrategy.IMMEDIATE, Map.of("target_version", "v1")))).isEmpty();
    }

    @Test
    void verify_withoutUrl_isHealthy() {
        assertThat(adapter.verify(target(RollbackStrategy.IMMEDIATE, Map.of("target_version", "v1"))).status())
                .isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void verify_probeFailure_isCritical() {
        when(healthClient.check(anyString(), any(Duration.class))).thenThrow(new ResourceAccessException("timeout"));

        assertThat(adapter.verify(target(RollbackStrategy.IMMEDIATE, Map.of(
                "target_version", "v1", "health_check_url", "http://x/health"))).status())
                .isEqualTo(HealthStatus.CRITICAL);
    }
}
