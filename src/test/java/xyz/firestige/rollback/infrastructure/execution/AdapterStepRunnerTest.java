package xyz.firestige.rollback.infrastructure.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackStep;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.RollbackTrigger;
import xyz.firestige.rollback.domain.execution.ServiceType;
import xyz.firestige.rollback.domain.execution.StepOutcome;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;
import xyz.firestige.rollback.infrastructure.adapter.AdapterContext;
import xyz.firestige.rollback.infrastructure.adapter.PlannedStep;
import xyz.firestige.rollback.infrastructure.adapter.StepResult;
import xyz.firestige.rollback.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.rollback.support.MutableClock;
import xyz.firestige.rollback.support.RollbackTestData;
import xyz.firestige.rollback.support.ScriptedAdapter;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class AdapterStepRunnerTest {

    private static final DeploymentId DEPLOYMENT = DeploymentId.of("deploy-1");

    private final MutableClock clock = MutableClock.startingAt("2025-08-05T10:00:00");
    private ExecutorService stepPool;
    private RollbackTarget target;
    private RollbackExecution execution;
    private RollbackExecutionContext context;
    private ScriptedAdapter adapter;

    @BeforeEach
    void setUp() {
        stepPool = Executors.newCachedThreadPool();
        target = RollbackTestData.backend("backend-api");
        ExecutionId executionId = ExecutionId.ofTrusted("exec-runner");
        execution = RollbackExecution.create(executionId,
                RollbackTrigger.manual(DEPLOYMENT, "test", clock.now()), List.of(target), clock.now());
        execution.startResolving();
        execution.resolved(List.of(target));
        context = new RollbackExecutionContext(executionId, DEPLOYMENT);
        adapter = new ScriptedAdapter(ServiceType.BACKEND, "switch");
    }

    @AfterEach
    void tearDown() {
        stepPool.shutdownNow();
    }

    private AdapterStepRunner runner(RetryPolicy policy, Duration timeout) {
        return new AdapterStepRunner(policy, timeout, stepPool, clock, new NoopMetricsRegistry());
    }

    private StepResult run(AdapterStepRunner runner) {
        return runner.run(adapter, PlannedStep.of("switch"),
                new AdapterContext(execution.getExecutionId(), target), execution, context);
    }

    @Test
    void retryableFailures_areRetriedAndEachAttemptRecorded() {
        adapter.script("backend-api", "switch",
                ScriptedAdapter.retryableFailure("timeout-1"),
                ScriptedAdapter.retryableFailure("timeout-2"),
                StepResult.success("ok"));

        StepResult result = run(runner(new RetryPolicy(3, Duration.ZERO, 1.0, Duration.ZERO), Duration.ofSeconds(5)));

        assertThat(result.isSuccess()).isTrue();
        assertThat(execution.getSteps()).extracting(RollbackStep::attempt).containsExactly(1, 2, 3);
        assertThat(execution.getSteps()).extracting(RollbackStep::outcome)
                .containsExactly(StepOutcome.FAILED, StepOutcome.FAILED, StepOutcome.SUCCEEDED);
        assertThat(execution.getSteps()).extracting(RollbackStep::sequence).containsExactly(1, 2, 3);
        assertThat(execution.getSteps().get(0).failureInfo().getErrorMessage()).isEqualTo("timeout-1");
        assertThat(execution.getSteps().get(0).failureInfo().isRetryable()).isTrue();
    }

    @Test
    void retriesAreBounded() {
        adapter.script("backend-api", "switch", ScriptedAdapter.retryableFailure("down"));

        StepResult result = run(runner(new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO), Duration.ofSeconds(5)));

        assertThat(result.isFailure()).isTrue();
        assertThat(execution.getSteps()).hasSize(2);
        assertThat(execution.isTargetFailed("backend-api")).isTrue();
    }

    @Test
    void fatalFailure_isNotRetried() {
        adapter.script("backend-api", "switch", ScriptedAdapter.fatalFailure("bad request"));

        StepResult result = run(runner(RetryPolicy.defaults(), Duration.ofSeconds(5)));

        assertThat(result.isFailure()).isTrue();
        assertThat(execution.getSteps()).hasSize(1);
        assertThat(execution.getSteps().get(0).failureInfo().isRetryable()).isFalse();
    }

    @Test
    void slowStep_timesOutAsRetryable() {
        adapter.scriptSupplier("backend-api", "switch", () -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StepResult.success("late");
        });

        StepResult result = run(runner(RetryPolicy.noRetry(), Duration.ofMillis(100)));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.isRetryable()).isTrue();
        assertThat(result.error().errorType()).isEqualTo(ErrorType.TIMEOUT_ERROR);
        assertThat(execution.getSteps()).hasSize(1);
    }

    @Test
    void unexpectedException_isFatalSystemError() {
        adapter.scriptSupplier("backend-api", "switch", () -> {
            throw new IllegalStateException("adapter bug");
        });

        StepResult result = run(runner(RetryPolicy.defaults(), Duration.ofSeconds(5)));

        assertThat(result.isRetryable()).isFalse();
        assertThat(result.error().errorType()).isEqualTo(ErrorType.SYSTEM_ERROR);
        assertThat(result.message()).contains("adapter bug");
    }

    @Test
    void cancelRequest_stopsRetrying() {
        adapter.script("backend-api", "switch", ScriptedAdapter.retryableFailure("down"));
        context.requestCancel();

        run(runner(new RetryPolicy(5, Duration.ZERO, 1.0, Duration.ZERO), Duration.ofSeconds(5)));

        assertThat(execution.getSteps()).hasSize(1);
    }

    @Test
    void retryPolicy_backsOffExponentiallyWithCap() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(5));

        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.nextDelay(3)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.nextDelay(5)).isNull();
        assertThat(RetryPolicy.noRetry().nextDelay(1)).isNull();
    }
}
