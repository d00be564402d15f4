package xyz.firestige.rollback.infrastructure.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollback.domain.execution.ExecutionStatus;
import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackStep;
import xyz.firestige.rollback.domain.execution.RollbackStrategy;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.RollbackTrigger;
import xyz.firestige.rollback.domain.execution.ServiceType;
import xyz.firestige.rollback.domain.execution.StepOutcome;
import xyz.firestige.rollback.domain.execution.event.RollbackStartedEvent;
import xyz.firestige.rollback.domain.execution.event.RollbackStepRecordedEvent;
import xyz.firestige.rollback.domain.execution.event.RollbackTerminatedEvent;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;
import xyz.firestige.rollback.infrastructure.adapter.AdapterRegistry;
import xyz.firestige.rollback.infrastructure.adapter.TargetAdapter;
import xyz.firestige.rollback.infrastructure.adapter.backend.BackendRollbackAdapter;
import xyz.firestige.rollback.infrastructure.external.DeploymentPlatformClient;
import xyz.firestige.rollback.infrastructure.external.HttpHealthClient;
import xyz.firestige.rollback.infrastructure.external.HttpProbeResponse;
import xyz.firestige.rollback.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.rollback.infrastructure.persistence.execution.InMemoryRollbackExecutionRepository;
import xyz.firestige.rollback.infrastructure.resolver.DependencyResolver;
import xyz.firestige.rollback.support.MutableClock;
import xyz.firestige.rollback.support.RecordingEventPublisher;
import xyz.firestige.rollback.support.RollbackTestData;
import xyz.firestige.rollback.support.ScriptedAdapter;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.awaitility.Awaitility.await;

class RollbackExecutorTest {

    private static final DeploymentId DEPLOYMENT = DeploymentId.of("deploy-1");

    private final MutableClock clock = MutableClock.startingAt("2025-08-05T10:00:00");
    private ExecutorService targetPool;
    private ExecutorService stepPool;
    private InMemoryRollbackExecutionRepository repository;
    private RecordingEventPublisher publisher;
    private ScriptedAdapter backend;
    private ScriptedAdapter frontend;
    private ScriptedAdapter database;
    private final AtomicReference<HealthStatus> reportStatus = new AtomicReference<>(HealthStatus.HEALTHY);

    @BeforeEach
    void setUp() {
        targetPool = Executors.newFixedThreadPool(4);
        stepPool = Executors.newCachedThreadPool();
        repository = new InMemoryRollbackExecutionRepository(20);
        publisher = new RecordingEventPublisher();
        backend = new ScriptedAdapter(ServiceType.BACKEND, "switch-traffic", "validate-health");
        frontend = new ScriptedAdapter(ServiceType.FRONTEND, "restore-web-assets", "invalidate-cdn");
        database = new ScriptedAdapter(ServiceType.DATABASE, "check-migration", "apply-migration");
    }

    @AfterEach
    void tearDown() {
        targetPool.shutdownNow();
        stepPool.shutdownNow();
    }

    private RollbackExecutor executor() {
        return executor(backend);
    }

    private RollbackExecutor executor(TargetAdapter backendAdapter) {
        AdapterRegistry registry = new AdapterRegistry(List.of(backendAdapter, frontend, database));
        AdapterStepRunner runner = new AdapterStepRunner(RetryPolicy.noRetry(), Duration.ofSeconds(5), stepPool,
                clock, new NoopMetricsRegistry());
        return new RollbackExecutor(registry, new DependencyResolver(), runner,
                deploymentId -> RollbackTestData.report(deploymentId, reportStatus.get()),
                repository, publisher, targetPool, new NoopMetricsRegistry(), clock);
    }

    private RollbackExecution newExecution(RollbackTarget... targets) {
        return RollbackExecution.create(ExecutionId.ofTrusted("exec-" + targets.length),
                RollbackTrigger.manual(DEPLOYMENT, "test", clock.now()), List.of(targets), clock.now());
    }

    private RollbackExecution run(RollbackExecution execution) {
        executor().execute(execution, new RollbackExecutionContext(execution.getExecutionId(), DEPLOYMENT));
        return execution;
    }

    private static List<String> stepTargets(RollbackExecution execution) {
        return execution.getSteps().stream().map(RollbackStep::targetName).distinct().toList();
    }

    @Test
    void allTargetsSucceed_inDependencyOrder() {
        RollbackExecution execution = run(newExecution(
                RollbackTestData.frontend("frontend-web"),
                RollbackTestData.backend("backend-api"),
                RollbackTestData.database("orders-db")));

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(stepTargets(execution)).containsExactly("orders-db", "backend-api", "frontend-web");
        assertThat(execution.getSteps()).hasSize(6).allMatch(RollbackStep::isSucceeded);
        assertThat(execution.getVerificationStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(repository.findById(execution.getExecutionId()))
                .hasValueSatisfying(saved -> assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.COMPLETED));
    }

    @Test
    void lifecycleEvents_arePublished() {
        RollbackExecution execution = run(newExecution(RollbackTestData.backend("backend-api")));

        assertThat(publisher.eventsOf(RollbackStartedEvent.class)).hasSize(1);
        assertThat(publisher.eventsOf(RollbackStepRecordedEvent.class)).hasSize(2);
        assertThat(publisher.eventsOf(RollbackTerminatedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.getStatus()).isEqualTo(ExecutionStatus.COMPLETED));
        assertThat(execution.getDomainEvents()).isEmpty();
    }

    @Test
    void failedStep_skipsRemainingStepsOfTarget() {
        backend.script("backend-api", "switch-traffic", ScriptedAdapter.fatalFailure("platform rejected"));

        RollbackExecution execution = run(newExecution(
                RollbackTestData.backend("backend-api"),
                RollbackTestData.frontend("frontend-web")));

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.PARTIALLY_COMPLETED);
        assertThat(execution.getSteps())
                .filteredOn(s -> s.targetName().equals("backend-api"))
                .extracting(RollbackStep::stepName, RollbackStep::outcome)
                .containsExactly(
                        tuple("switch-traffic", StepOutcome.FAILED),
                        tuple("validate-health", StepOutcome.SKIPPED));
        assertThat(execution.getFailureInfo().getErrorMessage()).contains("backend-api");
    }

    @Test
    void databaseFailure_blocksLaterTiers() {
        database.script("orders-db", "apply-migration", ScriptedAdapter.fatalFailure("migration broke"));

        RollbackExecution execution = run(newExecution(
                RollbackTestData.database("orders-db"),
                RollbackTestData.backend("backend-api"),
                RollbackTestData.frontend("frontend-web")));

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.PARTIALLY_COMPLETED);
        assertThat(backend.executed()).isEmpty();
        assertThat(frontend.executed()).isEmpty();
        assertThat(execution.getSteps())
                .filteredOn(s -> s.targetName().equals("backend-api"))
                .singleElement()
                .satisfies(s -> {
                    assertThat(s.stepName()).isEqualTo("rollback");
                    assertThat(s.outcome()).isEqualTo(StepOutcome.SKIPPED);
                    assertThat(s.message()).contains("orders-db");
                });
    }

    @Test
    void noSuccessfulSteps_isFailed() {
        backend.script("backend-api", "switch-traffic", ScriptedAdapter.fatalFailure("down"));

        RollbackExecution execution = run(newExecution(RollbackTestData.backend("backend-api")));

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.getFailureInfo().getErrorCode()).isEqualTo("no_successful_steps");
    }

    @Test
    void unhealthyVerification_isPartiallyCompleted() {
        reportStatus.set(HealthStatus.CRITICAL);

        RollbackExecution execution = run(newExecution(RollbackTestData.backend("backend-api")));

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.PARTIALLY_COMPLETED);
        assertThat(execution.getVerificationStatus()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(execution.getVerificationMessage()).contains("backend_api");
    }

    @Test
    void adapterSelfCheck_affectsVerification() {
        backend.verifyAs(HealthStatus.WARNING);

        RollbackExecution execution = run(newExecution(RollbackTestData.backend("backend-api")));

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.PARTIALLY_COMPLETED);
        assertThat(execution.getVerificationStatus()).isEqualTo(HealthStatus.WARNING);
    }

    @Test
    void invalidTargetsOnly_failsWithoutSteps() {
        backend.rejectTarget("backend-api");

        RollbackExecution execution = run(newExecution(RollbackTestData.backend("backend-api")));

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.getFailureInfo().getErrorCode()).isEqualTo("no_valid_targets");
        assertThat(execution.getSteps()).isEmpty();
    }

    @Test
    void invalidTarget_isExcludedFromResolvedOrder() {
        frontend.rejectTarget("frontend-web");

        RollbackExecution execution = run(newExecution(
                RollbackTestData.backend("backend-api"),
                RollbackTestData.frontend("frontend-web")));

        assertThat(execution.getTargets()).extracting(RollbackTarget::name).containsExactly("backend-api");
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    void planFailure_isRecordedAsFailedStep() {
        backend.failPlan("backend-api");

        RollbackExecution execution = run(newExecution(
                RollbackTestData.backend("backend-api"),
                RollbackTestData.frontend("frontend-web")));

        assertThat(execution.getSteps())
                .filteredOn(s -> s.targetName().equals("backend-api"))
                .singleElement()
                .satisfies(s -> {
                    assertThat(s.stepName()).isEqualTo("plan");
                    assertThat(s.outcome()).isEqualTo(StepOutcome.FAILED);
                });
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.PARTIALLY_COMPLETED);
    }

    @Test
    void sameTierTargets_runConcurrently() throws InterruptedException {
        ScriptedAdapter twoBackends = backend;
        CountDownLatch gate = twoBackends.gate("backend-a", "switch-traffic");
        RollbackExecution execution = newExecution(
                RollbackTestData.backend("backend-a"),
                RollbackTestData.backend("backend-b"));
        Thread worker = new Thread(() -> run(execution));
        worker.start();

        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> twoBackends.executed().contains("backend-b/validate-health"));
        gate.countDown();
        worker.join(5_000);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    void cancelBeforeStart_cancelsWithoutSteps() {
        RollbackExecution execution = newExecution(RollbackTestData.backend("backend-api"));
        RollbackExecutionContext context = new RollbackExecutionContext(execution.getExecutionId(), DEPLOYMENT);
        execution.requestCancel("ops");
        context.requestCancel();

        executor().execute(execution, context);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(execution.getSteps()).isEmpty();
    }

    @Test
    void cancelDuringStep_letsStepFinishThenStops() throws InterruptedException {
        CountDownLatch gate = backend.gate("backend-api", "switch-traffic");
        RollbackExecution execution = newExecution(
                RollbackTestData.backend("backend-api"),
                RollbackTestData.frontend("frontend-web"));
        RollbackExecutionContext context = new RollbackExecutionContext(execution.getExecutionId(), DEPLOYMENT);
        Thread worker = new Thread(() -> executor().execute(execution, context));
        worker.start();

        assertThat(backend.awaitFirstStep(5, TimeUnit.SECONDS)).isTrue();
        execution.requestCancel("ops");
        context.requestCancel();
        gate.countDown();
        worker.join(5_000);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(execution.getSteps()).extracting(RollbackStep::stepName).containsExactly("switch-traffic");
        assertThat(execution.getSteps().get(0).isSucceeded()).isTrue();
        assertThat(frontend.executed()).isEmpty();
        assertThat(execution.getCancelRequestedBy()).isEqualTo("ops");
    }

    @Test
    void rollingBackend_completesEveryBatch() {
        DeploymentPlatformClient platform = mock(DeploymentPlatformClient.class);
        HttpHealthClient healthClient = mock(HttpHealthClient.class);
        when(platform.listInstances("orders")).thenReturn(List.of("i-1", "i-2", "i-3"));
        when(healthClient.check(anyString(), any(Duration.class))).thenReturn(new HttpProbeResponse(200, 3, "ok"));
        RollbackTarget target = RollbackTarget.of("orders", ServiceType.BACKEND, "production", RollbackStrategy.ROLLING,
                Map.of("target_version", "v1.2.3", "health_check_url", "http://orders/health",
                        "batch_size", 2, "batch_delay_seconds", 0));
        RollbackExecution execution = newExecution(target);

        executor(new BackendRollbackAdapter(platform, healthClient))
                .execute(execution, new RollbackExecutionContext(execution.getExecutionId(), DEPLOYMENT));

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.getSteps())
                .extracting(RollbackStep::stepName, RollbackStep::outcome)
                .containsExactly(
                        tuple("replace-batch-1", StepOutcome.SUCCEEDED),
                        tuple("health-check-batch-1", StepOutcome.SUCCEEDED),
                        tuple("replace-batch-2", StepOutcome.SUCCEEDED),
                        tuple("health-check-batch-2", StepOutcome.SUCCEEDED));
        verify(platform).replaceInstance("i-3", "v1.2.3");
    }

    @Test
    void terminalTimestamp_comesFromEngineClock() {
        RollbackExecution execution = newExecution(RollbackTestData.backend("backend-api"));
        clock.advanceMinutes(12);

        run(execution);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.getCompletedAt()).isEqualTo(clock.now());
        assertThat(execution.getDurationMinutes()).isEqualTo(12.0);
    }

    @Test
    void leaseIsRenewedBeforeEachStep() {
        AtomicInteger renewals = new AtomicInteger();
        RollbackExecution execution = newExecution(RollbackTestData.backend("backend-api"));
        RollbackExecutionContext context = new RollbackExecutionContext(execution.getExecutionId(), DEPLOYMENT);
        context.setLeaseRenewal(renewals::incrementAndGet);

        executor().execute(execution, context);

        // 1 个 tier + 2 个步骤
        assertThat(renewals.get()).isEqualTo(3);
    }

    @Test
    void interruptedWorker_failsExecutionAndKeepsInterruptFlag() throws InterruptedException {
        CountDownLatch gate = backend.gate("backend-a", "switch-traffic");
        RollbackExecution execution = newExecution(
                RollbackTestData.backend("backend-a"),
                RollbackTestData.backend("backend-b"));
        AtomicReference<Boolean> interruptedAfterRun = new AtomicReference<>();
        Thread worker = new Thread(() -> {
            run(execution);
            interruptedAfterRun.set(Thread.currentThread().isInterrupted());
        });
        worker.start();
        assertThat(backend.awaitFirstStep(5, TimeUnit.SECONDS)).isTrue();

        worker.interrupt();
        worker.join(5_000);
        gate.countDown();

        assertThat(interruptedAfterRun.get()).isTrue();
        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.getFailureInfo().getErrorCode()).isEqualTo("interrupted");
    }
}
