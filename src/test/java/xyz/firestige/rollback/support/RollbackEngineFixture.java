package xyz.firestige.rollback.support;

import xyz.firestige.rollback.application.RollbackOrchestrator;
import xyz.firestige.rollback.domain.execution.ServiceType;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.infrastructure.adapter.AdapterRegistry;
import xyz.firestige.rollback.infrastructure.execution.AdapterStepRunner;
import xyz.firestige.rollback.infrastructure.execution.PostRollbackVerifier;
import xyz.firestige.rollback.infrastructure.execution.RetryPolicy;
import xyz.firestige.rollback.infrastructure.execution.RollbackExecutor;
import xyz.firestige.rollback.infrastructure.lock.InMemoryDeploymentLockManager;
import xyz.firestige.rollback.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.rollback.infrastructure.persistence.execution.InMemoryRollbackExecutionRepository;
import xyz.firestige.rollback.infrastructure.resolver.DependencyResolver;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 用脚本适配器和内存实现组装的编排器，供应用层测试使用
 */
public class RollbackEngineFixture implements AutoCloseable {

    public final MutableClock clock = MutableClock.startingAt("2025-08-05T10:00:00");
    public final ScriptedAdapter backend = new ScriptedAdapter(ServiceType.BACKEND, "switch-traffic", "validate-health");
    public final ScriptedAdapter frontend = new ScriptedAdapter(ServiceType.FRONTEND, "restore-web-assets", "invalidate-cdn");
    public final ScriptedAdapter database = new ScriptedAdapter(ServiceType.DATABASE, "check-migration", "apply-migration");
    public final InMemoryRollbackExecutionRepository repository = new InMemoryRollbackExecutionRepository(20);
    public final InMemoryDeploymentLockManager lockManager = new InMemoryDeploymentLockManager(clock);
    public final RecordingEventPublisher publisher = new RecordingEventPublisher();
    public final AtomicReference<HealthStatus> verifiedStatus = new AtomicReference<>(HealthStatus.HEALTHY);
    public final RollbackOrchestrator orchestrator;

    private final ExecutorService workerPool = Executors.newFixedThreadPool(2);
    private final ExecutorService targetPool = Executors.newFixedThreadPool(4);
    private final ExecutorService stepPool = Executors.newCachedThreadPool();

    public RollbackEngineFixture() {
        AdapterRegistry registry = new AdapterRegistry(List.of(backend, frontend, database));
        AdapterStepRunner runner = new AdapterStepRunner(RetryPolicy.noRetry(), Duration.ofSeconds(5), stepPool,
                clock, new NoopMetricsRegistry());
        PostRollbackVerifier verifier = deploymentId -> RollbackTestData.report(deploymentId, verifiedStatus.get());
        RollbackExecutor executor = new RollbackExecutor(registry, new DependencyResolver(), runner, verifier,
                repository, publisher, targetPool, new NoopMetricsRegistry(), clock);
        orchestrator = new RollbackOrchestrator(registry, executor, repository, lockManager, workerPool,
                new NoopMetricsRegistry(), clock, Duration.ofMinutes(30), Duration.ofSeconds(5));
    }

    @Override
    public void close() {
        orchestrator.shutdown();
        targetPool.shutdownNow();
        stepPool.shutdownNow();
    }
}
