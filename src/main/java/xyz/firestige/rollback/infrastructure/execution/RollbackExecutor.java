package xyz.firestige.rollback.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.rollback.domain.execution.ExecutionStatus;
import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackExecutionRepository;
import xyz.firestige.rollback.domain.execution.RollbackStep;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.ServiceType;
import xyz.firestige.rollback.domain.execution.StepOutcome;
import xyz.firestige.rollback.domain.health.HealthReport;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.shared.event.DomainEventPublisher;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.domain.shared.exception.FailureInfo;
import xyz.firestige.rollback.infrastructure.adapter.AdapterContext;
import xyz.firestige.rollback.infrastructure.adapter.AdapterRegistry;
import xyz.firestige.rollback.infrastructure.adapter.HealthSignal;
import xyz.firestige.rollback.infrastructure.adapter.PlannedStep;
import xyz.firestige.rollback.infrastructure.adapter.PlannedSteps;
import xyz.firestige.rollback.infrastructure.adapter.StepResult;
import xyz.firestige.rollback.infrastructure.adapter.TargetAdapter;
import xyz.firestige.rollback.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollback.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.rollback.infrastructure.resolver.DependencyResolver;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * 回滚执行驱动器
 * <p>
 * 流程：
 * <pre>
 * PENDING → RESOLVING（依赖排序、过滤不可执行目标）
 *         → EXECUTING（按 tier 执行，同 tier 目标并发；阻塞型服务失败时跳过后续 tier）
 *         → VERIFYING（健康报告 + 适配器自检）
 *         → COMPLETED / PARTIALLY_COMPLETED / FAILED
 * </pre>
 * 取消是协作式的：在步骤之间检查取消标记，进行中的步骤允许自然结束。
 * 适配器错误在这里转换为步骤记录，不会越过驱动器抛出。
 */
public class RollbackExecutor {

    private static final Logger log = LoggerFactory.getLogger(RollbackExecutor.class);

    private final AdapterRegistry adapterRegistry;
    private final DependencyResolver dependencyResolver;
    private final AdapterStepRunner stepRunner;
    private final PostRollbackVerifier verifier;
    private final RollbackExecutionRepository repository;
    private final DomainEventPublisher eventPublisher;
    private final ExecutorService targetExecutor;
    private final MetricsRegistry metrics;
    private final Clock clock;

    /**
     * 失败后会阻塞后续 tier 的服务类型
     */
    private final Set<ServiceType> blockingServices;

    public RollbackExecutor(AdapterRegistry adapterRegistry,
                            DependencyResolver dependencyResolver,
                            AdapterStepRunner stepRunner,
                            PostRollbackVerifier verifier,
                            RollbackExecutionRepository repository,
                            DomainEventPublisher eventPublisher,
                            ExecutorService targetExecutor,
                            MetricsRegistry metrics,
                            Clock clock) {
        this.adapterRegistry = adapterRegistry;
        this.dependencyResolver = dependencyResolver;
        this.stepRunner = stepRunner;
        this.verifier = verifier;
        this.repository = repository;
        this.eventPublisher = eventPublisher;
        this.targetExecutor = targetExecutor;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
        this.clock = clock;
        this.blockingServices = EnumSet.of(ServiceType.DATABASE);
    }

    /**
     * 驱动执行直到终态（在工作线程中调用）
     */
    public void execute(RollbackExecution execution, RollbackExecutionContext context) {
        try {
            context.injectMdc(null);
            log.info("开始回滚执行, reason: {}, targets: {}",
                    execution.getTrigger().reason().getCode(), execution.getRequestedTargets());

            if (cancelIfRequested(execution, context)) {
                return;
            }

            // 1. 依赖解析
            execution.startResolving();
            flush(execution);
            List<RollbackTarget> ordered = resolveExecutableTargets(execution);
            if (ordered.isEmpty()) {
                execution.failNoValidTargets("依赖解析后没有可执行的目标: " + execution.getRequestedTargets(),
                        LocalDateTime.now(clock));
                log.warn("没有可执行的回滚目标");
                return;
            }
            execution.resolved(ordered);
            flush(execution);

            // 2. 按 tier 执行
            executeTiers(execution, context);
            if (cancelIfRequested(execution, context)) {
                return;
            }

            // 3. 校验并决定终态
            execution.startVerifying();
            flush(execution);
            verifyAndTerminate(execution);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("回滚执行线程被中断, executionId: {}, deploymentId: {}",
                    execution.getExecutionId(), execution.getDeploymentId());
            if (!execution.isTerminal()) {
                execution.fail(FailureInfo.of("interrupted", ErrorType.SYSTEM_ERROR, "回滚执行线程被中断",
                        execution.getStatus().getCode()), LocalDateTime.now(clock));
            }
        } catch (Exception e) {
            log.error("回滚执行异常, executionId: {}, deploymentId: {}, target: {}, error: {}",
                    execution.getExecutionId(), execution.getDeploymentId(), MDC.get(RollbackExecutionContext.MDC_TARGET),
                    e.getMessage(), e);
            if (!execution.isTerminal()) {
                execution.fail(FailureInfo.fromException(e, ErrorType.SYSTEM_ERROR, execution.getStatus().getCode()),
                        LocalDateTime.now(clock));
            }
        } finally {
            flush(execution);
            recordOutcome(execution);
            context.clearMdc();
        }
    }

    private List<RollbackTarget> resolveExecutableTargets(RollbackExecution execution) {
        List<RollbackTarget> ordered = dependencyResolver.resolveOrder(execution.getRequestedTargets());
        List<RollbackTarget> executable = new ArrayList<>();
        for (RollbackTarget target : ordered) {
            List<String> errors = adapterRegistry.validate(target);
            if (errors.isEmpty()) {
                executable.add(target);
            } else {
                log.warn("目标不可执行，已排除: {}, errors: {}", target, errors);
            }
        }
        log.info("依赖解析完成, 执行顺序: {}", executable);
        return executable;
    }

    private void executeTiers(RollbackExecution execution, RollbackExecutionContext context)
            throws InterruptedException {
        String blockedBy = null;
        for (List<RollbackTarget> tier : dependencyResolver.groupByTier(execution.getTargets())) {
            if (context.isCancelRequested()) {
                return;
            }
            context.renewLease();
            if (blockedBy != null) {
                for (RollbackTarget target : tier) {
                    skipTarget(execution, target, "依赖的目标 " + blockedBy + " 回滚失败，跳过");
                }
                flush(execution);
                continue;
            }

            runTier(execution, context, tier);
            flush(execution);

            for (RollbackTarget target : tier) {
                if (blockingServices.contains(target.service()) && execution.isTargetFailed(target.name())) {
                    blockedBy = target.name();
                    log.warn("阻塞型目标回滚失败，后续 tier 将被跳过: {}", target.name());
                }
            }
        }
    }

    private void runTier(RollbackExecution execution, RollbackExecutionContext context, List<RollbackTarget> tier)
            throws InterruptedException {
        if (tier.size() == 1) {
            runTarget(execution, context, tier.get(0));
            return;
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Callable<Void>> tasks = new ArrayList<>();
        for (RollbackTarget target : tier) {
            tasks.add(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    runTarget(execution, context, target);
                } finally {
                    MDC.clear();
                }
                return null;
            });
        }
        for (Future<Void> future : targetExecutor.invokeAll(tasks)) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("目标执行线程异常: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
            }
        }
    }

    /**
     * 顺序执行一个目标的全部步骤；某一步失败后，剩余步骤记为 SKIPPED
     */
    private void runTarget(RollbackExecution execution, RollbackExecutionContext context, RollbackTarget target) {
        context.injectMdc(target.name());
        TargetAdapter adapter = adapterRegistry.require(target.service());
        log.info("开始回滚目标: {}", target);

        PlannedSteps plan = adapter.plan(target);
        if (plan.isFailed()) {
            LocalDateTime now = LocalDateTime.now(clock);
            execution.appendStep(new RollbackStep(0, target.name(), target.service(), "plan", 1,
                    StepOutcome.FAILED, plan.error().reason(),
                    plan.error().toFailureInfo(target.name() + "/plan"), now, now));
            log.error("目标计划失败: {}, reason: {}", target.name(), plan.error().reason());
            return;
        }

        AdapterContext adapterContext = new AdapterContext(context.getExecutionId(), target);
        List<PlannedStep> steps = plan.steps();
        for (int i = 0; i < steps.size(); i++) {
            if (context.isCancelRequested()) {
                log.info("收到取消请求，停止目标的剩余步骤: {}", target.name());
                return;
            }
            context.renewLease();
            PlannedStep step = steps.get(i);
            StepResult result = stepRunner.run(adapter, step, adapterContext, execution, context);
            if (result.isFailure()) {
                for (PlannedStep remaining : steps.subList(i + 1, steps.size())) {
                    appendSkipped(execution, target, remaining.name(), "前序步骤 " + step.name() + " 失败，跳过");
                }
                log.error("目标回滚失败: {}, step: {}, reason: {}", target.name(), step.name(), result.message());
                return;
            }
        }
        log.info("目标回滚完成: {}", target.name());
    }

    private void skipTarget(RollbackExecution execution, RollbackTarget target, String reason) {
        appendSkipped(execution, target, "rollback", reason);
        log.warn("跳过目标: {}, reason: {}", target.name(), reason);
    }

    private void appendSkipped(RollbackExecution execution, RollbackTarget target, String stepName, String reason) {
        LocalDateTime now = LocalDateTime.now(clock);
        execution.appendStep(new RollbackStep(0, target.name(), target.service(), stepName, 1,
                StepOutcome.SKIPPED, reason, null, now, now));
    }

    private boolean cancelIfRequested(RollbackExecution execution, RollbackExecutionContext context) {
        if (!context.isCancelRequested() || execution.isTerminal()) {
            return false;
        }
        execution.cancel(LocalDateTime.now(clock));
        log.info("回滚已取消, requestedBy: {}, 已完成步骤: {}",
                execution.getCancelRequestedBy(), execution.getSteps().size());
        return true;
    }

    /**
     * 终态规则：
     * - 没有任何成功步骤 → FAILED
     * - 有目标未完成（失败或被跳过）→ PARTIALLY_COMPLETED，与校验结果无关
     * - 全部目标完成且健康 → COMPLETED，否则 PARTIALLY_COMPLETED
     */
    private void verifyAndTerminate(RollbackExecution execution) {
        List<String> incomplete = incompleteTargets(execution);

        HealthStatus status = verify(execution, incomplete);
        if (!execution.hasSucceededSteps()) {
            execution.fail(FailureInfo.of("no_successful_steps", ErrorType.BUSINESS_ERROR,
                    "没有任何步骤成功, 未完成目标: " + incomplete, "executing"), LocalDateTime.now(clock));
            log.error("回滚失败：没有任何步骤成功");
            return;
        }
        if (!incomplete.isEmpty()) {
            execution.completePartially(FailureInfo.of("targets_failed", ErrorType.BUSINESS_ERROR,
                    "部分目标回滚失败: " + incomplete + "，需人工处理", String.join(",", incomplete)),
                    LocalDateTime.now(clock));
            log.warn("回滚部分完成, 未完成目标: {}", incomplete);
            return;
        }
        if (status == HealthStatus.HEALTHY) {
            execution.complete(LocalDateTime.now(clock));
            log.info("回滚完成，回滚后健康校验通过");
        } else {
            execution.completePartially(FailureInfo.of("verification_failed", ErrorType.VERIFICATION_ERROR,
                    "回滚后健康校验未通过: " + execution.getVerificationMessage(), "verifying"),
                    LocalDateTime.now(clock));
            log.warn("回滚步骤全部成功，但健康校验未通过: {}", status);
        }
    }

    private List<String> incompleteTargets(RollbackExecution execution) {
        List<RollbackStep> latest = execution.latestAttempts();
        List<String> incomplete = new ArrayList<>();
        for (RollbackTarget target : execution.getTargets()) {
            List<RollbackStep> targetSteps = latest.stream()
                    .filter(s -> s.targetName().equals(target.name()))
                    .toList();
            boolean done = !targetSteps.isEmpty() && targetSteps.stream().allMatch(RollbackStep::isSucceeded);
            if (!done) {
                incomplete.add(target.name());
            }
        }
        return incomplete;
    }

    private HealthStatus verify(RollbackExecution execution, List<String> incomplete) {
        HealthStatus status = HealthStatus.HEALTHY;
        List<String> messages = new ArrayList<>();
        try {
            if (verifier != null) {
                HealthReport report = verifier.verify(execution.getDeploymentId());
                status = report.overallStatus();
                messages.add("health=" + report.overallStatus().getCode());
                if (!report.failedChecks().isEmpty()) {
                    messages.add("failed=" + report.failedChecks());
                }
            }
        } catch (Exception e) {
            log.warn("回滚后健康报告生成失败: {}", e.getMessage(), e);
            status = HealthStatus.UNKNOWN;
            messages.add("health report error: " + e.getMessage());
        }
        for (RollbackTarget target : execution.getTargets()) {
            if (incomplete.contains(target.name())) {
                continue;
            }
            HealthSignal signal = adapterRegistry.require(target.service()).verify(target);
            if (signal.status() != HealthStatus.HEALTHY) {
                status = status.worse(signal.status());
                messages.add(target.name() + ": " + signal.message());
            }
        }
        String message = messages.stream().collect(Collectors.joining("; "));
        execution.recordVerification(status, message);
        log.info("回滚后校验: {}, {}", status, message);
        return status;
    }

    private void flush(RollbackExecution execution) {
        try {
            repository.save(execution);
        } catch (RuntimeException e) {
            log.error("保存执行记录失败, executionId: {}, deploymentId: {}, error: {}",
                    execution.getExecutionId(), execution.getDeploymentId(), e.getMessage(), e);
        }
        eventPublisher.publishAll(execution.drainDomainEvents());
    }

    private void recordOutcome(RollbackExecution execution) {
        ExecutionStatus status = execution.getStatus();
        switch (status) {
            case COMPLETED -> metrics.incrementCounter("rollback_completed");
            case PARTIALLY_COMPLETED -> metrics.incrementCounter("rollback_partially_completed");
            case FAILED -> metrics.incrementCounter("rollback_failed");
            case CANCELLED -> metrics.incrementCounter("rollback_cancelled");
            default -> log.warn("执行结束时未到达终态: {}", status);
        }
        if (execution.getCompletedAt() != null) {
            metrics.recordDuration("rollback_execution_duration",
                    Duration.between(execution.getStartedAt(), execution.getCompletedAt()));
        }
        log.info("回滚执行结束, status: {}, steps: {}, duration: {} min",
                status, execution.getSteps().size(), String.format("%.2f", execution.getDurationMinutes()));
    }
}
