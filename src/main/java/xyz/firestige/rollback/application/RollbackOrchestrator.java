package xyz.firestige.rollback.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackExecutionRepository;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.RollbackTrigger;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.domain.shared.exception.FailureInfo;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;
import xyz.firestige.rollback.infrastructure.adapter.AdapterRegistry;
import xyz.firestige.rollback.infrastructure.execution.RollbackExecutionContext;
import xyz.firestige.rollback.infrastructure.execution.RollbackExecutor;
import xyz.firestige.rollback.infrastructure.lock.DeploymentLockManager;
import xyz.firestige.rollback.infrastructure.metrics.MetricsRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 回滚编排器
 * <p>
 * 职责：
 * 1. 同步校验目标（空集合、服务/策略不兼容直接拒绝）
 * 2. 通过部署锁保证同一 deploymentId 只有一个非终态执行
 * 3. 创建执行记录并提交到工作线程池异步驱动，立即返回 PENDING 快照
 * 4. 查询状态 / 历史，协作式取消
 * <p>
 * 部署锁在 initiateRollback 中获取，执行器在每个 tier 和步骤之前续租，工作线程在执行进入终态后释放
 */
public class RollbackOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(RollbackOrchestrator.class);

    private final AdapterRegistry adapterRegistry;
    private final RollbackExecutor rollbackExecutor;
    private final RollbackExecutionRepository repository;
    private final DeploymentLockManager lockManager;
    private final ExecutorService workerPool;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final Duration lockTtl;
    private final Duration shutdownTimeout;

    private final Map<ExecutionId, ActiveExecution> active = new ConcurrentHashMap<>();
    private volatile boolean shuttingDown;

    public RollbackOrchestrator(AdapterRegistry adapterRegistry,
                                RollbackExecutor rollbackExecutor,
                                RollbackExecutionRepository repository,
                                DeploymentLockManager lockManager,
                                ExecutorService workerPool,
                                MetricsRegistry metrics,
                                Clock clock,
                                Duration lockTtl,
                                Duration shutdownTimeout) {
        this.adapterRegistry = adapterRegistry;
        this.rollbackExecutor = rollbackExecutor;
        this.repository = repository;
        this.lockManager = lockManager;
        this.workerPool = workerPool;
        this.metrics = metrics;
        this.clock = clock;
        this.lockTtl = lockTtl;
        this.shutdownTimeout = shutdownTimeout;
        logger.info("[RollbackOrchestrator] 初始化完成, lockTtl: {}, shutdownTimeout: {}", lockTtl, shutdownTimeout);
    }

    /**
     * 发起回滚（非阻塞）
     *
     * @return PENDING 状态的执行快照，通过 {@link #getRollbackStatus} 轮询进度
     * @throws RollbackRejectedException 校验失败或部署已有进行中的回滚
     */
    public RollbackExecution initiateRollback(RollbackTrigger trigger, List<RollbackTarget> targets) {
        DeploymentId deploymentId = trigger.deploymentId();
        logger.info("[RollbackOrchestrator] 收到回滚请求: deploymentId={}, reason={}, triggeredBy={}, targets={}",
                deploymentId, trigger.reason().getCode(), trigger.triggeredBy(), targets == null ? 0 : targets.size());

        if (shuttingDown) {
            throw new IllegalStateException("编排器正在关闭，不再接受回滚请求: " + deploymentId);
        }

        // Step 1: 目标校验（快速失败）
        if (targets == null || targets.isEmpty()) {
            throw reject(new RollbackRejectedException(RejectionReason.NO_VALID_TARGETS, deploymentId,
                    List.of("目标集合为空")));
        }
        List<String> errors = validateTargets(targets);
        if (!errors.isEmpty()) {
            throw reject(new RollbackRejectedException(RejectionReason.VALIDATION_ERROR, deploymentId, errors));
        }

        // Step 2: 部署锁；本进程内仍在运行的执行优先于锁状态（锁可能已过期）
        Optional<ExecutionId> running = runningExecution(deploymentId);
        if (running.isPresent()) {
            throw reject(RollbackRejectedException.concurrent(deploymentId, running.get()));
        }
        ExecutionId executionId = ExecutionId.generate(deploymentId);
        if (!lockManager.tryAcquire(deploymentId, executionId, lockTtl)) {
            ExecutionId existing = lockManager.currentHolder(deploymentId).orElse(null);
            throw reject(RollbackRejectedException.concurrent(deploymentId, existing));
        }

        // Step 3: 创建并提交
        RollbackExecution execution = RollbackExecution.create(executionId, trigger, targets, LocalDateTime.now(clock));
        RollbackExecutionContext context = new RollbackExecutionContext(executionId, deploymentId);
        context.setLeaseRenewal(() -> renewLock(deploymentId, executionId));
        RollbackExecution pending;
        try {
            repository.save(execution);
            pending = execution.snapshot();
            active.put(executionId, new ActiveExecution(execution, context));
            workerPool.submit(() -> drive(execution, context));
        } catch (RejectedExecutionException e) {
            abandon(execution, "工作线程池拒绝执行: " + e.getMessage());
            throw new IllegalStateException("回滚执行提交失败: " + executionId, e);
        } catch (RuntimeException e) {
            abandon(execution, "回滚执行提交失败: " + e.getMessage());
            throw e;
        }

        metrics.incrementCounter("rollback_initiated");
        updateActiveGauge();
        logger.info("[RollbackOrchestrator] 回滚已提交: executionId={}, deploymentId={}", executionId, deploymentId);
        return pending;
    }

    private Optional<ExecutionId> runningExecution(DeploymentId deploymentId) {
        return active.values().stream()
                .map(ActiveExecution::execution)
                .filter(e -> e.getDeploymentId().equals(deploymentId) && !e.isTerminal())
                .map(RollbackExecution::getExecutionId)
                .findFirst();
    }

    /**
     * 续租部署锁；锁已过期且未被他人占用时重新获取
     */
    private void renewLock(DeploymentId deploymentId, ExecutionId executionId) {
        if (lockManager.renew(deploymentId, executionId, lockTtl)) {
            return;
        }
        if (lockManager.tryAcquire(deploymentId, executionId, lockTtl)) {
            logger.warn("[RollbackOrchestrator] 部署锁已过期，重新获取: executionId={}, deploymentId={}",
                    executionId, deploymentId);
            return;
        }
        logger.error("[RollbackOrchestrator] 部署锁续租失败，锁已被其他执行持有: executionId={}, deploymentId={}, holder={}",
                executionId, deploymentId, lockManager.currentHolder(deploymentId).orElse(null));
    }

    private RollbackRejectedException reject(RollbackRejectedException e) {
        metrics.incrementCounter("rollback_rejected");
        logger.warn("[RollbackOrchestrator] 回滚请求被拒绝: reason={}, {}", e.getReason().getCode(), e.getMessage());
        return e;
    }

    private void abandon(RollbackExecution execution, String message) {
        active.remove(execution.getExecutionId());
        if (!execution.isTerminal()) {
            execution.fail(FailureInfo.of(ErrorType.SYSTEM_ERROR, message, "initiate_rollback"), LocalDateTime.now(clock));
        }
        try {
            repository.save(execution);
        } finally {
            lockManager.release(execution.getDeploymentId(), execution.getExecutionId());
        }
    }

    private void drive(RollbackExecution execution, RollbackExecutionContext context) {
        try {
            rollbackExecutor.execute(execution, context);
        } catch (RuntimeException e) {
            logger.error("[RollbackOrchestrator] 回滚驱动异常: executionId={}, deploymentId={}",
                    execution.getExecutionId(), execution.getDeploymentId(), e);
        } finally {
            active.remove(execution.getExecutionId());
            lockManager.release(execution.getDeploymentId(), execution.getExecutionId());
            updateActiveGauge();
            logger.info("[RollbackOrchestrator] 回滚结束: executionId={}, status={}, duration={}min",
                    execution.getExecutionId(), execution.getStatus().getCode(),
                    String.format("%.2f", execution.getDurationMinutes()));
        }
    }

    /**
     * 目标兼容性校验（dry-run，不创建执行）
     * <p>
     * 步骤记录按目标名称归属，同一请求内目标名称必须唯一；未命名目标默认使用服务名，
     * 同一服务的多个目标需要显式命名
     *
     * @return 错误信息，空列表表示全部可执行
     */
    public List<String> validateTargets(List<RollbackTarget> targets) {
        List<String> errors = new ArrayList<>();
        if (targets == null) {
            return errors;
        }
        Set<String> names = new HashSet<>();
        for (RollbackTarget target : targets) {
            if (target == null) {
                errors.add("目标不能为空");
                continue;
            }
            if (!names.add(target.name())) {
                errors.add("目标名称重复: " + target.name());
            }
            errors.addAll(adapterRegistry.validate(target));
        }
        return errors;
    }

    /**
     * 查询执行状态（进行中的返回实时快照）
     */
    public Optional<RollbackExecution> getRollbackStatus(ExecutionId executionId) {
        ActiveExecution running = active.get(executionId);
        if (running != null) {
            return Optional.of(running.execution().snapshot());
        }
        return repository.findById(executionId);
    }

    /**
     * 部署的回滚历史（最近的在前）
     */
    public List<RollbackExecution> getRollbackHistory(DeploymentId deploymentId) {
        return repository.findByDeployment(deploymentId);
    }

    /**
     * 请求取消（协作式：进行中的步骤自然结束后不再调度新步骤）
     *
     * @return false 表示执行不存在或已是终态
     */
    public boolean cancelRollback(ExecutionId executionId, String requestedBy) {
        ActiveExecution running = active.get(executionId);
        if (running == null) {
            logger.warn("[RollbackOrchestrator] 取消失败，执行不存在或已结束: {}", executionId);
            return false;
        }
        if (!running.execution().requestCancel(requestedBy)) {
            return false;
        }
        running.context().requestCancel();
        repository.save(running.execution());
        logger.info("[RollbackOrchestrator] 已请求取消: executionId={}, requestedBy={}", executionId, requestedBy);
        return true;
    }

    /**
     * 部署当前的非终态执行
     */
    public Optional<RollbackExecution> getActiveExecution(DeploymentId deploymentId) {
        Optional<RollbackExecution> local = active.values().stream()
                .map(ActiveExecution::execution)
                .filter(e -> e.getDeploymentId().equals(deploymentId))
                .findFirst()
                .map(RollbackExecution::snapshot);
        if (local.isPresent()) {
            return local;
        }
        // 其他实例持有的锁
        return lockManager.currentHolder(deploymentId)
                .flatMap(repository::findById)
                .filter(e -> !e.isTerminal());
    }

    public boolean hasActiveExecution(DeploymentId deploymentId) {
        return getActiveExecution(deploymentId).isPresent();
    }

    public List<RollbackExecution> getActiveExecutions() {
        return active.values().stream().map(a -> a.execution().snapshot()).toList();
    }

    public int getActiveCount() {
        return active.size();
    }

    public long getTotalCount() {
        return repository.count();
    }

    /**
     * 停止接收新请求，等待进行中的执行结束；超时后请求取消
     */
    public void shutdown() {
        shuttingDown = true;
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("[RollbackOrchestrator] {} 内仍有 {} 个执行未结束，请求取消", shutdownTimeout, active.size());
                active.keySet().forEach(id -> cancelRollback(id, "shutdown"));
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
        logger.info("[RollbackOrchestrator] 已关闭");
    }

    private void updateActiveGauge() {
        metrics.setGauge("rollback_active", active.size());
    }

    private record ActiveExecution(RollbackExecution execution, RollbackExecutionContext context) {
    }
}
