package xyz.firestige.rollback.domain.execution;

import xyz.firestige.rollback.domain.execution.event.RollbackExecutionEvent;
import xyz.firestige.rollback.domain.execution.event.RollbackStartedEvent;
import xyz.firestige.rollback.domain.execution.event.RollbackStepRecordedEvent;
import xyz.firestige.rollback.domain.execution.event.RollbackTerminatedEvent;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.domain.shared.exception.FailureInfo;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 回滚执行聚合根
 * <p>
 * 职责：
 * 1. 管理执行生命周期和状态转换
 * 2. 保护不变式：steps 只追加不改写；终态之后不可变
 * 3. 收集领域事件，由执行器在状态变化后统一发布
 * <p>
 * 同一 tier 的目标并发执行时会并发追加步骤，所有变更方法都是 synchronized 的。
 */
public class RollbackExecution {

    private final ExecutionId executionId;
    private final RollbackTrigger trigger;

    /**
     * 提交时的目标集合（未排序）
     */
    private final List<RollbackTarget> requestedTargets;

    /**
     * 依赖解析后的目标顺序
     */
    private List<RollbackTarget> targets;

    private ExecutionStatus status;
    private final List<RollbackStep> steps = new ArrayList<>();

    private final LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Double durationMinutes;

    /**
     * 终态原因（failed / cancelled / 校验未通过）
     */
    private FailureInfo failureInfo;

    /**
     * 回滚后健康校验结果（未校验时为 null）
     */
    private HealthStatus verificationStatus;
    private String verificationMessage;

    private String cancelRequestedBy;

    private final List<RollbackExecutionEvent> domainEvents = new ArrayList<>();

    private RollbackExecution(ExecutionId executionId, RollbackTrigger trigger,
                              List<RollbackTarget> requestedTargets, LocalDateTime startedAt) {
        this.executionId = Objects.requireNonNull(executionId, "executionId cannot be null");
        this.trigger = Objects.requireNonNull(trigger, "trigger cannot be null");
        this.requestedTargets = List.copyOf(requestedTargets);
        this.targets = List.copyOf(requestedTargets);
        this.startedAt = startedAt;
        this.status = ExecutionStatus.PENDING;
    }

    /**
     * 创建新的执行记录（PENDING）
     */
    public static RollbackExecution create(ExecutionId executionId, RollbackTrigger trigger,
                                           List<RollbackTarget> targets, LocalDateTime startedAt) {
        return new RollbackExecution(executionId, trigger, targets, startedAt);
    }

    /**
     * 从持久化数据重建（不产生事件，不做状态校验）
     */
    public static RollbackExecution restore(ExecutionId executionId, RollbackTrigger trigger,
                                            List<RollbackTarget> requestedTargets, List<RollbackTarget> targets,
                                            ExecutionStatus status, List<RollbackStep> steps,
                                            LocalDateTime startedAt, LocalDateTime completedAt,
                                            Double durationMinutes, FailureInfo failureInfo,
                                            HealthStatus verificationStatus, String verificationMessage,
                                            String cancelRequestedBy) {
        RollbackExecution execution = new RollbackExecution(executionId, trigger, requestedTargets, startedAt);
        execution.targets = targets != null ? List.copyOf(targets) : execution.requestedTargets;
        execution.status = status;
        if (steps != null) {
            execution.steps.addAll(steps);
        }
        execution.completedAt = completedAt;
        execution.durationMinutes = durationMinutes;
        execution.failureInfo = failureInfo;
        execution.verificationStatus = verificationStatus;
        execution.verificationMessage = verificationMessage;
        execution.cancelRequestedBy = cancelRequestedBy;
        return execution;
    }

    // ============================================
    // 事件管理
    // ============================================

    public synchronized List<RollbackExecutionEvent> getDomainEvents() {
        return Collections.unmodifiableList(new ArrayList<>(domainEvents));
    }

    /**
     * 取出并清空领域事件（发布前调用）
     */
    public synchronized List<RollbackExecutionEvent> drainDomainEvents() {
        List<RollbackExecutionEvent> drained = new ArrayList<>(domainEvents);
        domainEvents.clear();
        return drained;
    }

    private void addDomainEvent(RollbackExecutionEvent event) {
        this.domainEvents.add(event);
    }

    // ============================================
    // 状态转换
    // ============================================

    /**
     * PENDING → RESOLVING
     */
    public synchronized void startResolving() {
        requireStatus(ExecutionStatus.PENDING, "开始解析依赖顺序");
        this.status = ExecutionStatus.RESOLVING;
    }

    /**
     * RESOLVING → EXECUTING，记录解析后的目标顺序
     */
    public synchronized void resolved(List<RollbackTarget> orderedTargets) {
        requireStatus(ExecutionStatus.RESOLVING, "开始执行");
        if (orderedTargets == null || orderedTargets.isEmpty()) {
            throw new IllegalStateException(
                String.format("解析后的目标为空时不能开始执行, executionId: %s", executionId)
            );
        }
        this.targets = List.copyOf(orderedTargets);
        this.status = ExecutionStatus.EXECUTING;
        addDomainEvent(new RollbackStartedEvent(executionId, getDeploymentId(), trigger.reason(), this.targets));
    }

    /**
     * 追加步骤记录
     * <p>
     * 只允许在 EXECUTING 状态追加；sequence 由聚合统一分配。
     *
     * @return 实际写入的记录
     */
    public synchronized RollbackStep appendStep(RollbackStep draft) {
        requireStatus(ExecutionStatus.EXECUTING, "追加步骤");
        RollbackStep recorded = new RollbackStep(
                steps.size() + 1,
                draft.targetName(),
                draft.service(),
                draft.stepName(),
                draft.attempt(),
                draft.outcome(),
                draft.message(),
                draft.failureInfo(),
                draft.startedAt(),
                draft.finishedAt());
        steps.add(recorded);
        addDomainEvent(new RollbackStepRecordedEvent(executionId, getDeploymentId(), status, recorded));
        return recorded;
    }

    /**
     * EXECUTING → VERIFYING
     */
    public synchronized void startVerifying() {
        requireStatus(ExecutionStatus.EXECUTING, "开始回滚后校验");
        this.status = ExecutionStatus.VERIFYING;
    }

    /**
     * 记录回滚后校验结果（VERIFYING 状态）
     */
    public synchronized void recordVerification(HealthStatus healthStatus, String message) {
        requireStatus(ExecutionStatus.VERIFYING, "记录校验结果");
        this.verificationStatus = healthStatus;
        this.verificationMessage = message;
    }

    /**
     * VERIFYING → COMPLETED
     */
    public synchronized void complete(LocalDateTime now) {
        requireStatus(ExecutionStatus.VERIFYING, "完成");
        terminate(ExecutionStatus.COMPLETED, null, "回滚完成", now);
    }

    /**
     * VERIFYING → PARTIALLY_COMPLETED
     */
    public synchronized void completePartially(FailureInfo reason, LocalDateTime now) {
        requireStatus(ExecutionStatus.VERIFYING, "部分完成");
        terminate(ExecutionStatus.PARTIALLY_COMPLETED, reason, "回滚部分完成", now);
    }

    /**
     * 任意非终态 → FAILED
     */
    public synchronized void fail(FailureInfo reason, LocalDateTime now) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                String.format("终态执行不能标记为失败，当前状态: %s, executionId: %s", status, executionId)
            );
        }
        terminate(ExecutionStatus.FAILED, reason, "回滚失败", now);
    }

    /**
     * 没有可执行的目标（RESOLVING → FAILED）
     */
    public synchronized void failNoValidTargets(String detail, LocalDateTime now) {
        requireStatus(ExecutionStatus.RESOLVING, "标记无有效目标");
        terminate(ExecutionStatus.FAILED,
                FailureInfo.of("no_valid_targets", ErrorType.VALIDATION_ERROR, detail, "resolving"),
                "没有可执行的回滚目标", now);
    }

    /**
     * 记录取消请求（协作式，由执行器在步骤边界生效）
     *
     * @return false 表示已是终态，取消无效
     */
    public synchronized boolean requestCancel(String requestedBy) {
        if (status.isTerminal()) {
            return false;
        }
        this.cancelRequestedBy = requestedBy != null ? requestedBy : "unknown";
        return true;
    }

    /**
     * 任意非终态 → CANCELLED
     * <p>
     * 已完成的步骤不会被反向执行，系统停留在部分回滚状态等待人工处理
     */
    public synchronized void cancel(LocalDateTime now) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                String.format("终态执行不能取消，当前状态: %s, executionId: %s", status, executionId)
            );
        }
        String by = cancelRequestedBy != null ? cancelRequestedBy : "unknown";
        terminate(ExecutionStatus.CANCELLED,
                FailureInfo.of("cancelled", ErrorType.BUSINESS_ERROR, "回滚被取消: " + by, currentTargetHint()),
                "回滚已取消", now);
    }

    private void terminate(ExecutionStatus terminal, FailureInfo reason, String message, LocalDateTime now) {
        this.status = terminal;
        this.failureInfo = reason;
        this.completedAt = Objects.requireNonNull(now, "completedAt cannot be null");
        this.durationMinutes = computeMinutes(completedAt);
        addDomainEvent(new RollbackTerminatedEvent(executionId, getDeploymentId(), terminal,
                message, reason, durationMinutes));
    }

    private void requireStatus(ExecutionStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(
                String.format("只有 %s 状态可以%s，当前状态: %s, executionId: %s", expected, action, status, executionId)
            );
        }
    }

    private String currentTargetHint() {
        return steps.isEmpty() ? status.getCode() : steps.get(steps.size() - 1).targetName();
    }

    private double computeMinutes(LocalDateTime end) {
        if (startedAt == null || end == null) {
            return 0.0;
        }
        return Duration.between(startedAt, end).toMillis() / 60_000.0;
    }

    // ============================================
    // 查询
    // ============================================

    /**
     * 只读快照（步骤列表独立复制，外部修改不会影响聚合）
     */
    public synchronized RollbackExecution snapshot() {
        return restore(executionId, trigger, requestedTargets, targets, status, steps,
                startedAt, completedAt, durationMinutes, failureInfo,
                verificationStatus, verificationMessage, cancelRequestedBy);
    }

    public synchronized boolean hasSucceededSteps() {
        return steps.stream().anyMatch(RollbackStep::isSucceeded);
    }

    /**
     * 指定目标是否有失败（以每个步骤的最后一次尝试为准）
     */
    public synchronized boolean isTargetFailed(String targetName) {
        return latestAttempts().stream()
                .filter(s -> s.targetName().equals(targetName))
                .anyMatch(RollbackStep::isFailed);
    }

    /**
     * 每个 (target, stepName) 的最后一次尝试
     */
    public synchronized List<RollbackStep> latestAttempts() {
        List<RollbackStep> latest = new ArrayList<>();
        for (RollbackStep step : steps) {
            latest.removeIf(s -> s.targetName().equals(step.targetName()) && s.stepName().equals(step.stepName()));
            latest.add(step);
        }
        return latest;
    }

    public ExecutionId getExecutionId() {
        return executionId;
    }

    public RollbackTrigger getTrigger() {
        return trigger;
    }

    public DeploymentId getDeploymentId() {
        return trigger.deploymentId();
    }

    public List<RollbackTarget> getRequestedTargets() {
        return requestedTargets;
    }

    public synchronized List<RollbackTarget> getTargets() {
        return targets;
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized List<RollbackStep> getSteps() {
        return List.copyOf(steps);
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public synchronized LocalDateTime getCompletedAt() {
        return completedAt;
    }

    /**
     * 执行时长（分钟）：终态时固定，否则为截至最近一个步骤结束的时长
     */
    public synchronized double getDurationMinutes() {
        if (durationMinutes != null) {
            return durationMinutes;
        }
        return steps.isEmpty() ? 0.0 : computeMinutes(steps.get(steps.size() - 1).finishedAt());
    }

    /**
     * 截至 now 的执行时长（分钟），终态时返回固定值
     */
    public synchronized double getDurationMinutes(LocalDateTime now) {
        return durationMinutes != null ? durationMinutes : computeMinutes(now);
    }

    public synchronized FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public synchronized HealthStatus getVerificationStatus() {
        return verificationStatus;
    }

    public synchronized String getVerificationMessage() {
        return verificationMessage;
    }

    public synchronized String getCancelRequestedBy() {
        return cancelRequestedBy;
    }

    @Override
    public String toString() {
        return "RollbackExecution{" +
                "executionId=" + executionId +
                ", deploymentId=" + getDeploymentId() +
                ", status=" + status +
                ", steps=" + steps.size() +
                '}';
    }
}
