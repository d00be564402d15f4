package xyz.firestige.rollback.infrastructure.persistence.execution;

import xyz.firestige.rollback.domain.execution.ExecutionStatus;
import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackStep;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.RollbackTrigger;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.shared.exception.FailureInfo;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 回滚执行的持久化文档（JSON）
 * <p>
 * steps 按追加顺序存储，读回后顺序不变
 */
public class RollbackExecutionDocument {

    private String executionId;
    private RollbackTrigger trigger;
    private List<RollbackTarget> requestedTargets = new ArrayList<>();
    private List<RollbackTarget> targets = new ArrayList<>();
    private ExecutionStatus status;
    private List<RollbackStep> steps = new ArrayList<>();
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Double durationMinutes;
    private FailureInfo failureInfo;
    private HealthStatus verificationStatus;
    private String verificationMessage;
    private String cancelRequestedBy;

    public static RollbackExecutionDocument from(RollbackExecution execution) {
        RollbackExecutionDocument doc = new RollbackExecutionDocument();
        doc.executionId = execution.getExecutionId().getValue();
        doc.trigger = execution.getTrigger();
        doc.requestedTargets = new ArrayList<>(execution.getRequestedTargets());
        doc.targets = new ArrayList<>(execution.getTargets());
        doc.status = execution.getStatus();
        doc.steps = new ArrayList<>(execution.getSteps());
        doc.startedAt = execution.getStartedAt();
        doc.completedAt = execution.getCompletedAt();
        doc.durationMinutes = execution.isTerminal() ? execution.getDurationMinutes() : null;
        doc.failureInfo = execution.getFailureInfo();
        doc.verificationStatus = execution.getVerificationStatus();
        doc.verificationMessage = execution.getVerificationMessage();
        doc.cancelRequestedBy = execution.getCancelRequestedBy();
        return doc;
    }

    public RollbackExecution toAggregate() {
        return RollbackExecution.restore(ExecutionId.ofTrusted(executionId), trigger, requestedTargets, targets,
                status, steps, startedAt, completedAt, durationMinutes, failureInfo,
                verificationStatus, verificationMessage, cancelRequestedBy);
    }

    // Getters and Setters

    public String getExecutionId() { return executionId; }
    public void setExecutionId(String executionId) { this.executionId = executionId; }
    public RollbackTrigger getTrigger() { return trigger; }
    public void setTrigger(RollbackTrigger trigger) { this.trigger = trigger; }
    public List<RollbackTarget> getRequestedTargets() { return requestedTargets; }
    public void setRequestedTargets(List<RollbackTarget> requestedTargets) { this.requestedTargets = requestedTargets; }
    public List<RollbackTarget> getTargets() { return targets; }
    public void setTargets(List<RollbackTarget> targets) { this.targets = targets; }
    public ExecutionStatus getStatus() { return status; }
    public void setStatus(ExecutionStatus status) { this.status = status; }
    public List<RollbackStep> getSteps() { return steps; }
    public void setSteps(List<RollbackStep> steps) { this.steps = steps; }
    public LocalDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(LocalDateTime startedAt) { this.startedAt = startedAt; }
    public LocalDateTime getCompletedAt() { return completedAt; }
    public void setCompletedAt(LocalDateTime completedAt) { this.completedAt = completedAt; }
    public Double getDurationMinutes() { return durationMinutes; }
    public void setDurationMinutes(Double durationMinutes) { this.durationMinutes = durationMinutes; }
    public FailureInfo getFailureInfo() { return failureInfo; }
    public void setFailureInfo(FailureInfo failureInfo) { this.failureInfo = failureInfo; }
    public HealthStatus getVerificationStatus() { return verificationStatus; }
    public void setVerificationStatus(HealthStatus verificationStatus) { this.verificationStatus = verificationStatus; }
    public String getVerificationMessage() { return verificationMessage; }
    public void setVerificationMessage(String verificationMessage) { this.verificationMessage = verificationMessage; }
    public String getCancelRequestedBy() { return cancelRequestedBy; }
    public void setCancelRequestedBy(String cancelRequestedBy) { this.cancelRequestedBy = cancelRequestedBy; }
}
