package xyz.firestige.rollback.facade;

import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackStep;
import xyz.firestige.rollback.domain.execution.RollbackTarget;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 回滚执行状态（Facade 层 DTO）
 */
public class RollbackStatusInfo {

    private String executionId;
    private String deploymentId;
    private String status;
    private String reason;
    private String triggeredBy;
    private List<String> targets;
    private List<StepInfo> steps;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private double durationMinutes;
    private String failureMessage;
    private String verificationStatus;

    public static RollbackStatusInfo from(RollbackExecution execution) {
        RollbackStatusInfo info = new RollbackStatusInfo();
        info.executionId = execution.getExecutionId().getValue();
        info.deploymentId = execution.getDeploymentId().getValue();
        info.status = execution.getStatus().getCode();
        info.reason = execution.getTrigger().reason().getCode();
        info.triggeredBy = execution.getTrigger().triggeredBy();
        info.targets = execution.getTargets().stream().map(RollbackTarget::toString).toList();
        info.steps = execution.getSteps().stream().map(StepInfo::from).toList();
        info.startedAt = execution.getStartedAt();
        info.completedAt = execution.getCompletedAt();
        info.durationMinutes = execution.getDurationMinutes();
        info.failureMessage = execution.getFailureInfo() != null ? execution.getFailureInfo().getErrorMessage() : null;
        info.verificationStatus = execution.getVerificationStatus() != null
                ? execution.getVerificationStatus().getCode()
                : null;
        return info;
    }

    /**
     * 步骤摘要
     */
    public record StepInfo(int sequence, String target, String step, int attempt, String outcome, String message) {

        static StepInfo from(RollbackStep step) {
            return new StepInfo(step.sequence(), step.targetName(), step.stepName(), step.attempt(),
                    step.outcome().getCode(), step.message());
        }
    }

    public String getExecutionId() { return executionId; }
    public String getDeploymentId() { return deploymentId; }
    public String getStatus() { return status; }
    public String getReason() { return reason; }
    public String getTriggeredBy() { return triggeredBy; }
    public List<String> getTargets() { return targets; }
    public List<StepInfo> getSteps() { return steps; }
    public LocalDateTime getStartedAt() { return startedAt; }
    public LocalDateTime getCompletedAt() { return completedAt; }
    public double getDurationMinutes() { return durationMinutes; }
    public String getFailureMessage() { return failureMessage; }
    public String getVerificationStatus() { return verificationStatus; }
}
