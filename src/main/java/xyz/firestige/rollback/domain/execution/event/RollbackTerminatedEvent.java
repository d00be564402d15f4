package xyz.firestige.rollback.domain.execution.event;

import xyz.firestige.rollback.domain.execution.ExecutionStatus;
import xyz.firestige.rollback.domain.shared.exception.FailureInfo;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

/**
 * 回滚执行进入终态（completed / partially_completed / failed / cancelled）
 */
public class RollbackTerminatedEvent extends RollbackExecutionEvent {

    private final FailureInfo failureInfo;
    private final double durationMinutes;

    public RollbackTerminatedEvent(ExecutionId executionId, DeploymentId deploymentId, ExecutionStatus status,
                                   String message, FailureInfo failureInfo, double durationMinutes) {
        super(executionId, deploymentId, status, message);
        this.failureInfo = failureInfo;
        this.durationMinutes = durationMinutes;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public double getDurationMinutes() {
        return durationMinutes;
    }
}
