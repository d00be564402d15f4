package xyz.firestige.rollback.domain.execution.event;

import xyz.firestige.rollback.domain.execution.ExecutionStatus;
import xyz.firestige.rollback.domain.execution.RollbackStep;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

/**
 * 追加了一条步骤记录
 */
public class RollbackStepRecordedEvent extends RollbackExecutionEvent {

    private final RollbackStep step;

    public RollbackStepRecordedEvent(ExecutionId executionId, DeploymentId deploymentId,
                                     ExecutionStatus status, RollbackStep step) {
        super(executionId, deploymentId, status,
                String.format("%s/%s: %s", step.targetName(), step.stepName(), step.outcome()));
        this.step = step;
    }

    public RollbackStep getStep() {
        return step;
    }
}
