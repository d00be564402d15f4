package xyz.firestige.rollback.domain.execution.event;

import xyz.firestige.rollback.domain.execution.ExecutionStatus;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 回滚执行领域事件基类
 */
public abstract class RollbackExecutionEvent {

    private final String eventId;
    private final ExecutionId executionId;
    private final DeploymentId deploymentId;
    private final ExecutionStatus status;
    private final LocalDateTime occurredAt;
    private final String message;

    protected RollbackExecutionEvent(ExecutionId executionId, DeploymentId deploymentId,
                                     ExecutionStatus status, String message) {
        this.eventId = UUID.randomUUID().toString();
        this.executionId = executionId;
        this.deploymentId = deploymentId;
        this.status = status;
        this.message = message;
        this.occurredAt = LocalDateTime.now();
    }

    public String getEventId() {
        return eventId;
    }

    public ExecutionId getExecutionId() {
        return executionId;
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{executionId=" + executionId
                + ", deploymentId=" + deploymentId + ", status=" + status + ", message='" + message + "'}";
    }
}
