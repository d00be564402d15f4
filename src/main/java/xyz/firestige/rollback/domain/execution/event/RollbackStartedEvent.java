package xyz.firestige.rollback.domain.execution.event;

import xyz.firestige.rollback.domain.execution.ExecutionStatus;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.TriggerReason;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.util.List;

/**
 * 依赖顺序解析完成，开始执行目标
 */
public class RollbackStartedEvent extends RollbackExecutionEvent {

    private final TriggerReason reason;
    private final List<RollbackTarget> orderedTargets;

    public RollbackStartedEvent(ExecutionId executionId, DeploymentId deploymentId,
                                TriggerReason reason, List<RollbackTarget> orderedTargets) {
        super(executionId, deploymentId, ExecutionStatus.EXECUTING,
                String.format("回滚开始执行, 目标数: %d", orderedTargets.size()));
        this.reason = reason;
        this.orderedTargets = List.copyOf(orderedTargets);
    }

    public TriggerReason getReason() {
        return reason;
    }

    public List<RollbackTarget> getOrderedTargets() {
        return orderedTargets;
    }
}
