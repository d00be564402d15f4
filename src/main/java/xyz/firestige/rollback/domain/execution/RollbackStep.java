package xyz.firestige.rollback.domain.execution;

import xyz.firestige.rollback.domain.shared.exception.FailureInfo;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 一条回滚步骤记录（不可变）
 * <p>
 * 写入 RollbackExecution 后不再修改；重试时追加一条 attempt 更大的新记录。
 *
 * @param sequence   在执行内的追加序号（从 1 开始）
 * @param targetName 所属目标
 * @param stepName   步骤名称
 * @param attempt    第几次尝试（从 1 开始）
 */
public record RollbackStep(
        int sequence,
        String targetName,
        ServiceType service,
        String stepName,
        int attempt,
        StepOutcome outcome,
        String message,
        FailureInfo failureInfo,
        LocalDateTime startedAt,
        LocalDateTime finishedAt) {

    public RollbackStep {
        Objects.requireNonNull(targetName, "targetName cannot be null");
        Objects.requireNonNull(stepName, "stepName cannot be null");
        Objects.requireNonNull(outcome, "outcome cannot be null");
    }

    public boolean isSucceeded() {
        return outcome == StepOutcome.SUCCEEDED;
    }

    public boolean isFailed() {
        return outcome == StepOutcome.FAILED;
    }

    /**
     * 失败原因（便于运维按目标执行手工恢复）
     */
    public String getFailureReason() {
        return failureInfo != null ? failureInfo.getErrorMessage() : null;
    }
}
