package xyz.firestige.rollback.infrastructure.adapter;

import xyz.firestige.rollback.domain.execution.StepOutcome;

import java.util.Objects;

/**
 * 单个步骤的执行结果
 * <p>
 * 适配器通过返回值报告失败，不向编排层抛出异常
 */
public record StepResult(StepOutcome outcome, String message, AdapterError error) {

    public StepResult {
        Objects.requireNonNull(outcome, "outcome cannot be null");
        if (outcome == StepOutcome.FAILED && error == null) {
            throw new IllegalArgumentException("失败的步骤结果必须携带 AdapterError");
        }
    }

    public static StepResult success(String message) {
        return new StepResult(StepOutcome.SUCCEEDED, message, null);
    }

    public static StepResult failure(AdapterError error) {
        return new StepResult(StepOutcome.FAILED, error.reason(), error);
    }

    public static StepResult skipped(String message) {
        return new StepResult(StepOutcome.SKIPPED, message, null);
    }

    public boolean isSuccess() {
        return outcome == StepOutcome.SUCCEEDED;
    }

    public boolean isFailure() {
        return outcome == StepOutcome.FAILED;
    }

    public boolean isRetryable() {
        return error != null && error.retryable();
    }
}
