package xyz.firestige.rollback.domain.shared.exception;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * 回滚失败信息（不可变）
 * <p>
 * 挂在失败步骤、执行终态和拒绝结果上；failedAt 记录失败位置，步骤失败时为 "{target}/{step}"
 */
public final class FailureInfo {

    private final String errorCode;
    private final String errorMessage;
    private final ErrorType errorType;
    private final String failedAt;
    private final boolean retryable;
    private final LocalDateTime timestamp;

    @JsonCreator
    public FailureInfo(@JsonProperty("errorCode") String errorCode,
                       @JsonProperty("errorMessage") String errorMessage,
                       @JsonProperty("errorType") ErrorType errorType,
                       @JsonProperty("failedAt") String failedAt,
                       @JsonProperty("retryable") boolean retryable,
                       @JsonProperty("timestamp") LocalDateTime timestamp) {
        this.errorType = errorType != null ? errorType : ErrorType.UNKNOWN_ERROR;
        this.errorCode = errorCode != null ? errorCode : this.errorType.name();
        this.errorMessage = errorMessage;
        this.failedAt = failedAt;
        this.retryable = retryable;
        this.timestamp = timestamp != null ? timestamp : LocalDateTime.now();
    }

    public FailureInfo(String errorCode, String errorMessage, ErrorType errorType, String failedAt, boolean retryable) {
        this(errorCode, errorMessage, errorType, failedAt, retryable, null);
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return of(errorType, errorMessage, null);
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        return of(errorType.name(), errorType, errorMessage, failedAt);
    }

    /**
     * 可重试标记取错误类型的默认值
     */
    public static FailureInfo of(String errorCode, ErrorType errorType, String errorMessage, String failedAt) {
        return new FailureInfo(errorCode, errorMessage, errorType, failedAt, errorType.isRetryableByDefault());
    }

    /**
     * 由意外异常构造；超时归为 TIMEOUT_ERROR，IO 异常归为 NETWORK_ERROR，两者可重试，其余使用传入类型
     */
    public static FailureInfo fromException(Exception e, ErrorType fallbackType, String failedAt) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (e instanceof TimeoutException) {
            return new FailureInfo(ErrorType.TIMEOUT_ERROR.name(), message, ErrorType.TIMEOUT_ERROR, failedAt, true);
        }
        if (e instanceof IOException) {
            return new FailureInfo(ErrorType.NETWORK_ERROR.name(), message, ErrorType.NETWORK_ERROR, failedAt, true);
        }
        return new FailureInfo(fallbackType.name(), message, fallbackType, failedAt, false);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FailureInfo that)) {
            return false;
        }
        return retryable == that.retryable
                && errorCode.equals(that.errorCode)
                && Objects.equals(errorMessage, that.errorMessage)
                && errorType == that.errorType
                && Objects.equals(failedAt, that.failedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorCode, errorMessage, errorType, failedAt, retryable);
    }

    @Override
    public String toString() {
        return errorCode + "[" + errorType + (retryable ? ", retryable" : "") + "] "
                + (failedAt != null ? failedAt + ": " : "") + errorMessage;
    }
}
