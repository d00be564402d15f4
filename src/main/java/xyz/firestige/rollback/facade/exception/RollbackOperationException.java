package xyz.firestige.rollback.facade.exception;

import xyz.firestige.rollback.domain.shared.exception.FailureInfo;

/**
 * 回滚操作异常
 * 请求被拒绝或操作无法执行时抛出
 */
public class RollbackOperationException extends RuntimeException {

    private final FailureInfo failureInfo;

    public RollbackOperationException(String message, FailureInfo failureInfo) {
        super(message);
        this.failureInfo = failureInfo;
    }

    public RollbackOperationException(String message, FailureInfo failureInfo, Throwable cause) {
        super(message, cause);
        this.failureInfo = failureInfo;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
