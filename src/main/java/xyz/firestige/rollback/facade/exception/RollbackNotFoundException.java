package xyz.firestige.rollback.facade.exception;

/**
 * 回滚执行不存在
 */
public class RollbackNotFoundException extends RuntimeException {

    public RollbackNotFoundException(String message) {
        super(message);
    }
}
