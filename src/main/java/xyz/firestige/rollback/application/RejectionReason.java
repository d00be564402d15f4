package xyz.firestige.rollback.application;

/**
 * initiate_rollback 同步拒绝的原因
 */
public enum RejectionReason {

    VALIDATION_ERROR("validation_error", "目标校验失败"),

    CONCURRENT_EXECUTION_EXISTS("concurrent_execution_exists", "部署已有进行中的回滚"),

    NO_VALID_TARGETS("no_valid_targets", "没有可执行的目标");

    private final String code;
    private final String description;

    RejectionReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
