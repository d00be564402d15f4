package xyz.firestige.rollback.domain.execution;

/**
 * 单个回滚步骤的结果
 */
public enum StepOutcome {

    SUCCEEDED("成功"),

    FAILED("失败"),

    /**
     * 前序目标失败且策略要求严格顺序时跳过
     */
    SKIPPED("已跳过");

    private final String description;

    StepOutcome(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public String getCode() {
        return name().toLowerCase();
    }
}
