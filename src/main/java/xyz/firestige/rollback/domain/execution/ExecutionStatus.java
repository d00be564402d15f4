package xyz.firestige.rollback.domain.execution;

/**
 * 回滚执行状态枚举
 * <p>
 * 状态转换说明：
 * - PENDING → RESOLVING: 开始解析依赖顺序
 * - RESOLVING → EXECUTING: 顺序解析完成
 * - RESOLVING → FAILED: 没有可执行的目标（no_valid_targets）
 * - EXECUTING → VERIFYING: 所有步骤已有结果
 * - EXECUTING → FAILED: 没有任何成功步骤
 * - VERIFYING → COMPLETED / PARTIALLY_COMPLETED / FAILED
 * - 任意非终态 → CANCELLED: 显式取消
 */
public enum ExecutionStatus {

    PENDING("待执行"),

    RESOLVING("解析依赖顺序"),

    EXECUTING("执行中"),

    VERIFYING("回滚后校验"),

    COMPLETED("已完成"),

    PARTIALLY_COMPLETED("部分完成"),

    FAILED("执行失败"),

    CANCELLED("已取消");

    private final String description;

    ExecutionStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否为终态
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIALLY_COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 是否可以取消
     */
    public boolean canCancel() {
        return !isTerminal();
    }

    public String getCode() {
        return name().toLowerCase();
    }
}
