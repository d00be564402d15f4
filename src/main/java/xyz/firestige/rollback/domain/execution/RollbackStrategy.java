package xyz.firestige.rollback.domain.execution;

import java.util.Arrays;

/**
 * 回滚策略
 */
public enum RollbackStrategy {

    /**
     * 蓝绿切换：将流量指回之前标记的稳定环境
     */
    BLUE_GREEN("blue_green"),

    /**
     * 滚动回滚：按批次替换实例，批次之间做健康检查
     */
    ROLLING("rolling"),

    /**
     * 立即回滚：一次性替换全部实例
     */
    IMMEDIATE("immediate"),

    /**
     * 数据库迁移回滚：快照后应用逆向迁移
     */
    DATABASE_MIGRATION("database_migration"),

    /**
     * 前端多平台回滚：web / android / ios
     */
    FRONTEND_MULTI_PLATFORM("frontend_multi_platform");

    private final String code;

    RollbackStrategy(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static RollbackStrategy fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的回滚策略: " + code));
    }
}
