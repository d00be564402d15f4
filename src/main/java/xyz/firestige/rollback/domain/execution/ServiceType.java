package xyz.firestige.rollback.domain.execution;

import java.util.Arrays;

/**
 * 回滚目标服务类型
 * <p>
 * dependencyTier 决定默认的回滚顺序：数值越小越先执行。
 * 同一 tier 的目标之间没有顺序约束，可以并发执行。
 */
public enum ServiceType {

    /**
     * 数据库：必须先于读取它的代码回滚
     */
    DATABASE("database", 1),

    /**
     * 后端服务：接口契约稳定后前端才能回滚
     */
    BACKEND("backend", 2),

    /**
     * 前端（web / android / ios）
     */
    FRONTEND("frontend", 3),

    /**
     * 自定义目标，排在最后
     */
    CUSTOM("custom", 99);

    private final String code;
    private final int dependencyTier;

    ServiceType(String code, int dependencyTier) {
        this.code = code;
        this.dependencyTier = dependencyTier;
    }

    public String getCode() {
        return code;
    }

    public int getDependencyTier() {
        return dependencyTier;
    }

    public static ServiceType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code) || t.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的服务类型: " + code));
    }
}
