package xyz.firestige.rollback.domain.execution;

import java.util.Arrays;

/**
 * 回滚触发原因
 */
public enum TriggerReason {

    MANUAL("manual", "人工触发"),
    PERFORMANCE_DEGRADATION("performance_degradation", "性能劣化"),
    ERROR_RATE("error_rate", "错误率超阈值"),
    HEALTH_CHECK_FAILURE("health_check_failure", "健康检查失败"),
    EXTERNAL_SIGNAL("external_signal", "外部信号"),
    DEPENDENCY_FAILURE("dependency_failure", "依赖服务故障"),
    MIGRATION_FAILURE("migration_failure", "数据库迁移失败"),
    DEPLOYMENT_TIMEOUT("deployment_timeout", "部署超时");

    private final String code;
    private final String description;

    TriggerReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 按 code 解析（忽略大小写，兼容枚举名）
     *
     * @throws IllegalArgumentException 未知 code
     */
    public static TriggerReason fromCode(String code) {
        return Arrays.stream(values())
                .filter(r -> r.code.equalsIgnoreCase(code) || r.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的触发原因: " + code));
    }
}
