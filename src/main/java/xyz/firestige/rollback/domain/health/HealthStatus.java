package xyz.firestige.rollback.domain.health;

/**
 * 健康状态
 * <p>
 * severity 越大越严重，用于合成整体状态：任一 critical 则 critical，否则任一 warning 则 warning
 */
public enum HealthStatus {

    HEALTHY("健康", 0),

    UNKNOWN("未知", 1),

    WARNING("告警", 2),

    CRITICAL("严重", 3);

    private final String description;
    private final int severity;

    HealthStatus(String description, int severity) {
        this.description = description;
        this.severity = severity;
    }

    public String getDescription() {
        return description;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * 非 healthy 即视为一次失败样本
     */
    public boolean isFailure() {
        return this != HEALTHY;
    }

    public HealthStatus worse(HealthStatus other) {
        if (other == null) {
            return this;
        }
        return other.severity > this.severity ? other : this;
    }

    public String getCode() {
        return name().toLowerCase();
    }
}
