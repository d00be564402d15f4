package xyz.firestige.rollback.domain.health;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 健康检查定义（启动时从配置加载，运行期不变）
 * <p>
 * 不同检查类型使用的字段：
 * - http_response: endpointUrl, expectedStatus, latencyWarningMs
 * - database_connection: query
 * - system_resource: resource (cpu/memory/disk), path（disk 时）
 * - custom: command
 * thresholdWarning / thresholdCritical 作用于 system_resource 和 custom 的数值结果
 */
public class HealthCheckDefinition {

    @NotBlank
    private String checkId;

    @NotBlank
    private String service;

    private String name;

    @NotNull
    private CheckType type;

    private String endpointUrl;
    private int expectedStatus = 200;
    private long latencyWarningMs = 2000;

    private String query = "SELECT 1";

    private String resource;
    private String path = "/";

    private String command;

    @Min(1)
    private int intervalSeconds = 30;
    @Min(1)
    private int timeoutSeconds = 10;

    private boolean enabled = true;

    private Double thresholdWarning;
    private Double thresholdCritical;

    public HealthCheckDefinition() {
    }

    public HealthCheckDefinition(String checkId, String service, CheckType type) {
        this.checkId = checkId;
        this.service = service;
        this.type = type;
    }

    public String getDisplayName() {
        return name != null ? name : checkId;
    }

    // Getters and Setters

    public String getCheckId() {
        return checkId;
    }

    public void setCheckId(String checkId) {
        this.checkId = checkId;
    }

    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public CheckType getType() {
        return type;
    }

    public void setType(CheckType type) {
        this.type = type;
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    public void setEndpointUrl(String endpointUrl) {
        this.endpointUrl = endpointUrl;
    }

    public int getExpectedStatus() {
        return expectedStatus;
    }

    public void setExpectedStatus(int expectedStatus) {
        this.expectedStatus = expectedStatus;
    }

    public long getLatencyWarningMs() {
        return latencyWarningMs;
    }

    public void setLatencyWarningMs(long latencyWarningMs) {
        this.latencyWarningMs = latencyWarningMs;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getResource() {
        return resource;
    }

    public void setResource(String resource) {
        this.resource = resource;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public int getIntervalSeconds() {
        return intervalSeconds;
    }

    public void setIntervalSeconds(int intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Double getThresholdWarning() {
        return thresholdWarning;
    }

    public void setThresholdWarning(Double thresholdWarning) {
        this.thresholdWarning = thresholdWarning;
    }

    public Double getThresholdCritical() {
        return thresholdCritical;
    }

    public void setThresholdCritical(Double thresholdCritical) {
        this.thresholdCritical = thresholdCritical;
    }

    @Override
    public String toString() {
        return "HealthCheckDefinition{" +
                "checkId='" + checkId + '\'' +
                ", service='" + service + '\'' +
                ", type=" + type +
                ", intervalSeconds=" + intervalSeconds +
                ", enabled=" + enabled +
                '}';
    }
}
