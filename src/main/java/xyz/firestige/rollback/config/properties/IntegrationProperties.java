package xyz.firestige.rollback.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * 监控与回滚集成配置属性
 * prefix: rollback.integration
 * <p>
 * auto-rollback-targets 决定健康规则触发的自动回滚范围，通常比 manual-rollback-targets 窄：
 * 除非显式配置，自动回滚不包含数据库
 */
@ConfigurationProperties(prefix = "rollback.integration")
@Validated
public class IntegrationProperties {

    private boolean enabled = true;

    @NotBlank
    private String deploymentId = "default";

    @NotBlank
    private String environment = "production";

    /** 被监控的服务（preserve_logs 的默认范围） */
    private List<String> services = new ArrayList<>(List.of("backend", "frontend", "database"));

    /** 关闭后 rollback 规则降级为告警 */
    private boolean autoRollbackEnabled = true;

    /** 开启后 rollback 规则只发审批告警，不自动提交 */
    private boolean requireManualApproval = false;

    /** 自动回滚前先保全日志 */
    private boolean preserveLogsBeforeRollback = true;

    /** 活跃执行超过该时长发出一次慢回滚告警 */
    @Min(1)
    private int verificationTimeoutMinutes = 10;

    /** 回滚结束后的稳定性观察窗口 */
    @Min(1)
    private int postRollbackMonitoringMinutes = 30;

    /** 观察窗口内连续健康报告达到该数量视为稳定 */
    @Min(1)
    private int stableReportsRequired = 5;

    @Min(1)
    private int supervisionIntervalSeconds = 60;

    @NotBlank
    private String alertChannel = "ops-alerts";

    @Valid
    private List<TargetDefinition> autoRollbackTargets = new ArrayList<>();

    @Valid
    private List<TargetDefinition> manualRollbackTargets = new ArrayList<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getDeploymentId() { return deploymentId; }
    public void setDeploymentId(String deploymentId) { this.deploymentId = deploymentId; }

    public String getEnvironment() { return environment; }
    public void setEnvironment(String environment) { this.environment = environment; }

    public List<String> getServices() { return services; }
    public void setServices(List<String> services) { this.services = services; }

    public boolean isAutoRollbackEnabled() { return autoRollbackEnabled; }
    public void setAutoRollbackEnabled(boolean autoRollbackEnabled) { this.autoRollbackEnabled = autoRollbackEnabled; }

    public boolean isRequireManualApproval() { return requireManualApproval; }
    public void setRequireManualApproval(boolean requireManualApproval) { this.requireManualApproval = requireManualApproval; }

    public boolean isPreserveLogsBeforeRollback() { return preserveLogsBeforeRollback; }
    public void setPreserveLogsBeforeRollback(boolean preserveLogsBeforeRollback) { this.preserveLogsBeforeRollback = preserveLogsBeforeRollback; }

    public int getVerificationTimeoutMinutes() { return verificationTimeoutMinutes; }
    public void setVerificationTimeoutMinutes(int verificationTimeoutMinutes) { this.verificationTimeoutMinutes = verificationTimeoutMinutes; }

    public int getPostRollbackMonitoringMinutes() { return postRollbackMonitoringMinutes; }
    public void setPostRollbackMonitoringMinutes(int postRollbackMonitoringMinutes) { this.postRollbackMonitoringMinutes = postRollbackMonitoringMinutes; }

    public int getStableReportsRequired() { return stableReportsRequired; }
    public void setStableReportsRequired(int stableReportsRequired) { this.stableReportsRequired = stableReportsRequired; }

    public int getSupervisionIntervalSeconds() { return supervisionIntervalSeconds; }
    public void setSupervisionIntervalSeconds(int supervisionIntervalSeconds) { this.supervisionIntervalSeconds = supervisionIntervalSeconds; }

    public String getAlertChannel() { return alertChannel; }
    public void setAlertChannel(String alertChannel) { this.alertChannel = alertChannel; }

    public List<TargetDefinition> getAutoRollbackTargets() { return autoRollbackTargets; }
    public void setAutoRollbackTargets(List<TargetDefinition> autoRollbackTargets) { this.autoRollbackTargets = autoRollbackTargets; }

    public List<TargetDefinition> getManualRollbackTargets() { return manualRollbackTargets; }
    public void setManualRollbackTargets(List<TargetDefinition> manualRollbackTargets) { this.manualRollbackTargets = manualRollbackTargets; }
}
