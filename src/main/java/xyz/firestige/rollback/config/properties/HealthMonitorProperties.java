package xyz.firestige.rollback.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckDefinition;
import xyz.firestige.rollback.domain.health.RuleAction;

import java.util.ArrayList;
import java.util.List;

/**
 * 健康监控配置属性
 * prefix: rollback.monitor
 * <p>
 * 规则条件是结构化的：
 * <pre>
 * rules:
 *   - rule-id: backend_failures
 *     action: rollback
 *     priority: 1
 *     cooldown-minutes: 30
 *     condition:
 *       type: any
 *       conditions:
 *         - function: failure_count
 *           service: backend
 *           window: 5
 *           operator: "&gt;="
 *           threshold: 3
 * </pre>
 * 未配置任何规则时使用内置默认规则
 */
@ConfigurationProperties(prefix = "rollback.monitor")
@Validated
public class HealthMonitorProperties {

    private boolean enabled = true;

    @Min(1)
    private int monitoringIntervalSeconds = 30;

    @Min(1)
    private int metricsRetentionMinutes = 60;

    @Min(1)
    private int probeThreads = 4;

    /** 没有配置规则时是否启用默认规则 */
    private boolean defaultRulesEnabled = true;

    @Valid
    private List<HealthCheckDefinition> checks = new ArrayList<>();

    @Valid
    private List<RuleDefinition> rules = new ArrayList<>();

    public static class RuleDefinition {
        @NotBlank
        private String ruleId;
        private String name;
        @NotNull
        private RuleAction action;
        private int priority = 1;
        @Min(0)
        private int cooldownMinutes = 30;
        private boolean enabled = true;
        /** 动作涉及的服务（preserve_logs 的日志范围） */
        private List<String> services = new ArrayList<>();
        @Valid
        @NotNull
        private ConditionDefinition condition;

        public String getRuleId() { return ruleId; }
        public void setRuleId(String ruleId) { this.ruleId = ruleId; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public RuleAction getAction() { return action; }
        public void setAction(RuleAction action) { this.action = action; }
        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }
        public int getCooldownMinutes() { return cooldownMinutes; }
        public void setCooldownMinutes(int cooldownMinutes) { this.cooldownMinutes = cooldownMinutes; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public List<String> getServices() { return services; }
        public void setServices(List<String> services) { this.services = services; }
        public ConditionDefinition getCondition() { return condition; }
        public void setCondition(ConditionDefinition condition) { this.condition = condition; }
    }

    /**
     * 条件定义：type=threshold（默认）时使用 function/service/window/operator/threshold，
     * type=all / any 时使用 conditions
     */
    public static class ConditionDefinition {
        private String type = "threshold";
        private String function;
        private String service;
        private CheckType checkType;
        private int window = 5;
        private List<String> services = new ArrayList<>();
        private String operator = ">=";
        private Double threshold;
        private List<ConditionDefinition> conditions = new ArrayList<>();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getFunction() { return function; }
        public void setFunction(String function) { this.function = function; }
        public String getService() { return service; }
        public void setService(String service) { this.service = service; }
        public CheckType getCheckType() { return checkType; }
        public void setCheckType(CheckType checkType) { this.checkType = checkType; }
        public int getWindow() { return window; }
        public void setWindow(int window) { this.window = window; }
        public List<String> getServices() { return services; }
        public void setServices(List<String> services) { this.services = services; }
        public String getOperator() { return operator; }
        public void setOperator(String operator) { this.operator = operator; }
        public Double getThreshold() { return threshold; }
        public void setThreshold(Double threshold) { this.threshold = threshold; }
        public List<ConditionDefinition> getConditions() { return conditions; }
        public void setConditions(List<ConditionDefinition> conditions) { this.conditions = conditions; }
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getMonitoringIntervalSeconds() { return monitoringIntervalSeconds; }
    public void setMonitoringIntervalSeconds(int monitoringIntervalSeconds) { this.monitoringIntervalSeconds = monitoringIntervalSeconds; }

    public int getMetricsRetentionMinutes() { return metricsRetentionMinutes; }
    public void setMetricsRetentionMinutes(int metricsRetentionMinutes) { this.metricsRetentionMinutes = metricsRetentionMinutes; }

    public int getProbeThreads() { return probeThreads; }
    public void setProbeThreads(int probeThreads) { this.probeThreads = probeThreads; }

    public boolean isDefaultRulesEnabled() { return defaultRulesEnabled; }
    public void setDefaultRulesEnabled(boolean defaultRulesEnabled) { this.defaultRulesEnabled = defaultRulesEnabled; }

    public List<HealthCheckDefinition> getChecks() { return checks; }
    public void setChecks(List<HealthCheckDefinition> checks) { this.checks = checks; }

    public List<RuleDefinition> getRules() { return rules; }
    public void setRules(List<RuleDefinition> rules) { this.rules = rules; }
}
