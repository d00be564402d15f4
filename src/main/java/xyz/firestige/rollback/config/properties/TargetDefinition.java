package xyz.firestige.rollback.config.properties;

import jakarta.validation.constraints.NotNull;
import xyz.firestige.rollback.domain.execution.RollbackStrategy;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.ServiceType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 配置中的回滚目标
 */
public class TargetDefinition {

    private String name;
    @NotNull
    private ServiceType service;
    /** 为空时使用 rollback.integration.environment */
    private String environment;
    @NotNull
    private RollbackStrategy strategy;
    private Map<String, Object> options = new LinkedHashMap<>();

    public RollbackTarget toTarget(String defaultEnvironment) {
        String env = environment != null && !environment.isBlank() ? environment : defaultEnvironment;
        return RollbackTarget.of(name, service, env, strategy, options);
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public ServiceType getService() { return service; }
    public void setService(ServiceType service) { this.service = service; }
    public String getEnvironment() { return environment; }
    public void setEnvironment(String environment) { this.environment = environment; }
    public RollbackStrategy getStrategy() { return strategy; }
    public void setStrategy(RollbackStrategy strategy) { this.strategy = strategy; }
    public Map<String, Object> getOptions() { return options; }
    public void setOptions(Map<String, Object> options) { this.options = options; }
}
