package xyz.firestige.rollback.facade;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.List;

/**
 * 人工回滚请求（CLI / 运维入口）
 */
public class ManualRollbackRequest {

    @NotBlank(message = "deploymentId 不能为空")
    private String deploymentId;

    /**
     * 为空时使用配置的环境
     */
    private String environment;

    @NotBlank(message = "reason 不能为空")
    @Size(max = 500, message = "reason 不能超过 500 个字符")
    private String reason;

    /**
     * 只回滚这些服务，为空表示全部
     */
    private List<String> services = new ArrayList<>();

    private boolean preserveLogs;

    public ManualRollbackRequest() {
    }

    public ManualRollbackRequest(String deploymentId, String environment, String reason) {
        this.deploymentId = deploymentId;
        this.environment = environment;
        this.reason = reason;
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public void setDeploymentId(String deploymentId) {
        this.deploymentId = deploymentId;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public List<String> getServices() {
        return services;
    }

    public void setServices(List<String> services) {
        this.services = services;
    }

    public boolean isPreserveLogs() {
        return preserveLogs;
    }

    public void setPreserveLogs(boolean preserveLogs) {
        this.preserveLogs = preserveLogs;
    }
}
