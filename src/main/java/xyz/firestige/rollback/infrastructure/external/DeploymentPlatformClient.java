package xyz.firestige.rollback.infrastructure.external;

import java.util.List;

/**
 * 部署平台（容器编排）客户端
 * <p>
 * 所有方法都是可能失败的外部调用，失败时抛出运行时异常，由适配器转换为 AdapterError
 */
public interface DeploymentPlatformClient {

    /**
     * 将流量切换到指定环境
     */
    void switchTraffic(String environment, String targetVersion);

    /**
     * 列出服务的运行实例 ID
     */
    List<String> listInstances(String service);

    /**
     * 将实例替换为目标版本
     */
    void replaceInstance(String instanceId, String targetVersion);

    /**
     * 下线环境（蓝绿回滚校验通过且不要求保留失败环境时调用）
     */
    void teardownEnvironment(String environment);
}
