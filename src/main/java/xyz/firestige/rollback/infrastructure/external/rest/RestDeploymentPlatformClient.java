package xyz.firestige.rollback.infrastructure.external.rest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.rollback.infrastructure.external.DeploymentPlatformClient;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 部署平台 HTTP 客户端
 * <p>
 * 接口约定：
 * - POST   {baseUrl}/environments/{env}/traffic       {"version": "..."}
 * - GET    {baseUrl}/services/{service}/instances     → ["id1", "id2"]
 * - POST   {baseUrl}/instances/{id}/version           {"version": "..."}
 * - DELETE {baseUrl}/environments/{env}
 */
public class RestDeploymentPlatformClient implements DeploymentPlatformClient {

    private static final Logger log = LoggerFactory.getLogger(RestDeploymentPlatformClient.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestDeploymentPlatformClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public void switchTraffic(String environment, String targetVersion) {
        log.info("[Platform] 切换流量, environment: {}, version: {}", environment, targetVersion);
        restTemplate.postForEntity(baseUrl + "/environments/{env}/traffic",
                Map.of("version", targetVersion), Void.class, environment);
    }

    @Override
    public List<String> listInstances(String service) {
        String[] instances = restTemplate.getForObject(baseUrl + "/services/{service}/instances",
                String[].class, service);
        return instances != null ? Arrays.asList(instances) : List.of();
    }

    @Override
    public void replaceInstance(String instanceId, String targetVersion) {
        log.info("[Platform] 替换实例, instance: {}, version: {}", instanceId, targetVersion);
        restTemplate.postForEntity(baseUrl + "/instances/{id}/version",
                Map.of("version", targetVersion), Void.class, instanceId);
    }

    @Override
    public void teardownEnvironment(String environment) {
        log.info("[Platform] 下线环境, environment: {}", environment);
        restTemplate.delete(baseUrl + "/environments/{env}", environment);
    }
}
