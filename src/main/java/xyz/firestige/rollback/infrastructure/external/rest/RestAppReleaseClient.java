package xyz.firestige.rollback.infrastructure.external.rest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.rollback.infrastructure.external.AppReleaseClient;

import java.util.Map;

/**
 * 发布平台 HTTP 客户端
 * <p>
 * POST {baseUrl}/apps/{platform}/rollback {"version": "...", "environment": "..."}
 */
public class RestAppReleaseClient implements AppReleaseClient {

    private static final Logger log = LoggerFactory.getLogger(RestAppReleaseClient.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestAppReleaseClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public void updateRollbackMetadata(String platform, String version, String environment) {
        log.info("[Release] 更新回滚元数据, platform: {}, version: {}, environment: {}", platform, version, environment);
        restTemplate.postForEntity(baseUrl + "/apps/{platform}/rollback",
                Map.of("version", version, "environment", environment), Void.class, platform);
    }
}
