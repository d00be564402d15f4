package xyz.firestige.rollback.infrastructure.external.rest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.rollback.infrastructure.external.CdnClient;

import java.util.List;
import java.util.Map;

/**
 * CDN / 资源存储 HTTP 客户端
 * <p>
 * - POST {baseUrl}/invalidations {"paths": [...]}
 * - POST {baseUrl}/sync          {"source": "...", "destination": "..."}
 */
public class RestCdnClient implements CdnClient {

    private static final Logger log = LoggerFactory.getLogger(RestCdnClient.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestCdnClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public void invalidate(List<String> paths) {
        log.info("[CDN] 刷新缓存, paths: {}", paths);
        restTemplate.postForEntity(baseUrl + "/invalidations", Map.of("paths", paths), Void.class);
    }

    @Override
    public void sync(String sourcePrefix, String destPrefix) {
        log.info("[CDN] 同步资源, {} → {}", sourcePrefix, destPrefix);
        restTemplate.postForEntity(baseUrl + "/sync",
                Map.of("source", sourcePrefix, "destination", destPrefix), Void.class);
    }
}
