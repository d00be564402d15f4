package xyz.firestige.rollback.infrastructure.external.rest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.rollback.infrastructure.external.HttpHealthClient;
import xyz.firestige.rollback.infrastructure.external.HttpProbeResponse;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 RestTemplate 的 HTTP 健康探测
 * <p>
 * 每种超时配置缓存一个 RestTemplate；非 2xx 响应不抛异常，交给调用方判断状态码
 */
public class RestTemplateHttpHealthClient implements HttpHealthClient {

    private static final Logger log = LoggerFactory.getLogger(RestTemplateHttpHealthClient.class);

    private final Map<Duration, RestTemplate> templates = new ConcurrentHashMap<>();

    @Override
    public HttpProbeResponse check(String url, Duration timeout) {
        RestTemplate restTemplate = templates.computeIfAbsent(timeout, this::createTemplate);
        long start = System.nanoTime();
        ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
        long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        log.debug("健康探测 GET {} → {} (耗时 {}ms)", url, response.getStatusCode().value(), latencyMs);
        return new HttpProbeResponse(response.getStatusCode().value(), latencyMs, response.getBody());
    }

    private RestTemplate createTemplate(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        RestTemplate restTemplate = new RestTemplate(factory);
        restTemplate.setErrorHandler(new DefaultResponseErrorHandler() {
            @Override
            public boolean hasError(ClientHttpResponse response) {
                return false;
            }
        });
        return restTemplate;
    }
}
