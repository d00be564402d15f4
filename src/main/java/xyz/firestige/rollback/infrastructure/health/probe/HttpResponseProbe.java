package xyz.firestige.rollback.infrastructure.health.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckDefinition;
import xyz.firestige.rollback.domain.health.HealthCheckResult;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.infrastructure.external.HttpHealthClient;
import xyz.firestige.rollback.infrastructure.external.HttpProbeResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * http_response：状态码不符或请求失败为 critical，延迟超过 latencyWarningMs 为 warning
 */
public class HttpResponseProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpResponseProbe.class);

    private final HttpHealthClient client;
    private final Clock clock;

    public HttpResponseProbe(HttpHealthClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    @Override
    public CheckType getType() {
        return CheckType.HTTP_RESPONSE;
    }

    @Override
    public HealthCheckResult probe(HealthCheckDefinition check) {
        try {
            HttpProbeResponse response = client.check(check.getEndpointUrl(), Duration.ofSeconds(check.getTimeoutSeconds()));
            LocalDateTime now = LocalDateTime.now(clock);
            if (!response.hasStatus(check.getExpectedStatus())) {
                return HealthCheckResult.of(check, HealthStatus.CRITICAL, response.latencyMs(), now,
                        String.format("状态码 %d，期望 %d", response.statusCode(), check.getExpectedStatus()));
            }
            if (response.latencyMs() > check.getLatencyWarningMs()) {
                return HealthCheckResult.of(check, HealthStatus.WARNING, response.latencyMs(), now,
                        String.format("响应延迟 %dms 超过 %dms", response.latencyMs(), check.getLatencyWarningMs()));
            }
            return HealthCheckResult.of(check, HealthStatus.HEALTHY, response.latencyMs(), now, "OK");
        } catch (Exception e) {
            log.debug("HTTP 探测失败: {}, url: {}", check.getCheckId(), check.getEndpointUrl(), e);
            return HealthCheckResult.of(check, HealthStatus.CRITICAL, -1, LocalDateTime.now(clock),
                    "请求失败: " + e.getMessage());
        }
    }
}
