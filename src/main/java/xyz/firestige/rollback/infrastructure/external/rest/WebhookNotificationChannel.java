package xyz.firestige.rollback.infrastructure.external.rest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.rollback.infrastructure.external.NotificationChannel;

import java.util.Map;

/**
 * Webhook 通知渠道
 * <p>
 * channel → webhook URL 由配置提供；未配置的渠道只记录日志。
 * 发送失败记录日志后返回 false，不重试。
 */
public class WebhookNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationChannel.class);

    private final RestTemplate restTemplate;
    private final Map<String, String> webhooks;

    public WebhookNotificationChannel(RestTemplate restTemplate, Map<String, String> webhooks) {
        this.restTemplate = restTemplate;
        this.webhooks = webhooks != null ? Map.copyOf(webhooks) : Map.of();
    }

    @Override
    public boolean send(String channel, String message) {
        String url = webhooks.get(channel);
        if (url == null || url.isBlank()) {
            log.warn("[Notify] 渠道未配置 webhook, channel: {}, message: {}", channel, message);
            return false;
        }
        try {
            restTemplate.postForEntity(url, Map.of("channel", channel, "text", message), String.class);
            log.info("[Notify] 通知已发送, channel: {}", channel);
            return true;
        } catch (RestClientException e) {
            log.error("[Notify] 通知发送失败, channel: {}, error: {}", channel, e.getMessage());
            return false;
        }
    }
}
