package xyz.firestige.rollback.infrastructure.external;

import java.time.Duration;

/**
 * HTTP 健康探测客户端
 */
public interface HttpHealthClient {

    /**
     * 请求 url 并返回状态码和延迟
     * <p>
     * 非 2xx 响应正常返回；连接失败或超时抛出异常
     */
    HttpProbeResponse check(String url, Duration timeout);
}
