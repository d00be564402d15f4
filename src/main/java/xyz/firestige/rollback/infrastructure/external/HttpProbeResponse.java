package xyz.firestige.rollback.infrastructure.external;

/**
 * 一次 HTTP 探测的响应
 */
public record HttpProbeResponse(int statusCode, long latencyMs, String body) {

    public boolean hasStatus(int expected) {
        return statusCode == expected;
    }
}
