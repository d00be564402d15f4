package xyz.firestige.rollback.infrastructure.external.redis;

import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.rollback.infrastructure.external.VersionRegistry;

import java.util.Optional;

/**
 * 基于 Redis Hash 的版本登记
 * <p>
 * Hash: {namespace}:stable-version:{service}，field = platform，value = 版本号。
 * Redis 中没有记录时回退到 fallback。
 */
public class RedisVersionRegistry implements VersionRegistry {

    private final StringRedisTemplate redisTemplate;
    private final String namespace;
    private final VersionRegistry fallback;

    public RedisVersionRegistry(StringRedisTemplate redisTemplate, String namespace, VersionRegistry fallback) {
        this.redisTemplate = redisTemplate;
        this.namespace = (namespace == null || namespace.isBlank()) ? "rollback" : namespace;
        this.fallback = fallback;
    }

    @Override
    public Optional<String> previousStableVersion(String service, String platform) {
        Object value = redisTemplate.opsForHash().get(namespace + ":stable-version:" + service, platform);
        if (value != null && !value.toString().isBlank()) {
            return Optional.of(value.toString());
        }
        return fallback != null ? fallback.previousStableVersion(service, platform) : Optional.empty();
    }
}
