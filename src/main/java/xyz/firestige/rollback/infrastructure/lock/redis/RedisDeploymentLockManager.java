package xyz.firestige.rollback.infrastructure.lock.redis;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;
import xyz.firestige.rollback.infrastructure.lock.DeploymentLockManager;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 部署锁 Redis 实现（分布式锁）
 * <p>
 * 使用 SET NX 原子获取锁，TTL 自动释放；释放和续租通过 Lua 脚本校验持有者
 */
public class RedisDeploymentLockManager implements DeploymentLockManager {

    private static final String DEFAULT_KEY_PREFIX = "rollback:lock:deployment:";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private static final DefaultRedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisDeploymentLockManager(StringRedisTemplate redisTemplate) {
        this(redisTemplate, DEFAULT_KEY_PREFIX);
    }

    public RedisDeploymentLockManager(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix.endsWith(":") ? keyPrefix : keyPrefix + ":";
    }

    private String key(DeploymentId deploymentId) {
        return keyPrefix + deploymentId.getValue();
    }

    @Override
    public boolean tryAcquire(DeploymentId deploymentId, ExecutionId executionId, Duration ttl) {
        if (deploymentId == null || executionId == null || ttl == null) {
            return false;
        }
        Boolean success = redisTemplate.opsForValue().setIfAbsent(key(deploymentId), executionId.getValue(), ttl);
        return Boolean.TRUE.equals(success);
    }

    @Override
    public void release(DeploymentId deploymentId, ExecutionId executionId) {
        if (deploymentId == null || executionId == null) {
            return;
        }
        redisTemplate.execute(RELEASE_SCRIPT, List.of(key(deploymentId)), executionId.getValue());
    }

    @Override
    public Optional<ExecutionId> currentHolder(DeploymentId deploymentId) {
        if (deploymentId == null) {
            return Optional.empty();
        }
        String holder = redisTemplate.opsForValue().get(key(deploymentId));
        return holder != null ? Optional.of(ExecutionId.ofTrusted(holder)) : Optional.empty();
    }

    @Override
    public boolean renew(DeploymentId deploymentId, ExecutionId executionId, Duration ttl) {
        if (deploymentId == null || executionId == null || ttl == null) {
            return false;
        }
        Long result = redisTemplate.execute(RENEW_SCRIPT, List.of(key(deploymentId)),
                executionId.getValue(), String.valueOf(ttl.toMillis()));
        return result != null && result > 0;
    }
}
