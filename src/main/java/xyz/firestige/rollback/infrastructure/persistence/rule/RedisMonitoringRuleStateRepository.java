package xyz.firestige.rollback.infrastructure.persistence.rule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.rollback.domain.health.MonitoringRuleStateRepository;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 规则触发状态 Redis 实现
 * <p>
 * Hash: {namespace}:rule-state，field = ruleId，value = ISO-8601 时间
 */
public class RedisMonitoringRuleStateRepository implements MonitoringRuleStateRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisMonitoringRuleStateRepository.class);

    private final StringRedisTemplate redisTemplate;
    private final String key;

    public RedisMonitoringRuleStateRepository(StringRedisTemplate redisTemplate, String namespace) {
        this.redisTemplate = redisTemplate;
        this.key = ((namespace == null || namespace.isBlank()) ? "rollback" : namespace) + ":rule-state";
    }

    @Override
    public Optional<LocalDateTime> findLastFiredAt(String ruleId) {
        Object value = redisTemplate.opsForHash().get(key, ruleId);
        return Optional.ofNullable(parse(ruleId, value));
    }

    @Override
    public void saveLastFiredAt(String ruleId, LocalDateTime lastFiredAt) {
        redisTemplate.opsForHash().put(key, ruleId, lastFiredAt.toString());
    }

    @Override
    public Map<String, LocalDateTime> findAll() {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(key);
        Map<String, LocalDateTime> result = new HashMap<>();
        entries.forEach((field, value) -> {
            LocalDateTime time = parse(String.valueOf(field), value);
            if (time != null) {
                result.put(String.valueOf(field), time);
            }
        });
        return result;
    }

    private LocalDateTime parse(String ruleId, Object value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.toString());
        } catch (DateTimeParseException e) {
            log.warn("规则触发时间格式无效, ruleId: {}, value: {}", ruleId, value);
            return null;
        }
    }
}
