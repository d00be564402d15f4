package xyz.firestige.rollback.infrastructure.persistence.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackExecutionRepository;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;
import xyz.firestige.rollback.infrastructure.persistence.RollbackObjectMapperFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 执行记录 Redis 实现
 * <p>
 * Key 设计：
 * - {namespace}:execution:{executionId} → JSON 文档（带 TTL）
 * - {namespace}:history:{deploymentId} → 执行 ID 列表（LPUSH，最近的在前，LTRIM 到 historyLimit）
 * - {namespace}:execution-count → 累计执行数
 */
public class RedisRollbackExecutionRepository implements RollbackExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisRollbackExecutionRepository.class);

    private final StringRedisTemplate redisTemplate;
    private final String namespace;
    private final Duration ttl;
    private final int historyLimit;
    private final ObjectMapper mapper = RollbackObjectMapperFactory.create();

    public RedisRollbackExecutionRepository(StringRedisTemplate redisTemplate, String namespace,
                                            Duration ttl, int historyLimit) {
        this.redisTemplate = redisTemplate;
        this.namespace = (namespace == null || namespace.isBlank()) ? "rollback" : namespace;
        this.ttl = ttl;
        this.historyLimit = historyLimit > 0 ? historyLimit : 100;
    }

    private String executionKey(ExecutionId id) { return namespace + ":execution:" + id.getValue(); }
    private String historyKey(DeploymentId id) { return namespace + ":history:" + id.getValue(); }
    private String countKey() { return namespace + ":execution-count"; }

    @Override
    public void save(RollbackExecution execution) {
        String key = executionKey(execution.getExecutionId());
        String json;
        try {
            json = mapper.writeValueAsString(RollbackExecutionDocument.from(execution));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化回滚执行记录失败: " + execution.getExecutionId(), e);
        }
        boolean existed = Boolean.TRUE.equals(redisTemplate.hasKey(key));
        redisTemplate.opsForValue().set(key, json, ttl);
        if (!existed) {
            String historyKey = historyKey(execution.getDeploymentId());
            redisTemplate.opsForList().leftPush(historyKey, execution.getExecutionId().getValue());
            redisTemplate.opsForList().trim(historyKey, 0, historyLimit - 1);
            redisTemplate.expire(historyKey, ttl);
            redisTemplate.opsForValue().increment(countKey());
        }
    }

    @Override
    public Optional<RollbackExecution> findById(ExecutionId executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        String json = redisTemplate.opsForValue().get(executionKey(executionId));
        return Optional.ofNullable(parse(executionId.getValue(), json));
    }

    @Override
    public List<RollbackExecution> findByDeployment(DeploymentId deploymentId) {
        List<String> ids = redisTemplate.opsForList().range(historyKey(deploymentId), 0, -1);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<RollbackExecution> result = new ArrayList<>();
        for (String id : ids) {
            RollbackExecution execution = parse(id, redisTemplate.opsForValue().get(executionKey(ExecutionId.ofTrusted(id))));
            if (execution != null) {
                result.add(execution);
            }
        }
        return result;
    }

    @Override
    public long count() {
        String value = redisTemplate.opsForValue().get(countKey());
        return value != null ? Long.parseLong(value) : 0L;
    }

    private RollbackExecution parse(String executionId, String json) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return mapper.readValue(json, RollbackExecutionDocument.class).toAggregate();
        } catch (JsonProcessingException e) {
            log.error("反序列化回滚执行记录失败, executionId: {}, error: {}", executionId, e.getMessage(), e);
            return null;
        }
    }
}
