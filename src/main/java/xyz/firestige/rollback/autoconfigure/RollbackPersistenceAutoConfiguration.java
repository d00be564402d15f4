package xyz.firestige.rollback.autoconfigure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.rollback.config.properties.RollbackPersistenceProperties;
import xyz.firestige.rollback.domain.execution.RollbackExecutionRepository;
import xyz.firestige.rollback.domain.health.MonitoringRuleStateRepository;
import xyz.firestige.rollback.infrastructure.lock.DeploymentLockManager;
import xyz.firestige.rollback.infrastructure.lock.InMemoryDeploymentLockManager;
import xyz.firestige.rollback.infrastructure.lock.redis.RedisDeploymentLockManager;
import xyz.firestige.rollback.infrastructure.persistence.execution.InMemoryRollbackExecutionRepository;
import xyz.firestige.rollback.infrastructure.persistence.execution.RedisRollbackExecutionRepository;
import xyz.firestige.rollback.infrastructure.persistence.rule.InMemoryMonitoringRuleStateRepository;
import xyz.firestige.rollback.infrastructure.persistence.rule.RedisMonitoringRuleStateRepository;

/**
 * 回滚持久化自动配置
 * <p>
 * 职责：
 * - 根据配置自动装配 Redis 或 InMemory 实现
 * - 提供执行记录仓储、规则冷却状态仓储和部署锁的 Bean
 * - 支持条件注入，允许用户自定义实现
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * rollback:
 *   persistence:
 *     store-type: redis  # redis 或 memory，默认 memory
 *     namespace: rollback  # Redis Key 前缀，默认 rollback
 *     history-ttl: 30d  # 执行记录 TTL，默认 30 天
 *     lock-ttl: 2h  # 部署锁 TTL，默认 2 小时
 *     history-limit: 100  # 每个部署保留的执行记录条数
 * </pre>
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(RollbackPersistenceProperties.class)
public class RollbackPersistenceAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(RollbackPersistenceAutoConfiguration.class);

    // ========== Redis Infrastructure ==========

    @Bean(name = "rollbackRedisTemplate")
    @ConditionalOnClass(RedisConnectionFactory.class)
    @ConditionalOnMissingBean(name = "rollbackRedisTemplate")
    @ConditionalOnProperty(prefix = "rollback.persistence", name = "store-type", havingValue = "redis")
    public StringRedisTemplate rollbackRedisTemplate(RedisConnectionFactory factory) {
        logger.info("[AutoConfig] 创建 Redis Template for Rollback Engine");
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(factory);
        template.afterPropertiesSet();
        return template;
    }

    // ========== Execution Repository ==========

    /**
     * Redis 执行记录仓储
     */
    @Bean
    @ConditionalOnMissingBean(RollbackExecutionRepository.class)
    @ConditionalOnProperty(prefix = "rollback.persistence", name = "store-type", havingValue = "redis")
    public RollbackExecutionRepository redisRollbackExecutionRepository(
            StringRedisTemplate rollbackRedisTemplate,
            RollbackPersistenceProperties properties) {
        logger.info("[AutoConfig] 装配 Redis 执行记录仓储: namespace={}", properties.getNamespace());
        return new RedisRollbackExecutionRepository(rollbackRedisTemplate, properties.getNamespace(),
                properties.getHistoryTtl(), properties.getHistoryLimit());
    }

    /**
     * 内存执行记录仓储（Fallback）
     */
    @Bean
    @ConditionalOnMissingBean(RollbackExecutionRepository.class)
    public RollbackExecutionRepository inMemoryRollbackExecutionRepository(RollbackPersistenceProperties properties) {
        logger.warn("[AutoConfig] 装配 InMemory 执行记录仓储（Fallback）");
        return new InMemoryRollbackExecutionRepository(properties.getHistoryLimit());
    }

    // ========== Rule State Repository ==========

    /**
     * Redis 规则冷却状态仓储
     */
    @Bean
    @ConditionalOnMissingBean(MonitoringRuleStateRepository.class)
    @ConditionalOnProperty(prefix = "rollback.persistence", name = "store-type", havingValue = "redis")
    public MonitoringRuleStateRepository redisMonitoringRuleStateRepository(
            StringRedisTemplate rollbackRedisTemplate,
            RollbackPersistenceProperties properties) {
        logger.info("[AutoConfig] 装配 Redis 规则冷却状态仓储");
        return new RedisMonitoringRuleStateRepository(rollbackRedisTemplate, properties.getNamespace());
    }

    /**
     * 内存规则冷却状态仓储（Fallback，重启后冷却状态丢失）
     */
    @Bean
    @ConditionalOnMissingBean(MonitoringRuleStateRepository.class)
    public MonitoringRuleStateRepository inMemoryMonitoringRuleStateRepository() {
        logger.warn("[AutoConfig] 装配 InMemory 规则冷却状态仓储（Fallback）");
        return new InMemoryMonitoringRuleStateRepository();
    }

    // ========== Deployment Lock Manager ==========

    /**
     * Redis 部署锁（多实例）
     */
    @Bean
    @ConditionalOnMissingBean(DeploymentLockManager.class)
    @ConditionalOnProperty(prefix = "rollback.persistence", name = "store-type", havingValue = "redis")
    public DeploymentLockManager redisDeploymentLockManager(
            StringRedisTemplate rollbackRedisTemplate,
            RollbackPersistenceProperties properties) {
        logger.info("[AutoConfig] 装配 Redis 部署锁");
        return new RedisDeploymentLockManager(rollbackRedisTemplate, properties.getNamespace() + ":lock:deployment");
    }

    /**
     * 内存部署锁（Fallback，单进程）
     */
    @Bean
    @ConditionalOnMissingBean(DeploymentLockManager.class)
    public DeploymentLockManager inMemoryDeploymentLockManager() {
        logger.warn("[AutoConfig] 装配 InMemory 部署锁（Fallback）");
        return new InMemoryDeploymentLockManager();
    }
}
