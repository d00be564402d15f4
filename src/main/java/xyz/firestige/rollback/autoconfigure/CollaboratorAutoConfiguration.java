package xyz.firestige.rollback.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.rollback.config.properties.CollaboratorProperties;
import xyz.firestige.rollback.config.properties.RollbackPersistenceProperties;
import xyz.firestige.rollback.domain.shared.event.DomainEventPublisher;
import xyz.firestige.rollback.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.rollback.infrastructure.external.AppReleaseClient;
import xyz.firestige.rollback.infrastructure.external.CdnClient;
import xyz.firestige.rollback.infrastructure.external.ConfiguredVersionRegistry;
import xyz.firestige.rollback.infrastructure.external.DatabaseTooling;
import xyz.firestige.rollback.infrastructure.external.DeploymentPlatformClient;
import xyz.firestige.rollback.infrastructure.external.HttpHealthClient;
import xyz.firestige.rollback.infrastructure.external.LogPreservationService;
import xyz.firestige.rollback.infrastructure.external.NotificationChannel;
import xyz.firestige.rollback.infrastructure.external.VersionRegistry;
import xyz.firestige.rollback.infrastructure.external.fs.FileSystemLogPreservationService;
import xyz.firestige.rollback.infrastructure.external.jdbc.JdbcDatabaseTooling;
import xyz.firestige.rollback.infrastructure.external.redis.RedisVersionRegistry;
import xyz.firestige.rollback.infrastructure.external.rest.RestAppReleaseClient;
import xyz.firestige.rollback.infrastructure.external.rest.RestCdnClient;
import xyz.firestige.rollback.infrastructure.external.rest.RestDeploymentPlatformClient;
import xyz.firestige.rollback.infrastructure.external.rest.RestTemplateHttpHealthClient;
import xyz.firestige.rollback.infrastructure.external.rest.WebhookNotificationChannel;
import xyz.firestige.rollback.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollback.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.rollback.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.rollback.infrastructure.persistence.RollbackObjectMapperFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * 外部协作方自动配置
 * <p>
 * 职责：
 * - 部署平台 / CDN / 应用商店 / 通知 的 REST 客户端
 * - 版本登记（Redis 或配置）
 * - 数据库工具（存在 JdbcTemplate 时）
 * - 日志保全、指标、领域事件发布
 * <p>
 * 所有 Bean 都可以被用户自定义实现替换
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * rollback:
 *   collaborators:
 *     platform-base-url: http://deploy-platform:8080
 *     cdn-base-url: http://asset-store:8080
 *     notification-webhooks:
 *       ops-alerts: http://chat/hooks/ops
 *     migrations:
 *       - version: "20250805"
 *         down-sql:
 *           - ALTER TABLE users DROP COLUMN encrypted_email
 * </pre>
 */
@AutoConfiguration(after = {RedisAutoConfiguration.class, JdbcTemplateAutoConfiguration.class,
        RollbackPersistenceAutoConfiguration.class})
@EnableConfigurationProperties(CollaboratorProperties.class)
public class CollaboratorAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(CollaboratorAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock rollbackClock() {
        return Clock.systemDefaultZone();
    }

    @Bean(name = "rollbackRestTemplate")
    @ConditionalOnMissingBean(name = "rollbackRestTemplate")
    public RestTemplate rollbackRestTemplate(CollaboratorProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getRequestTimeout().toMillis());
        factory.setReadTimeout((int) properties.getRequestTimeout().toMillis());
        return new RestTemplate(factory);
    }

    // ========== Deployment / Asset Collaborators ==========

    @Bean
    @ConditionalOnMissingBean(HttpHealthClient.class)
    public HttpHealthClient httpHealthClient() {
        return new RestTemplateHttpHealthClient();
    }

    @Bean
    @ConditionalOnMissingBean(DeploymentPlatformClient.class)
    public DeploymentPlatformClient deploymentPlatformClient(RestTemplate rollbackRestTemplate,
                                                             CollaboratorProperties properties) {
        logger.info("[AutoConfig] 装配部署平台客户端: {}", properties.getPlatformBaseUrl());
        return new RestDeploymentPlatformClient(rollbackRestTemplate, properties.getPlatformBaseUrl());
    }

    @Bean
    @ConditionalOnMissingBean(CdnClient.class)
    public CdnClient cdnClient(RestTemplate rollbackRestTemplate, CollaboratorProperties properties) {
        logger.info("[AutoConfig] 装配 CDN 客户端: {}", properties.getCdnBaseUrl());
        return new RestCdnClient(rollbackRestTemplate, properties.getCdnBaseUrl());
    }

    @Bean
    @ConditionalOnMissingBean(AppReleaseClient.class)
    public AppReleaseClient appReleaseClient(RestTemplate rollbackRestTemplate, CollaboratorProperties properties) {
        return new RestAppReleaseClient(rollbackRestTemplate, properties.getAppReleaseBaseUrl());
    }

    // ========== Version Registry ==========

    /**
     * Redis 版本登记（配置中的版本作为兜底）
     */
    @Bean
    @ConditionalOnMissingBean(VersionRegistry.class)
    @ConditionalOnProperty(prefix = "rollback.persistence", name = "store-type", havingValue = "redis")
    public VersionRegistry redisVersionRegistry(StringRedisTemplate rollbackRedisTemplate,
                                                RollbackPersistenceProperties persistence,
                                                CollaboratorProperties properties) {
        logger.info("[AutoConfig] 装配 Redis 版本登记");
        return new RedisVersionRegistry(rollbackRedisTemplate, persistence.getNamespace(),
                new ConfiguredVersionRegistry(properties.getStableVersions()));
    }

    /**
     * 配置版本登记（Fallback）
     */
    @Bean
    @ConditionalOnMissingBean(VersionRegistry.class)
    public VersionRegistry configuredVersionRegistry(CollaboratorProperties properties) {
        logger.warn("[AutoConfig] 装配配置版本登记（Fallback），条目数: {}", properties.getStableVersions().size());
        return new ConfiguredVersionRegistry(properties.getStableVersions());
    }

    // ========== Database Tooling ==========

    @Bean
    @ConditionalOnBean(JdbcTemplate.class)
    @ConditionalOnMissingBean(DatabaseTooling.class)
    public DatabaseTooling jdbcDatabaseTooling(JdbcTemplate jdbcTemplate, CollaboratorProperties properties,
                                               Clock clock) {
        logger.info("[AutoConfig] 装配 JDBC 数据库工具，迁移目录条目数: {}", properties.getMigrations().size());
        return new JdbcDatabaseTooling(jdbcTemplate, properties.getMigrations(), properties.getBaselineMigration(), clock);
    }

    // ========== Notification / Log Preservation ==========

    @Bean
    @ConditionalOnMissingBean(NotificationChannel.class)
    public NotificationChannel notificationChannel(RestTemplate rollbackRestTemplate, CollaboratorProperties properties) {
        logger.info("[AutoConfig] 装配 Webhook 通知渠道: {}", properties.getNotificationWebhooks().keySet());
        return new WebhookNotificationChannel(rollbackRestTemplate, properties.getNotificationWebhooks());
    }

    @Bean
    @ConditionalOnMissingBean(LogPreservationService.class)
    public LogPreservationService logPreservationService(CollaboratorProperties properties, Clock clock) {
        return new FileSystemLogPreservationService(Path.of(properties.getLogSourceDir()),
                Path.of(properties.getLogArchiveDir()), RollbackObjectMapperFactory.create(), clock);
    }

    // ========== Metrics / Events ==========

    @Bean
    @ConditionalOnMissingBean(MetricsRegistry.class)
    public MetricsRegistry rollbackMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistry,
                                                   @Value("${rollback.integration.deployment-id:default}") String deploymentId) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            logger.warn("[AutoConfig] 未发现 MeterRegistry，装配 Noop 指标（Fallback）");
            return new NoopMetricsRegistry();
        }
        logger.info("[AutoConfig] 装配 Micrometer 指标: deployment={}", deploymentId);
        return new MicrometerMetricsRegistry(registry, deploymentId);
    }

    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    public DomainEventPublisher domainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        logger.info("[AutoConfig] 装配 Spring 领域事件发布器");
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }
}
