package xyz.firestige.rollback.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.rollback.application.MonitorRollbackIntegration;
import xyz.firestige.rollback.application.RollbackOrchestrator;
import xyz.firestige.rollback.config.properties.CollaboratorProperties;
import xyz.firestige.rollback.config.properties.HealthMonitorProperties;
import xyz.firestige.rollback.config.properties.IntegrationProperties;
import xyz.firestige.rollback.config.properties.RollbackExecutionProperties;
import xyz.firestige.rollback.config.properties.RollbackPersistenceProperties;
import xyz.firestige.rollback.domain.execution.RollbackExecutionRepository;
import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.MonitoringRule;
import xyz.firestige.rollback.domain.health.MonitoringRuleStateRepository;
import xyz.firestige.rollback.domain.shared.event.DomainEventPublisher;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.facade.RollbackFacade;
import xyz.firestige.rollback.infrastructure.adapter.AdapterRegistry;
import xyz.firestige.rollback.infrastructure.adapter.TargetAdapter;
import xyz.firestige.rollback.infrastructure.adapter.backend.BackendRollbackAdapter;
import xyz.firestige.rollback.infrastructure.adapter.database.DatabaseRollbackAdapter;
import xyz.firestige.rollback.infrastructure.adapter.frontend.FrontendRollbackAdapter;
import xyz.firestige.rollback.infrastructure.execution.AdapterStepRunner;
import xyz.firestige.rollback.infrastructure.execution.NamedThreadFactory;
import xyz.firestige.rollback.infrastructure.execution.PostRollbackVerifier;
import xyz.firestige.rollback.infrastructure.execution.RollbackExecutor;
import xyz.firestige.rollback.infrastructure.external.AppReleaseClient;
import xyz.firestige.rollback.infrastructure.external.CdnClient;
import xyz.firestige.rollback.infrastructure.external.DatabaseTooling;
import xyz.firestige.rollback.infrastructure.external.DeploymentPlatformClient;
import xyz.firestige.rollback.infrastructure.external.HttpHealthClient;
import xyz.firestige.rollback.infrastructure.external.LogPreservationService;
import xyz.firestige.rollback.infrastructure.external.NotificationChannel;
import xyz.firestige.rollback.infrastructure.external.VersionRegistry;
import xyz.firestige.rollback.infrastructure.health.DefaultMonitoringRules;
import xyz.firestige.rollback.infrastructure.health.HealthMonitor;
import xyz.firestige.rollback.infrastructure.health.MetricStore;
import xyz.firestige.rollback.infrastructure.health.RuleConditionFactory;
import xyz.firestige.rollback.infrastructure.health.probe.CustomCommandProbe;
import xyz.firestige.rollback.infrastructure.health.probe.DatabaseConnectionProbe;
import xyz.firestige.rollback.infrastructure.health.probe.HealthProbe;
import xyz.firestige.rollback.infrastructure.health.probe.HttpResponseProbe;
import xyz.firestige.rollback.infrastructure.health.probe.OperatingSystemResourceSampler;
import xyz.firestige.rollback.infrastructure.health.probe.SystemResourceProbe;
import xyz.firestige.rollback.infrastructure.lock.DeploymentLockManager;
import xyz.firestige.rollback.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollback.infrastructure.resolver.DependencyResolver;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 回滚引擎配置
 * <p>
 * 分层装配：
 * - 基础设施：校验器、依赖解析、适配器、线程池、探测器
 * - 领域服务：步骤执行、回滚执行器、健康监控
 * - 应用服务：编排器、监控联动
 * - 门面：RollbackFacade
 * <p>
 * 仓储 / 锁 / 外部协作方由 autoconfigure 包提供，可被用户 Bean 覆盖
 */
@Configuration
@EnableConfigurationProperties({
        RollbackExecutionProperties.class,
        HealthMonitorProperties.class,
        IntegrationProperties.class
})
public class RollbackEngineConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(RollbackEngineConfiguration.class);

    // ========== 基础设施 Bean ==========

    @Bean
    public Validator validator() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return factory.getValidator();
    }

    @Bean
    public DependencyResolver dependencyResolver(RollbackExecutionProperties properties) {
        return new DependencyResolver(properties.getTierOverrides());
    }

    @Bean
    public BackendRollbackAdapter backendRollbackAdapter(DeploymentPlatformClient platformClient,
                                                         HttpHealthClient httpHealthClient) {
        return new BackendRollbackAdapter(platformClient, httpHealthClient);
    }

    @Bean
    public FrontendRollbackAdapter frontendRollbackAdapter(VersionRegistry versionRegistry,
                                                           CdnClient cdnClient,
                                                           AppReleaseClient appReleaseClient,
                                                           HttpHealthClient httpHealthClient,
                                                           CollaboratorProperties collaboratorProperties) {
        return new FrontendRollbackAdapter(versionRegistry, cdnClient, appReleaseClient, httpHealthClient,
                collaboratorProperties.getProductionEnvironment());
    }

    /**
     * 适配器注册表
     * <p>
     * 没有 DatabaseTooling（未配置数据源）时不注册数据库适配器，database 目标会在校验阶段被拒绝
     */
    @Bean
    public AdapterRegistry adapterRegistry(BackendRollbackAdapter backendRollbackAdapter,
                                           FrontendRollbackAdapter frontendRollbackAdapter,
                                           ObjectProvider<DatabaseTooling> databaseTooling) {
        List<TargetAdapter> adapters = new ArrayList<>();
        adapters.add(backendRollbackAdapter);
        adapters.add(frontendRollbackAdapter);
        DatabaseTooling tooling = databaseTooling.getIfAvailable();
        if (tooling != null) {
            adapters.add(new DatabaseRollbackAdapter(tooling));
        } else {
            logger.warn("[Config] 未发现 DatabaseTooling，数据库回滚不可用");
        }
        return new AdapterRegistry(adapters);
    }

    // ========== 线程池 ==========

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService rollbackWorkerPool(RollbackExecutionProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerThreads(), new NamedThreadFactory("rollback-worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService rollbackTargetPool(RollbackExecutionProperties properties) {
        return Executors.newFixedThreadPool(properties.getTargetThreads(), new NamedThreadFactory("rollback-target"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService rollbackStepPool() {
        return Executors.newCachedThreadPool(new NamedThreadFactory("rollback-step"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService healthProbePool(HealthMonitorProperties properties) {
        return Executors.newFixedThreadPool(properties.getProbeThreads(), new NamedThreadFactory("health-probe"));
    }

    // ========== 执行 ==========

    @Bean
    public AdapterStepRunner adapterStepRunner(RollbackExecutionProperties properties,
                                               ExecutorService rollbackStepPool,
                                               Clock clock,
                                               MetricsRegistry metricsRegistry) {
        return new AdapterStepRunner(properties.getRetry().toPolicy(), properties.getStepTimeout(),
                rollbackStepPool, clock, metricsRegistry);
    }

    @Bean
    public PostRollbackVerifier postRollbackVerifier(HealthMonitor healthMonitor) {
        return healthMonitor::verifyNow;
    }

    @Bean
    public RollbackExecutor rollbackExecutor(AdapterRegistry adapterRegistry,
                                             DependencyResolver dependencyResolver,
                                             AdapterStepRunner adapterStepRunner,
                                             PostRollbackVerifier postRollbackVerifier,
                                             RollbackExecutionRepository rollbackExecutionRepository,
                                             DomainEventPublisher domainEventPublisher,
                                             ExecutorService rollbackTargetPool,
                                             MetricsRegistry metricsRegistry,
                                             Clock clock) {
        return new RollbackExecutor(adapterRegistry, dependencyResolver, adapterStepRunner, postRollbackVerifier,
                rollbackExecutionRepository, domainEventPublisher, rollbackTargetPool, metricsRegistry, clock);
    }

    // ========== 健康监控 ==========

    @Bean
    public MetricStore metricStore(HealthMonitorProperties properties, Clock clock) {
        return new MetricStore(Duration.ofMinutes(properties.getMetricsRetentionMinutes()), clock);
    }

    /**
     * 探测器按检查类型注册；无数据源时不提供 database 探测器
     */
    private static Map<CheckType, HealthProbe> healthProbes(HttpHealthClient httpHealthClient,
                                                    ObjectProvider<DataSource> dataSource,
                                                    Clock clock) {
        Map<CheckType, HealthProbe> probes = new EnumMap<>(CheckType.class);
        register(probes, new HttpResponseProbe(httpHealthClient, clock));
        register(probes, new SystemResourceProbe(new OperatingSystemResourceSampler(), clock));
        register(probes, new CustomCommandProbe(clock));
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            register(probes, new DatabaseConnectionProbe(ds, clock));
        }
        return probes;
    }

    private static void register(Map<CheckType, HealthProbe> probes, HealthProbe probe) {
        probes.put(probe.getType(), probe);
    }

    @Bean
    public HealthMonitor healthMonitor(HealthMonitorProperties properties,
                                       IntegrationProperties integrationProperties,
                                       HttpHealthClient httpHealthClient,
                                       ObjectProvider<DataSource> dataSource,
                                       MetricStore metricStore,
                                       MonitoringRuleStateRepository ruleStateRepository,
                                       NotificationChannel notificationChannel,
                                       LogPreservationService logPreservationService,
                                       ExecutorService healthProbePool,
                                       MetricsRegistry metricsRegistry,
                                       Clock clock) {
        List<MonitoringRule> rules;
        if (properties.getRules().isEmpty() && properties.isDefaultRulesEnabled()) {
            rules = DefaultMonitoringRules.create();
        } else {
            rules = RuleConditionFactory.createRules(properties.getRules());
        }
        logger.info("[Config] 装配健康监控: checks={}, rules={}", properties.getChecks().size(), rules.size());
        return new HealthMonitor(properties.getChecks(), rules, healthProbes(httpHealthClient, dataSource, clock),
                metricStore, ruleStateRepository, notificationChannel, logPreservationService, healthProbePool,
                metricsRegistry, clock,
                DeploymentId.of(integrationProperties.getDeploymentId()),
                properties.getMonitoringIntervalSeconds(), integrationProperties.getAlertChannel());
    }

    // ========== 应用服务 ==========

    @Bean
    public RollbackOrchestrator rollbackOrchestrator(AdapterRegistry adapterRegistry,
                                                     RollbackExecutor rollbackExecutor,
                                                     RollbackExecutionRepository rollbackExecutionRepository,
                                                     DeploymentLockManager deploymentLockManager,
                                                     ExecutorService rollbackWorkerPool,
                                                     MetricsRegistry metricsRegistry,
                                                     Clock clock,
                                                     RollbackPersistenceProperties persistenceProperties,
                                                     RollbackExecutionProperties executionProperties) {
        return new RollbackOrchestrator(adapterRegistry, rollbackExecutor, rollbackExecutionRepository,
                deploymentLockManager, rollbackWorkerPool, metricsRegistry, clock,
                persistenceProperties.getLockTtl(), executionProperties.getShutdownTimeout());
    }

    @Bean
    public MonitorRollbackIntegration monitorRollbackIntegration(RollbackOrchestrator rollbackOrchestrator,
                                                                 HealthMonitor healthMonitor,
                                                                 LogPreservationService logPreservationService,
                                                                 NotificationChannel notificationChannel,
                                                                 IntegrationProperties properties,
                                                                 Clock clock) {
        return new MonitorRollbackIntegration(rollbackOrchestrator, healthMonitor, logPreservationService,
                notificationChannel, properties, clock);
    }

    // ========== 门面 ==========

    @Bean
    public RollbackFacade rollbackFacade(RollbackOrchestrator rollbackOrchestrator,
                                         MonitorRollbackIntegration monitorRollbackIntegration,
                                         HealthMonitor healthMonitor,
                                         Validator validator) {
        return new RollbackFacade(rollbackOrchestrator, monitorRollbackIntegration, healthMonitor, validator);
    }

    @Bean
    public RollbackEngineLifecycle rollbackEngineLifecycle(MonitorRollbackIntegration monitorRollbackIntegration,
                                                           HealthMonitor healthMonitor,
                                                           RollbackOrchestrator rollbackOrchestrator,
                                                           HealthMonitorProperties monitorProperties,
                                                           IntegrationProperties integrationProperties) {
        return new RollbackEngineLifecycle(monitorRollbackIntegration, healthMonitor, rollbackOrchestrator,
                monitorProperties.isEnabled(), integrationProperties.isEnabled());
    }
}
