package xyz.firestige.rollback.application;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollback.config.properties.IntegrationProperties;
import xyz.firestige.rollback.config.properties.TargetDefinition;
import xyz.firestige.rollback.domain.execution.ExecutionStatus;
import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackStrategy;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.ServiceType;
import xyz.firestige.rollback.domain.execution.TriggerReason;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.health.MonitoringRule;
import xyz.firestige.rollback.domain.health.RuleAction;
import xyz.firestige.rollback.domain.health.condition.Comparison;
import xyz.firestige.rollback.domain.health.condition.ThresholdCondition;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.infrastructure.external.LogPreservationService;
import xyz.firestige.rollback.infrastructure.external.NotificationChannel;
import xyz.firestige.rollback.infrastructure.health.HealthMonitor;
import xyz.firestige.rollback.infrastructure.health.MetricStore;
import xyz.firestige.rollback.infrastructure.health.RuleFiring;
import xyz.firestige.rollback.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.rollback.infrastructure.persistence.rule.InMemoryMonitoringRuleStateRepository;
import xyz.firestige.rollback.support.RollbackEngineFixture;
import xyz.firestige.rollback.support.RollbackTestData;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MonitorRollbackIntegrationTest {

    private static final DeploymentId DEPLOYMENT = DeploymentId.of("deploy-1");

    private RollbackEngineFixture engine;
    private ExecutorService probePool;
    private HealthMonitor healthMonitor;
    private NotificationChannel notificationChannel;
    private LogPreservationService logPreservationService;
    private IntegrationProperties properties;
    private MonitorRollbackIntegration integration;

    @BeforeEach
    void setUp() {
        engine = new RollbackEngineFixture();
        probePool = Executors.newSingleThreadExecutor();
        notificationChannel = mock(NotificationChannel.class);
        when(notificationChannel.send(anyString(), anyString())).thenReturn(true);
        logPreservationService = mock(LogPreservationService.class);
        when(logPreservationService.preserve(any(), anyList())).thenReturn("/tmp/logs/deploy-1");
        healthMonitor = new HealthMonitor(List.of(), List.of(), Map.of(),
                new MetricStore(Duration.ofMinutes(60), engine.clock), new InMemoryMonitoringRuleStateRepository(),
                notificationChannel, logPreservationService, probePool, new NoopMetricsRegistry(), engine.clock,
                DEPLOYMENT, 30, "ops-alerts");

        properties = new IntegrationProperties();
        properties.setDeploymentId("deploy-1");
        properties.setEnvironment("production");
        properties.setStableReportsRequired(2);
        properties.setPostRollbackMonitoringMinutes(5);
        properties.setVerificationTimeoutMinutes(10);
        properties.setAutoRollbackTargets(List.of(
                definition("backend-api", ServiceType.BACKEND, RollbackStrategy.IMMEDIATE),
                definition("frontend-web", ServiceType.FRONTEND, RollbackStrategy.FRONTEND_MULTI_PLATFORM)));
        integration = new MonitorRollbackIntegration(engine.orchestrator, healthMonitor, logPreservationService,
                notificationChannel, properties, engine.clock);
    }

    @AfterEach
    void tearDown() {
        integration.shutdown();
        engine.close();
        probePool.shutdownNow();
    }

    private static TargetDefinition definition(String name, ServiceType service, RollbackStrategy strategy) {
        TargetDefinition definition = new TargetDefinition();
        definition.setName(name);
        definition.setService(service);
        definition.setStrategy(strategy);
        definition.setOptions(Map.of("target_version", "v1.2.3"));
        return definition;
    }

    private RuleFiring firing(RuleAction action) {
        MonitoringRule rule = new MonitoringRule("critical_failure_rollback", "关键服务连续失败",
                ThresholdCondition.failureCount("backend", 5, Comparison.GTE, 3),
                action, 1, 30, true, 0, List.of("backend"));
        return new RuleFiring(rule, DEPLOYMENT, RollbackTestData.report(DEPLOYMENT, HealthStatus.CRITICAL),
                engine.clock.now());
    }

    private RollbackExecution onlyExecution() {
        List<RollbackExecution> history = engine.orchestrator.getRollbackHistory(DEPLOYMENT);
        assertThat(history).hasSize(1);
        return history.get(0);
    }

    private void awaitIdle() {
        await().atMost(5, TimeUnit.SECONDS).until(() -> !engine.orchestrator.hasActiveExecution(DEPLOYMENT));
    }

    @Test
    void rollbackRule_submitsHealthCheckTriggeredRollback() {
        IntegrationOutcome outcome = integration.handleRuleFired(firing(RuleAction.ROLLBACK));

        assertThat(outcome).isEqualTo(IntegrationOutcome.SUBMITTED);
        RollbackExecution execution = onlyExecution();
        assertThat(execution.getTrigger().reason()).isEqualTo(TriggerReason.HEALTH_CHECK_FAILURE);
        assertThat(execution.getTrigger().message()).contains("critical_failure_rollback");
        assertThat(execution.getRequestedTargets()).hasSize(2);
        verify(logPreservationService).preserve(DEPLOYMENT, List.of("backend"));
        verify(notificationChannel).send(eq("ops-alerts"), contains("[自动回滚]"));
        awaitIdle();
    }

    @Test
    void repeatedFiring_whileRollbackRuns_isDeduplicated() {
        CountDownLatch gate = engine.backend.gate("backend-api", "switch-traffic");

        IntegrationOutcome first = integration.handleRuleFired(firing(RuleAction.ROLLBACK));
        IntegrationOutcome second = integration.handleRuleFired(firing(RuleAction.ROLLBACK));

        assertThat(first).isEqualTo(IntegrationOutcome.SUBMITTED);
        assertThat(second).isEqualTo(IntegrationOutcome.DEDUPLICATED);
        assertThat(onlyExecution()).isNotNull();
        gate.countDown();
        awaitIdle();
    }

    @Test
    void autoRollbackDisabled_onlyAlerts() {
        properties.setAutoRollbackEnabled(false);

        assertThat(integration.handleRuleFired(firing(RuleAction.ROLLBACK)))
                .isEqualTo(IntegrationOutcome.AUTO_ROLLBACK_DISABLED);
        assertThat(engine.orchestrator.getTotalCount()).isZero();
        verify(notificationChannel).send(eq("ops-alerts"), contains("[自动回滚已关闭]"));
    }

    @Test
    void manualApproval_requiredBeforeRollback() {
        properties.setRequireManualApproval(true);

        assertThat(integration.handleRuleFired(firing(RuleAction.ROLLBACK)))
                .isEqualTo(IntegrationOutcome.APPROVAL_REQUIRED);
        assertThat(engine.orchestrator.getTotalCount()).isZero();
        verify(notificationChannel).send(eq("ops-alerts"), contains("[待审批]"));
    }

    @Test
    void noConfiguredTargets_isRejected() {
        properties.setAutoRollbackTargets(List.of());

        assertThat(integration.handleRuleFired(firing(RuleAction.ROLLBACK))).isEqualTo(IntegrationOutcome.REJECTED);
        assertThat(engine.orchestrator.getTotalCount()).isZero();
    }

    @Test
    void nonRollbackAction_isIgnored() {
        assertThat(integration.handleRuleFired(firing(RuleAction.ALERT))).isEqualTo(IntegrationOutcome.IGNORED);
        verify(notificationChannel, never()).send(anyString(), anyString());
    }

    @Test
    void ruleHandlerCallback_recordsLastOutcome() {
        integration.onRuleFired(firing(RuleAction.ROLLBACK));

        assertThat(integration.getLastOutcome()).isEqualTo(IntegrationOutcome.SUBMITTED);
        awaitIdle();
    }

    @Test
    void manualRollback_bypassesRulesAndFiltersServices() {
        RollbackExecution execution = integration.manualRollback(DEPLOYMENT, "staging", "版本缺陷",
                List.of("frontend"), true);

        assertThat(execution.getTrigger().reason()).isEqualTo(TriggerReason.MANUAL);
        assertThat(execution.getRequestedTargets())
                .extracting(RollbackTarget::name, RollbackTarget::environment)
                .containsExactly(tuple("frontend-web", "staging"));
        verify(logPreservationService).preserve(DEPLOYMENT, List.of("frontend"));
        verify(notificationChannel).send(eq("ops-alerts"), contains("[人工回滚]"));
        awaitIdle();
    }

    @Test
    void manualRollback_whileActive_isRejected() {
        CountDownLatch gate = engine.backend.gate("backend-api", "switch-traffic");
        integration.manualRollback("deploy-1", "first");

        assertThatThrownBy(() -> integration.manualRollback("deploy-1", "second"))
                .isInstanceOfSatisfying(RollbackRejectedException.class,
                        e -> assertThat(e.getReason()).isEqualTo(RejectionReason.CONCURRENT_EXECUTION_EXISTS));
        gate.countDown();
        awaitIdle();
    }

    @Test
    void status_reflectsLifecycleAndLatestReport() {
        IntegrationStatus before = integration.getStatus();
        assertThat(before.integrationRunning()).isFalse();
        assertThat(before.healthStatus()).isEqualTo("unknown");
        assertThat(before.lastReportTime()).isNull();

        integration.start();
        integration.supervise();
        IntegrationStatus after = integration.getStatus();

        assertThat(after.integrationRunning()).isTrue();
        assertThat(after.deploymentId()).isEqualTo("deploy-1");
        assertThat(after.environment()).isEqualTo("production");
        assertThat(after.healthStatus()).isEqualTo("healthy");
        assertThat(after.activeRollbacks()).isZero();
        assertThat(after.autoRollbackEnabled()).isTrue();
        assertThat(after.lastReportTime()).isNotNull();
    }

    @Test
    void supervise_reportsStabilityAfterConsecutiveHealthyReports() {
        RollbackExecution execution = integration.manualRollback("deploy-1", "回滚观察");
        await().atMost(5, TimeUnit.SECONDS).until(() -> engine.orchestrator.getRollbackStatus(execution.getExecutionId())
                .map(RollbackExecution::isTerminal).orElse(false));

        integration.supervise();
        assertThat(integration.getWatchCount()).isEqualTo(1);
        integration.supervise();

        assertThat(integration.getWatchCount()).isZero();
        verify(notificationChannel).send(eq("ops-alerts"), contains("[回滚成功]"));
    }

    @Test
    void supervise_reportsInstabilityAfterObservationWindow() {
        RollbackExecution execution = integration.manualRollback("deploy-1", "回滚观察");
        await().atMost(5, TimeUnit.SECONDS).until(() -> engine.orchestrator.getRollbackStatus(execution.getExecutionId())
                .map(RollbackExecution::isTerminal).orElse(false));
        healthMonitor.record(RollbackTestData.result("backend_api", "backend", HealthStatus.CRITICAL, engine.clock.now()));

        integration.supervise();
        engine.clock.advanceMinutes(6);
        integration.supervise();

        assertThat(integration.getWatchCount()).isZero();
        verify(notificationChannel).send(eq("ops-alerts"), contains("[回滚后不稳定]"));
        verify(notificationChannel, never()).send(eq("ops-alerts"), contains("[回滚成功]"));
    }

    @Test
    void supervise_alertsSlowRollbackOnce() {
        CountDownLatch gate = engine.backend.gate("backend-api", "switch-traffic");
        integration.manualRollback("deploy-1", "慢回滚");
        engine.clock.advanceMinutes(11);

        integration.supervise();
        integration.supervise();

        verify(notificationChannel, times(1)).send(eq("ops-alerts"), contains("[回滚缓慢]"));
        assertThat(engine.orchestrator.getActiveExecutions()).extracting(RollbackExecution::getStatus)
                .doesNotContain(ExecutionStatus.COMPLETED);
        gate.countDown();
        awaitIdle();
    }
}
