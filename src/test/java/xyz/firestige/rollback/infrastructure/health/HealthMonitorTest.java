package xyz.firestige.rollback.infrastructure.health;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckDefinition;
import xyz.firestige.rollback.domain.health.HealthCheckResult;
import xyz.firestige.rollback.domain.health.HealthReport;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.health.MonitoringRule;
import xyz.firestige.rollback.domain.health.RuleAction;
import xyz.firestige.rollback.domain.health.condition.Comparison;
import xyz.firestige.rollback.domain.health.condition.ThresholdCondition;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.infrastructure.external.LogPreservationService;
import xyz.firestige.rollback.infrastructure.external.NotificationChannel;
import xyz.firestige.rollback.infrastructure.health.probe.HealthProbe;
import xyz.firestige.rollback.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.rollback.infrastructure.persistence.rule.InMemoryMonitoringRuleStateRepository;
import xyz.firestige.rollback.support.MutableClock;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static xyz.firestige.rollback.support.RollbackTestData.resource;
import static xyz.firestige.rollback.support.RollbackTestData.result;

/**
 * 健康监控：检查执行、规则触发与冷却、报告
 */
class HealthMonitorTest {

    private static final DeploymentId DEPLOYMENT = DeploymentId.of("deploy-1");

    private MutableClock clock;
    private MetricStore metricStore;
    private InMemoryMonitoringRuleStateRepository ruleStateRepository;
    private NotificationChannel notificationChannel;
    private LogPreservationService logPreservationService;
    private ExecutorService probeExecutor;
    private ScriptedProbe httpProbe;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-08-05T10:00:00");
        metricStore = new MetricStore(Duration.ofMinutes(60), clock);
        ruleStateRepository = new InMemoryMonitoringRuleStateRepository();
        notificationChannel = mock(NotificationChannel.class);
        when(notificationChannel.send(anyString(), anyString())).thenReturn(true);
        logPreservationService = mock(LogPreservationService.class);
        probeExecutor = Executors.newFixedThreadPool(2);
        httpProbe = new ScriptedProbe(CheckType.HTTP_RESPONSE);
    }

    @AfterEach
    void tearDown() {
        probeExecutor.shutdownNow();
    }

    private HealthMonitor monitor(List<HealthCheckDefinition> checks, List<MonitoringRule> rules) {
        return new HealthMonitor(checks, rules, Map.of(CheckType.HTTP_RESPONSE, httpProbe), metricStore,
                ruleStateRepository, notificationChannel, logPreservationService, probeExecutor,
                new NoopMetricsRegistry(), clock, DEPLOYMENT, 30, "ops-alerts");
    }

    private static HealthCheckDefinition backendCheck() {
        HealthCheckDefinition check = new HealthCheckDefinition("backend_api", "backend", CheckType.HTTP_RESPONSE);
        check.setEndpointUrl("http://backend/health");
        check.setIntervalSeconds(30);
        check.setTimeoutSeconds(5);
        return check;
    }

    @Test
    void threeConsecutiveCriticals_fireRollbackOnceThenCooldown() {
        httpProbe.status = HealthStatus.CRITICAL;
        HealthMonitor monitor = monitor(List.of(backendCheck()), DefaultMonitoringRules.create());
        List<RuleFiring> handled = new ArrayList<>();
        monitor.setRollbackHandler(handled::add);

        List<List<RuleFiring>> perTick = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            perTick.add(monitor.tick());
            clock.advance(Duration.ofSeconds(30));
        }

        assertThat(perTick.get(0)).isEmpty();
        assertThat(perTick.get(1)).isEmpty();
        assertThat(perTick.get(2)).extracting(f -> f.rule().getRuleId())
                .containsExactly(DefaultMonitoringRules.CRITICAL_FAILURE_ROLLBACK);
        assertThat(perTick.get(3)).isEmpty();
        assertThat(perTick.get(4)).isEmpty();
        assertThat(handled).hasSize(1);
        assertThat(handled.get(0).report().overallStatus()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(ruleStateRepository.findLastFiredAt(DefaultMonitoringRules.CRITICAL_FAILURE_ROLLBACK)).isPresent();
        assertThat(httpProbe.calls).isEqualTo(5);
    }

    @Test
    void checkIsSkippedUntilIntervalElapses() {
        httpProbe.status = HealthStatus.HEALTHY;
        HealthMonitor monitor = monitor(List.of(backendCheck()), List.of());

        monitor.tick();
        clock.advance(Duration.ofSeconds(10));
        monitor.tick();
        clock.advance(Duration.ofSeconds(20));
        monitor.tick();

        assertThat(httpProbe.calls).isEqualTo(2);
        assertThat(metricStore.size()).isEqualTo(2);
    }

    @Test
    void restoredRuleState_suppressesFiringAfterRestart() {
        ruleStateRepository.saveLastFiredAt(DefaultMonitoringRules.CRITICAL_FAILURE_ROLLBACK, clock.now().minusMinutes(5));
        HealthMonitor monitor = monitor(List.of(), DefaultMonitoringRules.create());
        monitor.restoreRuleState();
        for (int i = 0; i < 3; i++) {
            monitor.record(result("backend_api", "backend", HealthStatus.CRITICAL, clock.now()));
            clock.advance(Duration.ofSeconds(30));
        }

        assertThat(monitor.evaluateRules()).isEmpty();
    }

    @Test
    void alertRule_sendsToAlertChannel() {
        HealthMonitor monitor = monitor(List.of(), DefaultMonitoringRules.create());
        monitor.record(resource("system_cpu", 95.5, clock.now()));

        List<RuleFiring> fired = monitor.evaluateRules();

        assertThat(fired).extracting(f -> f.rule().getRuleId())
                .containsExactly(DefaultMonitoringRules.SYSTEM_RESOURCE_ALERT);
        verify(notificationChannel).send(eq("ops-alerts"), contains(DefaultMonitoringRules.SYSTEM_RESOURCE_ALERT));
    }

    @Test
    void rollbackWithoutHandler_isIgnored() {
        HealthMonitor monitor = monitor(List.of(), DefaultMonitoringRules.create());
        for (int i = 0; i < 3; i++) {
            monitor.record(result("backend_api", "backend", HealthStatus.CRITICAL, clock.now()));
        }

        assertThat(monitor.evaluateRules()).hasSize(1);
        verify(notificationChannel, never()).send(anyString(), anyString());
    }

    @Test
    void failingHandler_doesNotBreakEvaluation() {
        HealthMonitor monitor = monitor(List.of(), DefaultMonitoringRules.create());
        monitor.setRollbackHandler(firing -> {
            throw new IllegalStateException("boom");
        });
        monitor.record(result("backend_api", "backend", HealthStatus.CRITICAL, clock.now()));
        monitor.record(result("frontend_web", "frontend", HealthStatus.CRITICAL, clock.now()));

        List<RuleFiring> fired = monitor.evaluateRules();

        assertThat(fired).extracting(f -> f.rule().getRuleId())
                .containsExactly(DefaultMonitoringRules.MULTIPLE_SERVICE_DEGRADATION);
    }

    @Test
    void preserveLogsRule_callsLogPreservation() {
        MonitoringRule preserve = new MonitoringRule("preserve", "preserve",
                ThresholdCondition.failureCount("backend", 5, Comparison.GTE, 1),
                RuleAction.PRESERVE_LOGS, 1, 10, true, 0, List.of("backend"));
        HealthMonitor monitor = monitor(List.of(), List.of(preserve));
        monitor.record(result("backend_api", "backend", HealthStatus.CRITICAL, clock.now()));

        monitor.evaluateRules();

        verify(logPreservationService).preserve(DEPLOYMENT, List.of("backend"));
    }

    @Test
    void slowProbe_isRecordedAsCriticalTimeout() {
        httpProbe.delay = Duration.ofSeconds(3);
        HealthCheckDefinition check = backendCheck();
        check.setTimeoutSeconds(1);
        HealthMonitor monitor = monitor(List.of(check), List.of());

        List<HealthCheckResult> results = monitor.runChecks(List.of(check));

        assertThat(results).hasSize(1);
        assertThat(results.get(0).status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(results.get(0).message()).contains("超时");
    }

    @Test
    void throwingProbe_isRecordedAsCritical() {
        httpProbe.failure = new IllegalStateException("connection refused");
        HealthMonitor monitor = monitor(List.of(backendCheck()), List.of());

        List<HealthCheckResult> results = monitor.runChecks(List.of(backendCheck()));

        assertThat(results.get(0).status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(results.get(0).message()).contains("connection refused");
    }

    @Test
    void report_summarizesFailuresAndWarnings() {
        HealthMonitor monitor = monitor(List.of(), List.of());
        monitor.record(result("backend_api", "backend", HealthStatus.CRITICAL, clock.now()));
        monitor.record(result("frontend_web", "frontend", HealthStatus.WARNING, clock.now()));
        monitor.record(result("db_conn", "database", HealthStatus.HEALTHY, clock.now()));

        HealthReport report = monitor.generateHealthReport(DEPLOYMENT);

        assertThat(report.overallStatus()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(report.services()).containsEntry("database", HealthStatus.HEALTHY);
        assertThat(report.failedChecks()).containsExactly("backend_api");
        assertThat(report.warnings()).containsExactly("frontend_web");
        assertThat(report.failureCounts()).containsEntry("backend", 1).containsEntry("database", 0);
        assertThat(report.recommendations()).anyMatch(r -> r.contains("多个服务异常"));
    }

    @Test
    void report_withoutData_isHealthyWithHint() {
        HealthReport report = monitor(List.of(), List.of()).generateHealthReport(DEPLOYMENT);

        assertThat(report.overallStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(report.services()).isEmpty();
        assertThat(report.recommendations()).containsExactly("暂无健康检查数据，确认检查配置是否生效");
    }

    @Test
    void verifyNow_runsAllChecksRegardlessOfInterval() {
        httpProbe.status = HealthStatus.HEALTHY;
        HealthMonitor monitor = monitor(List.of(backendCheck()), List.of());
        monitor.tick();

        HealthReport report = monitor.verifyNow(DEPLOYMENT);

        assertThat(httpProbe.calls).isEqualTo(2);
        assertThat(report.isHealthy()).isTrue();
    }

    @Test
    void checkWithoutProbe_isRejectedAtConstruction() {
        HealthCheckDefinition db = new HealthCheckDefinition("db", "database", CheckType.DATABASE_CONNECTION);

        assertThatThrownBy(() -> monitor(List.of(db), List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("db");
    }

    @Test
    void notificationFailure_isSwallowedByAlert() {
        when(notificationChannel.send(anyString(), anyString())).thenThrow(new IllegalStateException("webhook down"));
        HealthMonitor monitor = monitor(List.of(), List.of());

        monitor.sendAlert("test");

        verify(notificationChannel).send("ops-alerts", "test");
    }

    /**
     * 按脚本返回固定状态的探测器
     */
    static class ScriptedProbe implements HealthProbe {

        private final CheckType type;
        volatile HealthStatus status = HealthStatus.HEALTHY;
        volatile Duration delay = Duration.ZERO;
        volatile RuntimeException failure;
        volatile int calls;

        ScriptedProbe(CheckType type) {
            this.type = type;
        }

        @Override
        public CheckType getType() {
            return type;
        }

        @Override
        public HealthCheckResult probe(HealthCheckDefinition check) {
            calls++;
            if (failure != null) {
                throw failure;
            }
            if (!delay.isZero()) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return new HealthCheckResult(check.getCheckId(), check.getService(), type, status, 120,
                    LocalDateTime.now(), status.getCode());
        }
    }
}
