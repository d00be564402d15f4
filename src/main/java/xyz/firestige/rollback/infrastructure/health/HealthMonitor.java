package xyz.firestige.rollback.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckDefinition;
import xyz.firestige.rollback.domain.health.HealthCheckResult;
import xyz.firestige.rollback.domain.health.HealthReport;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.health.MonitoringRule;
import xyz.firestige.rollback.domain.health.MonitoringRuleStateRepository;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.infrastructure.execution.NamedThreadFactory;
import xyz.firestige.rollback.infrastructure.external.LogPreservationService;
import xyz.firestige.rollback.infrastructure.external.NotificationChannel;
import xyz.firestige.rollback.infrastructure.health.probe.HealthProbe;
import xyz.firestige.rollback.infrastructure.metrics.MetricsRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 健康监控器
 * <p>
 * 每个 tick：
 * 1. 执行到期的检查（各检查有自己的 intervalSeconds，并发执行后统一汇合）
 * 2. 写入滚动指标存储并淘汰过期样本
 * 3. 在同一份快照上按 priority 升序评估规则，命中且不在冷却期则触发动作
 * <p>
 * 同一时刻只有一个 tick 在运行
 */
public class HealthMonitor {

    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    private static final String MDC_DEPLOYMENT_ID = "deploymentId";
    private static final int ALERT_RECENT_METRICS = 3;

    private final List<HealthCheckDefinition> checks;
    private final List<MonitoringRule> rules;
    private final Map<CheckType, HealthProbe> probes;
    private final MetricStore metricStore;
    private final MonitoringRuleStateRepository ruleStateRepository;
    private final NotificationChannel notificationChannel;
    private final LogPreservationService logPreservationService;
    private final ExecutorService probeExecutor;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final DeploymentId deploymentId;
    private final int intervalSeconds;
    private final String alertChannel;

    private final Map<String, LocalDateTime> lastRunAt = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object tickLock = new Object();

    private volatile RollbackRuleHandler rollbackHandler;
    private volatile LocalDateTime lastTickAt;
    private ScheduledExecutorService scheduler;

    public HealthMonitor(List<HealthCheckDefinition> checks,
                         List<MonitoringRule> rules,
                         Map<CheckType, HealthProbe> probes,
                         MetricStore metricStore,
                         MonitoringRuleStateRepository ruleStateRepository,
                         NotificationChannel notificationChannel,
                         LogPreservationService logPreservationService,
                         ExecutorService probeExecutor,
                         MetricsRegistry metrics,
                         Clock clock,
                         DeploymentId deploymentId,
                         int intervalSeconds,
                         String alertChannel) {
        this.checks = List.copyOf(checks);
        List<MonitoringRule> ordered = new ArrayList<>(rules);
        ordered.sort(MonitoringRule.EVALUATION_ORDER);
        this.rules = List.copyOf(ordered);
        this.probes = Map.copyOf(probes);
        this.metricStore = Objects.requireNonNull(metricStore);
        this.ruleStateRepository = Objects.requireNonNull(ruleStateRepository);
        this.notificationChannel = Objects.requireNonNull(notificationChannel);
        this.logPreservationService = Objects.requireNonNull(logPreservationService);
        this.probeExecutor = Objects.requireNonNull(probeExecutor);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
        this.deploymentId = Objects.requireNonNull(deploymentId);
        this.intervalSeconds = intervalSeconds;
        this.alertChannel = alertChannel;
        validateChecks();
    }

    private void validateChecks() {
        for (HealthCheckDefinition check : checks) {
            if (check.getType() == null || !probes.containsKey(check.getType())) {
                throw new IllegalStateException(String.format(
                        "健康检查 %s 的类型 %s 没有可用的探测器", check.getCheckId(), check.getType()));
            }
        }
    }

    public void setRollbackHandler(RollbackRuleHandler rollbackHandler) {
        this.rollbackHandler = rollbackHandler;
    }

    // ========== 生命周期 ==========

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        restoreRuleState();
        scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("health-monitor"));
        scheduler.scheduleWithFixedDelay(this::safeTick, 0, intervalSeconds, TimeUnit.SECONDS);
        logger.info("[HealthMonitor] 启动: deploymentId={}, checks={}, rules={}, interval={}s",
                deploymentId, checks.size(), rules.size(), intervalSeconds);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("[HealthMonitor] 调度线程未在 5 秒内退出");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("[HealthMonitor] 已停止: deploymentId={}", deploymentId);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 从持久化状态恢复规则的 lastFiredAt，重启后冷却期继续生效
     */
    void restoreRuleState() {
        Map<String, LocalDateTime> saved = ruleStateRepository.findAll();
        for (MonitoringRule rule : rules) {
            LocalDateTime lastFiredAt = saved.get(rule.getRuleId());
            if (lastFiredAt != null) {
                rule.restoreLastFiredAt(lastFiredAt);
                logger.info("[HealthMonitor] 恢复规则冷却状态: ruleId={}, lastFiredAt={}", rule.getRuleId(), lastFiredAt);
            }
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            logger.error("[HealthMonitor] tick 执行异常: deploymentId={}", deploymentId, e);
        }
    }

    // ========== tick ==========

    /**
     * 执行一次完整的检查与规则评估
     *
     * @return 本次触发的规则
     */
    public List<RuleFiring> tick() {
        synchronized (tickLock) {
            MDC.put(MDC_DEPLOYMENT_ID, deploymentId.getValue());
            try {
                LocalDateTime now = LocalDateTime.now(clock);
                List<HealthCheckDefinition> due = checks.stream()
                        .filter(HealthCheckDefinition::isEnabled)
                        .filter(check -> isDue(check, now))
                        .toList();
                List<HealthCheckResult> results = runChecks(due);
                metricStore.recordAll(results);
                int evicted = metricStore.evictExpired();
                if (evicted > 0) {
                    logger.debug("[HealthMonitor] 淘汰过期样本: {}", evicted);
                }
                lastTickAt = now;
                return evaluateRules();
            } finally {
                MDC.remove(MDC_DEPLOYMENT_ID);
            }
        }
    }

    private boolean isDue(HealthCheckDefinition check, LocalDateTime now) {
        LocalDateTime last = lastRunAt.get(check.getCheckId());
        return last == null
                || Duration.between(last, now).compareTo(Duration.ofSeconds(check.getIntervalSeconds())) >= 0;
    }

    /**
     * 并发执行检查，全部汇合后返回；超时的检查记为 critical
     */
    List<HealthCheckResult> runChecks(List<HealthCheckDefinition> due) {
        if (due.isEmpty()) {
            return List.of();
        }
        Map<HealthCheckDefinition, Future<HealthCheckResult>> futures = new LinkedHashMap<>();
        for (HealthCheckDefinition check : due) {
            futures.put(check, probeExecutor.submit(() -> probe(check)));
        }
        List<HealthCheckResult> results = new ArrayList<>(due.size());
        for (Map.Entry<HealthCheckDefinition, Future<HealthCheckResult>> entry : futures.entrySet()) {
            HealthCheckDefinition check = entry.getKey();
            results.add(await(check, entry.getValue()));
            lastRunAt.put(check.getCheckId(), LocalDateTime.now(clock));
            metrics.incrementCounter("health_check_executed");
        }
        return results;
    }

    private HealthCheckResult await(HealthCheckDefinition check, Future<HealthCheckResult> future) {
        // 探测器自身也有超时，这里多留 1 秒给它返回结果
        long waitSeconds = check.getTimeoutSeconds() + 1L;
        try {
            return future.get(waitSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("[HealthMonitor] 检查超时: checkId={}, timeout={}s", check.getCheckId(), check.getTimeoutSeconds());
            return HealthCheckResult.of(check, HealthStatus.CRITICAL, 0, LocalDateTime.now(clock),
                    "检查超时: " + check.getTimeoutSeconds() + "s");
        } catch (ExecutionException e) {
            logger.warn("[HealthMonitor] 检查执行异常: checkId={}", check.getCheckId(), e.getCause());
            return HealthCheckResult.of(check, HealthStatus.CRITICAL, 0, LocalDateTime.now(clock),
                    "检查执行异常: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return HealthCheckResult.of(check, HealthStatus.UNKNOWN, 0, LocalDateTime.now(clock), "检查被中断");
        }
    }

    private HealthCheckResult probe(HealthCheckDefinition check) {
        HealthCheckResult result = probes.get(check.getType()).probe(check);
        if (result.status().isFailure()) {
            logger.info("[HealthMonitor] 检查异常: checkId={}, service={}, status={}, message={}",
                    check.getCheckId(), check.getService(), result.status().getCode(), result.message());
        } else {
            logger.debug("[HealthMonitor] 检查通过: checkId={}, value={}", check.getCheckId(), result.value());
        }
        return result;
    }

    /**
     * 外部样本写入（例如由其他组件推送的检查结果）
     */
    public void record(HealthCheckResult result) {
        metricStore.record(result);
    }

    // ========== 规则评估 ==========

    /**
     * 在一份快照上按优先级评估全部规则
     */
    public List<RuleFiring> evaluateRules() {
        MetricSnapshot snapshot = metricStore.snapshot();
        List<RuleFiring> fired = new ArrayList<>();
        for (MonitoringRule rule : rules) {
            if (!rule.isEnabled()) {
                continue;
            }
            boolean matched;
            try {
                matched = rule.getCondition().evaluate(snapshot);
            } catch (RuntimeException e) {
                logger.error("[HealthMonitor] 规则条件评估异常: ruleId={}", rule.getRuleId(), e);
                continue;
            }
            if (!matched) {
                continue;
            }
            LocalDateTime now = LocalDateTime.now(clock);
            if (!rule.tryFire(now)) {
                logger.debug("[HealthMonitor] 规则命中但处于冷却期: ruleId={}, lastFiredAt={}",
                        rule.getRuleId(), rule.getLastFiredAt());
                continue;
            }
            persistRuleState(rule, now);
            metrics.incrementCounter("health_rule_fired");
            logger.warn("[HealthMonitor] 规则触发: ruleId={}, action={}, condition={}",
                    rule.getRuleId(), rule.getAction().getCode(), rule.getCondition().describe());

            RuleFiring firing = new RuleFiring(rule, deploymentId, buildReport(snapshot, deploymentId, now), now);
            fired.add(firing);
            dispatch(firing, snapshot);
        }
        return fired;
    }

    private void persistRuleState(MonitoringRule rule, LocalDateTime firedAt) {
        try {
            ruleStateRepository.saveLastFiredAt(rule.getRuleId(), firedAt);
        } catch (RuntimeException e) {
            // 内存中的冷却状态已更新，本进程内不会重复触发
            logger.error("[HealthMonitor] 持久化规则触发时间失败: ruleId={}", rule.getRuleId(), e);
        }
    }

    private void dispatch(RuleFiring firing, MetricSnapshot snapshot) {
        MonitoringRule rule = firing.rule();
        switch (rule.getAction()) {
            case ALERT -> sendAlert(formatAlert(firing, snapshot));
            case PRESERVE_LOGS -> preserveLogs(rule, snapshot);
            case ROLLBACK -> handleRollback(firing);
        }
    }

    private void handleRollback(RuleFiring firing) {
        RollbackRuleHandler handler = this.rollbackHandler;
        if (handler == null) {
            logger.warn("[HealthMonitor] 未注册回滚处理器，忽略 rollback 动作: ruleId={}", firing.rule().getRuleId());
            return;
        }
        try {
            handler.onRuleFired(firing);
        } catch (RuntimeException e) {
            logger.error("[HealthMonitor] 回滚处理器异常: ruleId={}", firing.rule().getRuleId(), e);
        }
    }

    private void preserveLogs(MonitoringRule rule, MetricSnapshot snapshot) {
        List<String> services = rule.getServices().isEmpty()
                ? snapshot.getServices().stream().sorted().toList()
                : rule.getServices();
        try {
            String location = logPreservationService.preserve(deploymentId, services);
            logger.info("[HealthMonitor] 日志已保全: ruleId={}, services={}, location={}",
                    rule.getRuleId(), services, location);
        } catch (RuntimeException e) {
            logger.error("[HealthMonitor] 日志保全失败: ruleId={}, services={}", rule.getRuleId(), services, e);
        }
    }

    /**
     * 发送告警（尽力而为）
     */
    public void sendAlert(String message) {
        try {
            if (!notificationChannel.send(alertChannel, message)) {
                logger.warn("[HealthMonitor] 告警发送失败: channel={}", alertChannel);
            }
        } catch (RuntimeException e) {
            logger.warn("[HealthMonitor] 告警发送异常: channel={}, error={}", alertChannel, e.getMessage());
        }
    }

    String formatAlert(RuleFiring firing, MetricSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append("[健康告警] 规则: ").append(firing.rule().getName())
                .append(" (").append(firing.rule().getRuleId()).append(")\n");
        sb.append("部署: ").append(deploymentId).append('\n');
        sb.append("整体状态: ").append(firing.report().overallStatus().getCode()).append('\n');
        sb.append("条件: ").append(firing.rule().getCondition().describe()).append('\n');
        for (String service : snapshot.getServices()) {
            String recent = snapshot.getRecentResults(service, ALERT_RECENT_METRICS).stream()
                    .map(r -> r.checkId() + "=" + r.status().getCode() + "(" + r.value() + ")")
                    .collect(Collectors.joining(", "));
            sb.append("  ").append(service).append(": ").append(recent).append('\n');
        }
        return sb.toString();
    }

    // ========== 报告 ==========

    public HealthReport generateHealthReport(DeploymentId deploymentId) {
        return buildReport(metricStore.snapshot(), deploymentId, LocalDateTime.now(clock));
    }

    /**
     * 立即执行全部启用的检查（忽略各自的 interval）后生成报告，用于回滚后验证
     */
    public HealthReport verifyNow(DeploymentId deploymentId) {
        List<HealthCheckDefinition> enabled = checks.stream().filter(HealthCheckDefinition::isEnabled).toList();
        metricStore.recordAll(runChecks(enabled));
        return generateHealthReport(deploymentId);
    }

    HealthReport buildReport(MetricSnapshot snapshot, DeploymentId deploymentId, LocalDateTime now) {
        Map<String, HealthStatus> services = new LinkedHashMap<>();
        Map<String, Integer> failureCounts = new LinkedHashMap<>();
        for (String service : snapshot.getServices()) {
            snapshot.getServiceStatus(service).ifPresent(status -> services.put(service, status));
            failureCounts.put(service, snapshot.getTotalFailures(service));
        }
        List<String> failedChecks = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        snapshot.getLatestByCheck().values().stream()
                .sorted(Comparator.comparing(HealthCheckResult::checkId))
                .forEach(r -> {
                    if (r.status() == HealthStatus.CRITICAL) {
                        failedChecks.add(r.checkId());
                    } else if (r.status() == HealthStatus.WARNING || r.status() == HealthStatus.UNKNOWN) {
                        warnings.add(r.checkId());
                    }
                });
        HealthStatus overall = HealthReport.deriveOverall(services);
        List<String> recommendations = recommend(snapshot, services, overall);
        return new HealthReport(deploymentId, overall, services, failedChecks, warnings, failureCounts,
                recommendations, now);
    }

    private List<String> recommend(MetricSnapshot snapshot, Map<String, HealthStatus> services, HealthStatus overall) {
        List<String> recommendations = new ArrayList<>();
        if (snapshot.isEmpty()) {
            recommendations.add("暂无健康检查数据，确认检查配置是否生效");
            return recommendations;
        }
        List<String> unhealthy = services.entrySet().stream()
                .filter(e -> e.getValue().isFailure())
                .map(Map.Entry::getKey)
                .toList();
        if (unhealthy.size() == 1) {
            String service = unhealthy.get(0);
            recommendations.add(String.format("排查 %s 服务%s", service, describeSymptom(snapshot, service)));
        } else if (unhealthy.size() > 1) {
            recommendations.add(String.format("多个服务异常 %s，评估是否需要整体回滚", unhealthy));
        }
        boolean resourcePressure = snapshot.getLatestByCheck().values().stream()
                .anyMatch(r -> r.checkType() == CheckType.SYSTEM_RESOURCE && r.status().isFailure());
        if (resourcePressure) {
            recommendations.add("系统资源紧张，检查 CPU / 内存 / 磁盘占用");
        }
        if (overall == HealthStatus.CRITICAL) {
            recommendations.add("存在严重异常，确认是否需要立即回滚");
        }
        return recommendations;
    }

    private String describeSymptom(MetricSnapshot snapshot, String service) {
        return snapshot.getLatestByCheck().values().stream()
                .filter(r -> r.service().equals(service) && r.status().isFailure() && r.checkType() != null)
                .findFirst()
                .map(r -> switch (r.checkType()) {
                    case HTTP_RESPONSE -> r.status() == HealthStatus.WARNING ? "的响应延迟" : "的接口可用性";
                    case DATABASE_CONNECTION -> "的数据库连接";
                    case SYSTEM_RESOURCE -> "的资源使用率";
                    case CUSTOM -> "的自定义检查 " + r.checkId();
                })
                .orElse("");
    }

    // ========== 查询 ==========

    public List<MonitoringRule> getRules() {
        return rules;
    }

    public List<HealthCheckDefinition> getChecks() {
        return checks;
    }

    public MetricStore getMetricStore() {
        return metricStore;
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public LocalDateTime getLastTickAt() {
        return lastTickAt;
    }
}
