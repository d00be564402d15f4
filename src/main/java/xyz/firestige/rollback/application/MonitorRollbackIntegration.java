package xyz.firestige.rollback.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollback.config.properties.IntegrationProperties;
import xyz.firestige.rollback.config.properties.TargetDefinition;
import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.RollbackTrigger;
import xyz.firestige.rollback.domain.health.HealthReport;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.health.MonitoringRule;
import xyz.firestige.rollback.domain.health.RuleAction;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;
import xyz.firestige.rollback.infrastructure.execution.NamedThreadFactory;
import xyz.firestige.rollback.infrastructure.external.LogPreservationService;
import xyz.firestige.rollback.infrastructure.external.NotificationChannel;
import xyz.firestige.rollback.infrastructure.health.HealthMonitor;
import xyz.firestige.rollback.infrastructure.health.RollbackRuleHandler;
import xyz.firestige.rollback.infrastructure.health.RuleFiring;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 监控与回滚的集成层
 * <p>
 * 职责：
 * 1. 把触发的 rollback 规则转换为 RollbackTrigger + 自动回滚目标，提交给编排器
 * 2. 去重：部署已有进行中的回滚时本次为空操作
 * 3. 人工回滚入口（绕过规则评估）
 * 4. 监督循环：慢回滚告警、回滚结束后的稳定性观察
 * 5. 汇总对外状态
 */
public class MonitorRollbackIntegration implements RollbackRuleHandler {

    private static final Logger logger = LoggerFactory.getLogger(MonitorRollbackIntegration.class);

    private final RollbackOrchestrator orchestrator;
    private final HealthMonitor healthMonitor;
    private final LogPreservationService logPreservationService;
    private final NotificationChannel notificationChannel;
    private final IntegrationProperties properties;
    private final Clock clock;
    private final DeploymentId deploymentId;

    private final Map<ExecutionId, PostRollbackWatch> watches = new ConcurrentHashMap<>();
    private final Set<ExecutionId> slowAlerted = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile HealthReport lastReport;
    private volatile IntegrationOutcome lastOutcome;
    private ScheduledExecutorService supervisor;

    public MonitorRollbackIntegration(RollbackOrchestrator orchestrator,
                                      HealthMonitor healthMonitor,
                                      LogPreservationService logPreservationService,
                                      NotificationChannel notificationChannel,
                                      IntegrationProperties properties,
                                      Clock clock) {
        this.orchestrator = orchestrator;
        this.healthMonitor = healthMonitor;
        this.logPreservationService = logPreservationService;
        this.notificationChannel = notificationChannel;
        this.properties = properties;
        this.clock = clock;
        this.deploymentId = DeploymentId.of(properties.getDeploymentId());
    }

    // ========== 生命周期 ==========

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        healthMonitor.setRollbackHandler(this);
        supervisor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("rollback-supervisor"));
        int interval = properties.getSupervisionIntervalSeconds();
        supervisor.scheduleWithFixedDelay(this::safeSupervise, interval, interval, TimeUnit.SECONDS);
        logger.info("[Integration] 启动: deploymentId={}, environment={}, autoRollbackEnabled={}, autoTargets={}",
                deploymentId, properties.getEnvironment(), properties.isAutoRollbackEnabled(),
                properties.getAutoRollbackTargets().size());
    }

    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        healthMonitor.setRollbackHandler(null);
        supervisor.shutdownNow();
        logger.info("[Integration] 已停止: deploymentId={}", deploymentId);
    }

    public boolean isRunning() {
        return running.get();
    }

    // ========== 规则触发 ==========

    @Override
    public void onRuleFired(RuleFiring firing) {
        lastOutcome = handleRuleFired(firing);
    }

    /**
     * 处理一次规则触发
     */
    public IntegrationOutcome handleRuleFired(RuleFiring firing) {
        MonitoringRule rule = firing.rule();
        if (rule.getAction() != RuleAction.ROLLBACK) {
            return IntegrationOutcome.IGNORED;
        }
        DeploymentId target = firing.deploymentId();
        lastReport = firing.report();

        if (!properties.isAutoRollbackEnabled()) {
            logger.warn("[Integration] 自动回滚已关闭，规则 {} 的 rollback 动作降级为告警: deploymentId={}",
                    rule.getRuleId(), target);
            notifyOps(String.format("[自动回滚已关闭] 规则 %s 命中，部署 %s 需要人工确认是否回滚。整体状态: %s",
                    rule.getRuleId(), target, firing.report().overallStatus().getCode()));
            return IntegrationOutcome.AUTO_ROLLBACK_DISABLED;
        }

        Optional<RollbackExecution> existing = orchestrator.getActiveExecution(target);
        if (existing.isPresent()) {
            logger.info("[Integration] 部署已有进行中的回滚，忽略规则 {}: executionId={}",
                    rule.getRuleId(), existing.get().getExecutionId());
            return IntegrationOutcome.DEDUPLICATED;
        }

        if (properties.isRequireManualApproval()) {
            logger.warn("[Integration] 规则 {} 命中，等待人工审批回滚: deploymentId={}", rule.getRuleId(), target);
            notifyOps(String.format("[待审批] 规则 %s 命中，部署 %s 建议回滚，需要人工审批",
                    rule.getRuleId(), target));
            return IntegrationOutcome.APPROVAL_REQUIRED;
        }

        List<RollbackTarget> targets = toTargets(properties.getAutoRollbackTargets(), properties.getEnvironment());
        if (targets.isEmpty()) {
            logger.warn("[Integration] 未配置自动回滚目标，规则 {} 无法发起回滚", rule.getRuleId());
            notifyOps(String.format("[自动回滚失败] 规则 %s 命中，但没有配置自动回滚目标", rule.getRuleId()));
            return IntegrationOutcome.REJECTED;
        }

        if (properties.isPreserveLogsBeforeRollback()) {
            preserveLogs(target, rule.getServices().isEmpty() ? properties.getServices() : rule.getServices());
        }

        RollbackTrigger trigger = RollbackTrigger.healthCheckFailure(target,
                String.format("规则 %s 触发: %s", rule.getRuleId(), rule.getCondition().describe()),
                LocalDateTime.now(clock));
        try {
            RollbackExecution execution = orchestrator.initiateRollback(trigger, targets);
            watch(execution);
            logger.warn("[Integration] 已发起自动回滚: executionId={}, rule={}", execution.getExecutionId(), rule.getRuleId());
            notifyOps(String.format("[自动回滚] 规则 %s 命中，已对部署 %s 发起回滚: %s",
                    rule.getRuleId(), target, execution.getExecutionId()));
            return IntegrationOutcome.SUBMITTED;
        } catch (RollbackRejectedException e) {
            if (e.getReason() == RejectionReason.CONCURRENT_EXECUTION_EXISTS) {
                logger.info("[Integration] 提交时发现进行中的回滚，忽略规则 {}: existing={}",
                        rule.getRuleId(), e.getExistingExecutionId());
                return IntegrationOutcome.DEDUPLICATED;
            }
            logger.error("[Integration] 自动回滚被拒绝: rule={}, {}", rule.getRuleId(), e.getMessage());
            notifyOps("[自动回滚失败] " + e.getMessage());
            return IntegrationOutcome.REJECTED;
        }
    }

    // ========== 人工回滚 ==========

    /**
     * 人工回滚（绕过规则评估），使用全部人工回滚目标
     */
    public RollbackExecution manualRollback(String deploymentId, String reason) {
        return manualRollback(DeploymentId.of(deploymentId), null, reason, List.of(), false);
    }

    /**
     * 人工回滚
     *
     * @param environment  目标环境，为空时使用配置的环境
     * @param services     只回滚这些服务的目标，为空表示全部
     * @param preserveLogs 回滚前保全日志
     * @throws RollbackRejectedException 校验失败或部署已有进行中的回滚
     */
    public RollbackExecution manualRollback(DeploymentId deploymentId, String environment, String reason,
                                            List<String> services, boolean preserveLogs) {
        List<TargetDefinition> definitions = properties.getManualRollbackTargets().isEmpty()
                ? properties.getAutoRollbackTargets()
                : properties.getManualRollbackTargets();
        String env = environment != null && !environment.isBlank() ? environment : properties.getEnvironment();
        List<RollbackTarget> targets = toTargets(definitions, env).stream()
                .filter(t -> services == null || services.isEmpty()
                        || services.contains(t.service().getCode()) || services.contains(t.name()))
                .toList();
        logger.info("[Integration] 人工回滚: deploymentId={}, reason={}, targets={}", deploymentId, reason, targets.size());

        if (preserveLogs) {
            List<String> scope = services == null || services.isEmpty() ? properties.getServices() : services;
            preserveLogs(deploymentId, scope);
        }
        RollbackTrigger trigger = RollbackTrigger.manual(deploymentId, reason, LocalDateTime.now(clock));
        RollbackExecution execution = orchestrator.initiateRollback(trigger, targets);
        watch(execution);
        notifyOps(String.format("[人工回滚] 部署 %s 已发起回滚: %s, 原因: %s",
                deploymentId, execution.getExecutionId(), reason));
        return execution;
    }

    private List<RollbackTarget> toTargets(List<TargetDefinition> definitions, String environment) {
        List<RollbackTarget> targets = new ArrayList<>(definitions.size());
        for (TargetDefinition definition : definitions) {
            targets.add(definition.toTarget(environment));
        }
        return targets;
    }

    private void preserveLogs(DeploymentId target, List<String> services) {
        try {
            String location = logPreservationService.preserve(target, services);
            logger.info("[Integration] 回滚前日志已保全: deploymentId={}, location={}", target, location);
        } catch (RuntimeException e) {
            // 日志保全失败不阻止回滚
            logger.error("[Integration] 回滚前日志保全失败: deploymentId={}, services={}", target, services, e);
        }
    }

    // ========== 监督循环 ==========

    private void watch(RollbackExecution execution) {
        watches.put(execution.getExecutionId(), new PostRollbackWatch(execution.getExecutionId(), execution.getDeploymentId()));
    }

    private void safeSupervise() {
        try {
            supervise();
        } catch (RuntimeException e) {
            logger.error("[Integration] 监督循环异常", e);
        }
    }

    /**
     * 一次监督：刷新报告、慢回滚告警、回滚后稳定性观察
     */
    void supervise() {
        LocalDateTime now = LocalDateTime.now(clock);
        lastReport = healthMonitor.generateHealthReport(deploymentId);

        for (RollbackExecution execution : orchestrator.getActiveExecutions()) {
            checkSlowRollback(execution, now);
        }
        for (PostRollbackWatch watch : List.copyOf(watches.values())) {
            observe(watch, now);
        }
    }

    private void checkSlowRollback(RollbackExecution execution, LocalDateTime now) {
        Duration limit = Duration.ofMinutes(properties.getVerificationTimeoutMinutes());
        if (execution.getStartedAt() == null || Duration.between(execution.getStartedAt(), now).compareTo(limit) < 0) {
            return;
        }
        if (slowAlerted.add(execution.getExecutionId())) {
            logger.warn("[Integration] 回滚执行超过 {} 分钟仍未结束: executionId={}, status={}",
                    limit.toMinutes(), execution.getExecutionId(), execution.getStatus().getCode());
            notifyOps(String.format("[回滚缓慢] 执行 %s 已运行超过 %d 分钟，当前状态: %s",
                    execution.getExecutionId(), limit.toMinutes(), execution.getStatus().getCode()));
        }
    }

    private void observe(PostRollbackWatch watch, LocalDateTime now) {
        Optional<RollbackExecution> status = orchestrator.getRollbackStatus(watch.executionId);
        if (status.isEmpty()) {
            watches.remove(watch.executionId);
            return;
        }
        RollbackExecution execution = status.get();
        if (!execution.isTerminal()) {
            return;
        }
        slowAlerted.remove(watch.executionId);
        if (watch.observationStartedAt == null) {
            watch.observationStartedAt = now;
            logger.info("[Integration] 回滚已结束，开始稳定性观察: executionId={}, status={}",
                    watch.executionId, execution.getStatus().getCode());
        }

        HealthReport report = healthMonitor.generateHealthReport(watch.deploymentId);
        watch.consecutiveHealthy = report.isHealthy() ? watch.consecutiveHealthy + 1 : 0;

        if (watch.consecutiveHealthy >= properties.getStableReportsRequired()) {
            watches.remove(watch.executionId);
            logger.info("[Integration] 回滚后系统已稳定: executionId={}", watch.executionId);
            notifyOps(String.format("[回滚成功] 执行 %s 结束后连续 %d 次健康检查正常",
                    watch.executionId, watch.consecutiveHealthy));
            return;
        }
        Duration window = Duration.ofMinutes(properties.getPostRollbackMonitoringMinutes());
        if (Duration.between(watch.observationStartedAt, now).compareTo(window) >= 0) {
            watches.remove(watch.executionId);
            logger.warn("[Integration] 回滚后观察窗口内系统未稳定: executionId={}, overall={}",
                    watch.executionId, report.overallStatus().getCode());
            notifyOps(String.format("[回滚后不稳定] 执行 %s 结束后 %d 分钟内未稳定，当前状态: %s，失败检查: %s",
                    watch.executionId, window.toMinutes(), report.overallStatus().getCode(), report.failedChecks()));
        }
    }

    private void notifyOps(String message) {
        try {
            if (!notificationChannel.send(properties.getAlertChannel(), message)) {
                logger.warn("[Integration] 通知发送失败: channel={}", properties.getAlertChannel());
            }
        } catch (RuntimeException e) {
            logger.warn("[Integration] 通知发送异常: channel={}, error={}", properties.getAlertChannel(), e.getMessage());
        }
    }

    // ========== 状态 ==========

    public IntegrationStatus getStatus() {
        HealthReport report = lastReport;
        return new IntegrationStatus(
                running.get(),
                deploymentId.getValue(),
                properties.getEnvironment(),
                report != null ? report.overallStatus().getCode() : HealthStatus.UNKNOWN.getCode(),
                orchestrator.getActiveCount(),
                orchestrator.getTotalCount(),
                properties.isAutoRollbackEnabled(),
                report != null ? report.generatedAt() : null);
    }

    public IntegrationOutcome getLastOutcome() {
        return lastOutcome;
    }

    int getWatchCount() {
        return watches.size();
    }

    private static final class PostRollbackWatch {
        private final ExecutionId executionId;
        private final DeploymentId deploymentId;
        private LocalDateTime observationStartedAt;
        private int consecutiveHealthy;

        private PostRollbackWatch(ExecutionId executionId, DeploymentId deploymentId) {
            this.executionId = executionId;
            this.deploymentId = deploymentId;
        }
    }
}
