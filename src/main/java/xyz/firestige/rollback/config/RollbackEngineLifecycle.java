package xyz.firestige.rollback.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import xyz.firestige.rollback.application.MonitorRollbackIntegration;
import xyz.firestige.rollback.application.RollbackOrchestrator;
import xyz.firestige.rollback.infrastructure.health.HealthMonitor;

/**
 * 引擎生命周期：容器就绪后启动监控与联动，关闭时按相反顺序停止
 * <p>
 * 编排器最后关闭，等待进行中的回滚结束（超时后取消）
 */
public class RollbackEngineLifecycle implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(RollbackEngineLifecycle.class);

    private final MonitorRollbackIntegration integration;
    private final HealthMonitor healthMonitor;
    private final RollbackOrchestrator orchestrator;
    private final boolean monitorEnabled;
    private final boolean integrationEnabled;

    private volatile boolean running;

    public RollbackEngineLifecycle(MonitorRollbackIntegration integration, HealthMonitor healthMonitor,
                                   RollbackOrchestrator orchestrator, boolean monitorEnabled,
                                   boolean integrationEnabled) {
        this.integration = integration;
        this.healthMonitor = healthMonitor;
        this.orchestrator = orchestrator;
        this.monitorEnabled = monitorEnabled;
        this.integrationEnabled = integrationEnabled;
    }

    @Override
    public void start() {
        if (integrationEnabled) {
            integration.start();
        }
        if (monitorEnabled) {
            healthMonitor.start();
        } else {
            logger.info("[Lifecycle] 健康监控未启用，仅提供手动回滚");
        }
        running = true;
    }

    @Override
    public void stop() {
        logger.info("[Lifecycle] 停止回滚引擎");
        healthMonitor.stop();
        integration.shutdown();
        orchestrator.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
