package xyz.firestige.rollback.facade;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollback.application.IntegrationStatus;
import xyz.firestige.rollback.application.MonitorRollbackIntegration;
import xyz.firestige.rollback.application.RollbackOrchestrator;
import xyz.firestige.rollback.application.RollbackRejectedException;
import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.RollbackTrigger;
import xyz.firestige.rollback.domain.health.HealthReport;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.domain.shared.exception.FailureInfo;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;
import xyz.firestige.rollback.facade.exception.RollbackNotFoundException;
import xyz.firestige.rollback.facade.exception.RollbackOperationException;
import xyz.firestige.rollback.infrastructure.health.HealthMonitor;
import xyz.firestige.rollback.infrastructure.persistence.RollbackObjectMapperFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 回滚引擎 Facade
 * <p>
 * 职责：
 * 1. 参数校验（快速失败）
 * 2. 调用应用服务（RollbackOrchestrator, MonitorRollbackIntegration）
 * 3. 异常转换：RollbackRejectedException → RollbackOperationException
 * 4. 状态输出（snake_case JSON，供 CLI / 状态接口使用）
 */
public class RollbackFacade {

    private static final Logger logger = LoggerFactory.getLogger(RollbackFacade.class);

    private final RollbackOrchestrator orchestrator;
    private final MonitorRollbackIntegration integration;
    private final HealthMonitor healthMonitor;
    private final Validator validator;
    private final ObjectMapper statusMapper;

    public RollbackFacade(RollbackOrchestrator orchestrator,
                          MonitorRollbackIntegration integration,
                          HealthMonitor healthMonitor,
                          Validator validator) {
        this.orchestrator = orchestrator;
        this.integration = integration;
        this.healthMonitor = healthMonitor;
        this.validator = validator;
        this.statusMapper = RollbackObjectMapperFactory.create()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    /**
     * 人工回滚
     *
     * @return executionId
     */
    public String manualRollback(ManualRollbackRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("回滚请求不能为空");
        }
        Set<ConstraintViolation<ManualRollbackRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String errorDetail = violations.stream()
                    .map(v -> String.format("[%s] %s", v.getPropertyPath(), v.getMessage()))
                    .collect(Collectors.joining("; "));
            logger.warn("[Facade] 人工回滚请求校验失败: {}", errorDetail);
            throw new IllegalArgumentException("人工回滚请求校验失败: " + errorDetail);
        }

        logger.info("[Facade] 人工回滚: deploymentId={}, environment={}, reason={}",
                request.getDeploymentId(), request.getEnvironment(), request.getReason());
        try {
            RollbackExecution execution = integration.manualRollback(DeploymentId.of(request.getDeploymentId()),
                    request.getEnvironment(), request.getReason(), request.getServices(), request.isPreserveLogs());
            logger.info("[Facade] 人工回滚已提交: executionId={}", execution.getExecutionId());
            return execution.getExecutionId().getValue();
        } catch (RollbackRejectedException e) {
            throw new RollbackOperationException(e.getMessage(), e.toFailureInfo(), e);
        }
    }

    /**
     * 以指定触发器和目标发起回滚
     *
     * @return executionId
     */
    public String initiateRollback(RollbackTrigger trigger, List<RollbackTarget> targets) {
        if (trigger == null) {
            throw new IllegalArgumentException("trigger 不能为空");
        }
        try {
            return orchestrator.initiateRollback(trigger, targets).getExecutionId().getValue();
        } catch (RollbackRejectedException e) {
            throw new RollbackOperationException(e.getMessage(), e.toFailureInfo(), e);
        }
    }

    /**
     * 目标校验（dry-run）
     */
    public List<String> validateTargets(List<RollbackTarget> targets) {
        return orchestrator.validateTargets(targets);
    }

    public RollbackStatusInfo queryRollbackStatus(String executionId) {
        logger.debug("[Facade] 查询回滚状态: {}", executionId);
        return orchestrator.getRollbackStatus(ExecutionId.of(executionId))
                .map(RollbackStatusInfo::from)
                .orElseThrow(() -> new RollbackNotFoundException("回滚执行不存在: " + executionId));
    }

    public List<RollbackStatusInfo> queryRollbackHistory(String deploymentId) {
        return orchestrator.getRollbackHistory(DeploymentId.of(deploymentId)).stream()
                .map(RollbackStatusInfo::from)
                .toList();
    }

    public void cancelRollback(String executionId, String operator) {
        logger.info("[Facade] 取消回滚: executionId={}, operator={}", executionId, operator);
        ExecutionId id = ExecutionId.of(executionId);
        if (orchestrator.getRollbackStatus(id).isEmpty()) {
            throw new RollbackNotFoundException("回滚执行不存在: " + executionId);
        }
        if (!orchestrator.cancelRollback(id, operator)) {
            throw new RollbackOperationException("回滚执行已结束，无法取消: " + executionId,
                    FailureInfo.of("already_terminal", ErrorType.BUSINESS_ERROR,
                            "回滚执行已结束，无法取消", "cancel_rollback"));
        }
    }

    public HealthReport generateHealthReport(String deploymentId) {
        return healthMonitor.generateHealthReport(DeploymentId.of(deploymentId));
    }

    public IntegrationStatus queryStatus() {
        return integration.getStatus();
    }

    /**
     * 集成状态 JSON：
     * {integration_running, deployment_id, environment, health_status,
     *  active_rollbacks, total_rollbacks, auto_rollback_enabled, last_report_time}
     */
    public String queryStatusJson() {
        try {
            return statusMapper.writeValueAsString(integration.getStatus());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("状态序列化失败", e);
        }
    }
}
