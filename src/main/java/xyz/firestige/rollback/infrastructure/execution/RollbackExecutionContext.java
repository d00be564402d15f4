package xyz.firestige.rollback.infrastructure.execution;

import org.slf4j.MDC;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

/**
 * 回滚执行运行时上下文：MDC、取消标记和部署锁续租
 */
public class RollbackExecutionContext {

    public static final String MDC_EXECUTION_ID = "executionId";
    public static final String MDC_DEPLOYMENT_ID = "deploymentId";
    public static final String MDC_TARGET = "target";

    private final ExecutionId executionId;
    private final DeploymentId deploymentId;
    private volatile boolean cancelRequested;
    private volatile Runnable leaseRenewal = () -> { };

    public RollbackExecutionContext(ExecutionId executionId, DeploymentId deploymentId) {
        this.executionId = executionId;
        this.deploymentId = deploymentId;
    }

    public void injectMdc(String targetName) {
        MDC.put(MDC_EXECUTION_ID, executionId.getValue());
        MDC.put(MDC_DEPLOYMENT_ID, deploymentId.getValue());
        if (targetName != null) {
            MDC.put(MDC_TARGET, targetName);
        } else {
            MDC.remove(MDC_TARGET);
        }
    }

    public void clearMdc() {
        MDC.remove(MDC_EXECUTION_ID);
        MDC.remove(MDC_DEPLOYMENT_ID);
        MDC.remove(MDC_TARGET);
    }

    public boolean isCancelRequested() { return cancelRequested; }
    public void requestCancel() { this.cancelRequested = true; }

    /**
     * 由执行器在步骤边界调用，保证部署锁在执行进入终态前不过期
     */
    public void renewLease() {
        leaseRenewal.run();
    }

    public void setLeaseRenewal(Runnable leaseRenewal) {
        this.leaseRenewal = leaseRenewal != null ? leaseRenewal : () -> { };
    }

    public ExecutionId getExecutionId() { return executionId; }
    public DeploymentId getDeploymentId() { return deploymentId; }
}
