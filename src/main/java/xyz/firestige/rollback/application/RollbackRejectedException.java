package xyz.firestige.rollback.application;

import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.domain.shared.exception.FailureInfo;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.util.List;

/**
 * 回滚请求被同步拒绝（不会创建 RollbackExecution）
 */
public class RollbackRejectedException extends RuntimeException {

    private final RejectionReason reason;
    private final DeploymentId deploymentId;
    private final List<String> details;

    /**
     * 冲突时为已存在的执行
     */
    private final ExecutionId existingExecutionId;

    public RollbackRejectedException(RejectionReason reason, DeploymentId deploymentId, List<String> details) {
        this(reason, deploymentId, details, null);
    }

    public RollbackRejectedException(RejectionReason reason, DeploymentId deploymentId, List<String> details,
                                     ExecutionId existingExecutionId) {
        super(buildMessage(reason, deploymentId, details, existingExecutionId));
        this.reason = reason;
        this.deploymentId = deploymentId;
        this.details = details == null ? List.of() : List.copyOf(details);
        this.existingExecutionId = existingExecutionId;
    }

    public static RollbackRejectedException concurrent(DeploymentId deploymentId, ExecutionId existing) {
        return new RollbackRejectedException(RejectionReason.CONCURRENT_EXECUTION_EXISTS, deploymentId, List.of(), existing);
    }

    private static String buildMessage(RejectionReason reason, DeploymentId deploymentId, List<String> details,
                                       ExecutionId existing) {
        StringBuilder sb = new StringBuilder(reason.getDescription())
                .append(", deploymentId: ").append(deploymentId);
        if (existing != null) {
            sb.append(", existingExecutionId: ").append(existing);
        }
        if (details != null && !details.isEmpty()) {
            sb.append(", details: ").append(String.join("; ", details));
        }
        return sb.toString();
    }

    public FailureInfo toFailureInfo() {
        ErrorType type = reason == RejectionReason.CONCURRENT_EXECUTION_EXISTS
                ? ErrorType.BUSINESS_ERROR
                : ErrorType.VALIDATION_ERROR;
        return FailureInfo.of(reason.getCode(), type, getMessage(), "initiate_rollback");
    }

    public RejectionReason getReason() {
        return reason;
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public List<String> getDetails() {
        return details;
    }

    public ExecutionId getExistingExecutionId() {
        return existingExecutionId;
    }
}
