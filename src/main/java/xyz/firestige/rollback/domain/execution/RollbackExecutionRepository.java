package xyz.firestige.rollback.domain.execution;

import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.util.List;
import java.util.Optional;

/**
 * 回滚执行记录仓储
 * <p>
 * 实现必须保留步骤的追加顺序；同一部署的历史按开始时间倒序返回。
 */
public interface RollbackExecutionRepository {

    void save(RollbackExecution execution);

    Optional<RollbackExecution> findById(ExecutionId executionId);

    /**
     * 查询部署的回滚历史（最近的在前）
     */
    List<RollbackExecution> findByDeployment(DeploymentId deploymentId);

    /**
     * 记录总数（跨部署）
     */
    long count();
}
