package xyz.firestige.rollback.infrastructure.persistence.execution;

import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackExecutionRepository;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 执行记录内存实现（重启后丢失，适用于测试和单机）
 * <p>
 * 保存的是快照，调用方后续对聚合的修改不会泄漏进仓储
 */
public class InMemoryRollbackExecutionRepository implements RollbackExecutionRepository {

    private final ConcurrentMap<ExecutionId, RollbackExecution> executions = new ConcurrentHashMap<>();
    private final ConcurrentMap<DeploymentId, Deque<ExecutionId>> history = new ConcurrentHashMap<>();
    private final int historyLimit;

    public InMemoryRollbackExecutionRepository() {
        this(100);
    }

    public InMemoryRollbackExecutionRepository(int historyLimit) {
        this.historyLimit = historyLimit > 0 ? historyLimit : 100;
    }

    @Override
    public void save(RollbackExecution execution) {
        RollbackExecution snapshot = execution.snapshot();
        RollbackExecution previous = executions.put(snapshot.getExecutionId(), snapshot);
        if (previous != null) {
            return;
        }
        Deque<ExecutionId> ids = history.computeIfAbsent(snapshot.getDeploymentId(), k -> new LinkedList<>());
        synchronized (ids) {
            ids.addFirst(snapshot.getExecutionId());
            while (ids.size() > historyLimit) {
                ExecutionId evicted = ids.removeLast();
                executions.remove(evicted);
            }
        }
    }

    @Override
    public Optional<RollbackExecution> findById(ExecutionId executionId) {
        RollbackExecution execution = executions.get(executionId);
        return execution != null ? Optional.of(execution.snapshot()) : Optional.empty();
    }

    @Override
    public List<RollbackExecution> findByDeployment(DeploymentId deploymentId) {
        Deque<ExecutionId> ids = history.get(deploymentId);
        if (ids == null) {
            return List.of();
        }
        List<ExecutionId> copy;
        synchronized (ids) {
            copy = new ArrayList<>(ids);
        }
        return copy.stream()
                .map(executions::get)
                .filter(e -> e != null)
                .map(RollbackExecution::snapshot)
                .toList();
    }

    @Override
    public long count() {
        return executions.size();
    }
}
