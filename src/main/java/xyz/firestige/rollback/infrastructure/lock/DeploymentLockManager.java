package xyz.firestige.rollback.infrastructure.lock;

import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.time.Duration;
import java.util.Optional;

/**
 * 部署回滚锁管理接口（技术无关）
 * <p>
 * 职责：
 * - 确保同一 deploymentId 任意时刻只有一个非终态的回滚执行
 * - initiate_rollback 时获取，执行进入终态时释放
 * - TTL 防止进程崩溃后锁泄漏
 * <p>
 * 实现：
 * - InMemory ConcurrentHashMap（单进程）
 * - Redis SET NX（多实例）
 */
public interface DeploymentLockManager {

    /**
     * 尝试获取部署锁（原子操作）
     *
     * @param deploymentId 部署 ID
     * @param executionId  执行 ID（标识锁持有者）
     * @param ttl          锁过期时间
     * @return true=成功获取，false=已被占用
     */
    boolean tryAcquire(DeploymentId deploymentId, ExecutionId executionId, Duration ttl);

    /**
     * 释放部署锁
     * <p>
     * 只有持有者可以释放，持有者不匹配时忽略
     */
    void release(DeploymentId deploymentId, ExecutionId executionId);

    /**
     * 当前持有锁的执行
     */
    Optional<ExecutionId> currentHolder(DeploymentId deploymentId);

    /**
     * 续租（长时间回滚场景）
     *
     * @return true=续租成功，false=锁已不存在或被他人持有
     */
    default boolean renew(DeploymentId deploymentId, ExecutionId executionId, Duration ttl) {
        return false;
    }

    default boolean isLocked(DeploymentId deploymentId) {
        return currentHolder(deploymentId).isPresent();
    }
}
