package xyz.firestige.rollback.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 部署锁内存实现（单进程）
 * <p>
 * 过期的锁在下一次访问时被惰性清理
 */
public class InMemoryDeploymentLockManager implements DeploymentLockManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDeploymentLockManager.class);

    private final ConcurrentMap<DeploymentId, Holder> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDeploymentLockManager() {
        this(Clock.systemUTC());
    }

    public InMemoryDeploymentLockManager(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(DeploymentId deploymentId, ExecutionId executionId, Duration ttl) {
        if (deploymentId == null || executionId == null || ttl == null) {
            return false;
        }
        Instant now = clock.instant();
        Holder candidate = new Holder(executionId, now.plus(ttl));
        Holder winner = locks.compute(deploymentId, (id, existing) ->
                existing == null || existing.isExpired(now) ? candidate : existing);
        boolean acquired = winner == candidate;
        if (!acquired) {
            log.debug("部署锁已被占用, deploymentId: {}, holder: {}", deploymentId, winner.executionId);
        }
        return acquired;
    }

    @Override
    public void release(DeploymentId deploymentId, ExecutionId executionId) {
        if (deploymentId == null) {
            return;
        }
        locks.computeIfPresent(deploymentId, (id, existing) ->
                existing.executionId.equals(executionId) ? null : existing);
    }

    @Override
    public Optional<ExecutionId> currentHolder(DeploymentId deploymentId) {
        if (deploymentId == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Holder holder = locks.computeIfPresent(deploymentId, (id, existing) ->
                existing.isExpired(now) ? null : existing);
        return holder != null ? Optional.of(holder.executionId) : Optional.empty();
    }

    @Override
    public boolean renew(DeploymentId deploymentId, ExecutionId executionId, Duration ttl) {
        Instant now = clock.instant();
        Holder renewed = locks.computeIfPresent(deploymentId, (id, existing) ->
                existing.executionId.equals(executionId) && !existing.isExpired(now)
                        ? new Holder(executionId, now.plus(ttl)) : existing);
        return renewed != null && renewed.executionId.equals(executionId) && !renewed.isExpired(now);
    }

    private static final class Holder {
        private final ExecutionId executionId;
        private final Instant expiresAt;

        private Holder(ExecutionId executionId, Instant expiresAt) {
            this.executionId = executionId;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
