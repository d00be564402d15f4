package xyz.firestige.rollback.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 回滚持久化配置属性
 * <p>
 * 支持配置：
 * - 存储类型（redis/memory）
 * - Redis Key 前缀
 * - 执行历史 TTL 和条数上限
 * - 部署锁 TTL
 */
@ConfigurationProperties(prefix = "rollback.persistence")
@Validated
public class RollbackPersistenceProperties {

    /**
     * 存储类型
     */
    @NotNull
    private StoreType storeType = StoreType.memory;

    /**
     * Redis Key 命名空间前缀
     */
    @NotBlank
    private String namespace = "rollback";

    /**
     * 执行记录 TTL（默认 30 天）
     */
    private Duration historyTtl = Duration.ofDays(30);

    /**
     * 部署锁 TTL（默认 2 小时，执行进入终态时主动释放）
     */
    private Duration lockTtl = Duration.ofHours(2);

    /**
     * 每个部署保留的执行记录条数
     */
    @Min(1)
    private int historyLimit = 100;

    public enum StoreType {
        /**
         * Redis 存储（多实例部署）
         */
        redis,

        /**
         * 内存存储（测试环境，重启后丢失）
         */
        memory
    }

    // Getters and Setters

    public StoreType getStoreType() {
        return storeType;
    }

    public void setStoreType(StoreType storeType) {
        this.storeType = storeType;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public Duration getHistoryTtl() {
        return historyTtl;
    }

    public void setHistoryTtl(Duration historyTtl) {
        this.historyTtl = historyTtl;
    }

    public Duration getLockTtl() {
        return lockTtl;
    }

    public void setLockTtl(Duration lockTtl) {
        this.lockTtl = lockTtl;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }
}
