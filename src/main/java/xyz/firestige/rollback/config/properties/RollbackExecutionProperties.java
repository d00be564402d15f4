package xyz.firestige.rollback.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.firestige.rollback.domain.execution.ServiceType;
import xyz.firestige.rollback.infrastructure.execution.RetryPolicy;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * 回滚执行配置属性
 * prefix: rollback.execution
 */
@ConfigurationProperties(prefix = "rollback.execution")
@Validated
public class RollbackExecutionProperties {

    /** 执行驱动线程数（同时驱动的执行数上限） */
    @Min(1)
    private int workerThreads = 4;

    /** 同 tier 目标并发执行的线程数 */
    @Min(1)
    private int targetThreads = 8;

    /** 单个步骤的超时时间 */
    @NotNull
    private Duration stepTimeout = Duration.ofMinutes(10);

    /** 关闭时等待活跃执行结束的最长时间 */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(300);

    /** 覆盖默认的服务 tier（数值越小越先执行） */
    private Map<ServiceType, Integer> tierOverrides = new EnumMap<>(ServiceType.class);

    @Valid
    @NotNull
    private Retry retry = new Retry();

    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(2);
        @DecimalMin("1.0")
        private double multiplier = 2.0;
        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(30);

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff);
        }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

    public int getTargetThreads() { return targetThreads; }
    public void setTargetThreads(int targetThreads) { this.targetThreads = targetThreads; }

    public Duration getStepTimeout() { return stepTimeout; }
    public void setStepTimeout(Duration stepTimeout) { this.stepTimeout = stepTimeout; }

    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }

    public Map<ServiceType, Integer> getTierOverrides() { return tierOverrides; }
    public void setTierOverrides(Map<ServiceType, Integer> tierOverrides) { this.tierOverrides = tierOverrides; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
}
