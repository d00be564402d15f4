package xyz.firestige.rollback.infrastructure.execution;

import java.time.Duration;

/**
 * 步骤重试策略：有界次数 + 指数退避
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts <= 0");
        if (initialBackoff == null || initialBackoff.isNegative()) throw new IllegalArgumentException("invalid initialBackoff");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier < 1.0");
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff == null ? Duration.ofSeconds(30) : maxBackoff;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * 第 attempt 次失败后的等待时间
     *
     * @return null 表示不再重试
     */
    public Duration nextDelay(int attempt) {
        if (attempt >= maxAttempts) return null;
        double factor = Math.pow(multiplier, attempt - 1);
        long delayMillis = Math.min((long) (initialBackoff.toMillis() * factor), maxBackoff.toMillis());
        return Duration.ofMillis(delayMillis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
