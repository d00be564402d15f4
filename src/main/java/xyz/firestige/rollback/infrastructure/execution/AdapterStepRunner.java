package xyz.firestige.rollback.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.rollback.domain.execution.RollbackExecution;
import xyz.firestige.rollback.domain.execution.RollbackStep;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.infrastructure.adapter.AdapterContext;
import xyz.firestige.rollback.infrastructure.adapter.AdapterError;
import xyz.firestige.rollback.infrastructure.adapter.PlannedStep;
import xyz.firestige.rollback.infrastructure.adapter.StepResult;
import xyz.firestige.rollback.infrastructure.adapter.TargetAdapter;
import xyz.firestige.rollback.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollback.infrastructure.metrics.NoopMetricsRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 单个步骤的执行器：超时 + 重试
 * <p>
 * 每次尝试都作为一条新的 RollbackStep 追加到执行记录，重试不会改写已有记录。
 * 超时的步骤视为可重试失败；适配器意外抛出的异常视为不可重试的系统错误。
 */
public class AdapterStepRunner {

    private static final Logger log = LoggerFactory.getLogger(AdapterStepRunner.class);

    private final RetryPolicy retryPolicy;
    private final Duration stepTimeout;
    private final ExecutorService stepExecutor;
    private final Clock clock;
    private final MetricsRegistry metrics;

    public AdapterStepRunner(RetryPolicy retryPolicy, Duration stepTimeout, ExecutorService stepExecutor,
                             Clock clock, MetricsRegistry metrics) {
        this.retryPolicy = retryPolicy;
        this.stepTimeout = stepTimeout;
        this.stepExecutor = stepExecutor;
        this.clock = clock;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
    }

    /**
     * 执行步骤直到成功、不可重试失败、重试耗尽或收到取消请求
     *
     * @return 最后一次尝试的结果
     */
    public StepResult run(TargetAdapter adapter, PlannedStep step, AdapterContext adapterContext,
                          RollbackExecution execution, RollbackExecutionContext context) {
        RollbackTarget target = adapterContext.getTarget();
        for (int attempt = 1; ; attempt++) {
            LocalDateTime startedAt = LocalDateTime.now(clock);
            StepResult result = invokeWithTimeout(adapter, step, adapterContext);
            LocalDateTime finishedAt = LocalDateTime.now(clock);
            metrics.recordDuration("rollback_step_duration", Duration.between(startedAt, finishedAt));

            execution.appendStep(new RollbackStep(0, target.name(), target.service(), step.name(), attempt,
                    result.outcome(), result.message(),
                    result.error() != null ? result.error().toFailureInfo(target.name() + "/" + step.name()) : null,
                    startedAt, finishedAt));

            if (!result.isFailure() || !result.isRetryable()) {
                return result;
            }
            Duration delay = retryPolicy.nextDelay(attempt);
            if (delay == null) {
                log.warn("步骤重试次数耗尽: {}, target: {}, attempts: {}", step.name(), target.name(), attempt);
                return result;
            }
            if (context.isCancelRequested()) {
                log.info("收到取消请求，不再重试步骤: {}, target: {}", step.name(), target.name());
                return result;
            }
            metrics.incrementCounter("rollback_step_retry");
            log.info("步骤将在 {}ms 后重试: {}, target: {}, attempt: {}", delay.toMillis(), step.name(), target.name(), attempt + 1);
            if (!sleep(delay)) {
                return result;
            }
        }
    }

    private StepResult invokeWithTimeout(TargetAdapter adapter, PlannedStep step, AdapterContext adapterContext) {
        String targetName = adapterContext.getTarget().name();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<StepResult> future = stepExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return adapter.execute(step, adapterContext);
            } finally {
                MDC.clear();
            }
        });
        try {
            StepResult result = future.get(stepTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return StepResult.failure(AdapterError.fatal(targetName, step.name() + " 没有返回结果", ErrorType.SYSTEM_ERROR));
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("步骤超时: {}, target: {}, timeout: {}", step.name(), targetName, stepTimeout);
            return StepResult.failure(AdapterError.retryable(targetName,
                    step.name() + " 执行超时（" + stepTimeout.toSeconds() + "s）", ErrorType.TIMEOUT_ERROR));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("适配器抛出未处理异常: {}, target: {}", step.name(), targetName, cause);
            return StepResult.failure(AdapterError.fatal(targetName,
                    step.name() + " 异常: " + cause.getMessage(), ErrorType.SYSTEM_ERROR));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return StepResult.failure(AdapterError.fatal(targetName, step.name() + " 被中断", ErrorType.SYSTEM_ERROR));
        }
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
