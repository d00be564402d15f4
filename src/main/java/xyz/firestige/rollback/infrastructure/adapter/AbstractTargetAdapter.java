package xyz.firestige.rollback.infrastructure.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;

import java.util.List;

/**
 * 适配器抽象基类
 * <p>
 * 职责：
 * 1. 模板方法 execute：捕获 doExecute 抛出的异常并转换为 AdapterError
 * 2. 提供 options 校验的公共方法
 */
public abstract class AbstractTargetAdapter implements TargetAdapter {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Override
    public final StepResult execute(PlannedStep step, AdapterContext context) {
        String targetName = context.getTarget().name();
        try {
            StepResult result = doExecute(step, context);
            if (result.isFailure()) {
                log.warn("步骤失败: {}, target: {}, reason: {}, retryable: {}",
                        step.name(), targetName, result.error().reason(), result.error().retryable());
            } else {
                log.info("步骤完成: {}, target: {}, outcome: {}", step.name(), targetName, result.outcome());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepResult.failure(AdapterError.fatal(targetName, step.name() + " 被中断", ErrorType.SYSTEM_ERROR));
        } catch (Exception e) {
            AdapterError error = AdapterError.fromException(targetName, step.name(), e);
            log.warn("步骤异常: {}, target: {}, retryable: {}", step.name(), targetName, error.retryable(), e);
            return StepResult.failure(error);
        }
    }

    /**
     * 执行单个步骤；可以直接抛出外部调用的异常，由基类分类
     */
    protected abstract StepResult doExecute(PlannedStep step, AdapterContext context) throws Exception;

    protected static StepResult unknownAction(PlannedStep step, AdapterContext context) {
        return StepResult.failure(AdapterError.fatal(context.getTarget().name(),
                "未知的步骤动作: " + step.action(), ErrorType.SYSTEM_ERROR));
    }

    protected static void requireOption(RollbackTarget target, String key, List<String> errors) {
        if (!target.hasOption(key)) {
            errors.add("缺少必填参数 " + key);
        }
    }

    protected static void requirePositiveInt(RollbackTarget target, String key, List<String> errors) {
        if (!target.hasOption(key)) {
            return;
        }
        try {
            if (target.getInt(key, 1) < 1) {
                errors.add("参数 " + key + " 必须大于 0");
            }
        } catch (NumberFormatException e) {
            errors.add("参数 " + key + " 不是整数: " + target.getString(key));
        }
    }

    protected static void requireNonNegativeInt(RollbackTarget target, String key, List<String> errors) {
        if (!target.hasOption(key)) {
            return;
        }
        try {
            if (target.getInt(key, 0) < 0) {
                errors.add("参数 " + key + " 不能为负数");
            }
        } catch (NumberFormatException e) {
            errors.add("参数 " + key + " 不是整数: " + target.getString(key));
        }
    }
}
