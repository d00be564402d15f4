package xyz.firestige.rollback.infrastructure.adapter;

import xyz.firestige.rollback.domain.execution.RollbackStrategy;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.ServiceType;

import java.util.List;
import java.util.Set;

/**
 * 目标适配器：某类服务的回滚机制
 * <p>
 * 约定：
 * - plan / execute / verify 不抛出异常，失败通过 PlannedSteps / StepResult / HealthSignal 返回
 * - execute 只处理单个步骤，步骤间的顺序、重试、超时由驱动器负责
 * - 适配器不感知编排（不知道其他目标的存在）
 */
public interface TargetAdapter {

    ServiceType getServiceType();

    Set<RollbackStrategy> supportedStrategies();

    default boolean supports(RollbackStrategy strategy) {
        return supportedStrategies().contains(strategy);
    }

    /**
     * 校验 options（提交时调用）
     *
     * @return 错误列表，为空表示通过
     */
    List<String> validate(RollbackTarget target);

    PlannedSteps plan(RollbackTarget target);

    StepResult execute(PlannedStep step, AdapterContext context);

    HealthSignal verify(RollbackTarget target);
}
