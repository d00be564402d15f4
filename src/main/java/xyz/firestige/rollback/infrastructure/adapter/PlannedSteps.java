package xyz.firestige.rollback.infrastructure.adapter;

import java.util.List;

/**
 * 适配器为一个目标生成的步骤计划
 * <p>
 * 计划失败时（例如无法列出实例）steps 为空，error 给出原因
 */
public record PlannedSteps(List<PlannedStep> steps, AdapterError error) {

    public PlannedSteps {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static PlannedSteps of(List<PlannedStep> steps) {
        return new PlannedSteps(steps, null);
    }

    public static PlannedSteps failed(AdapterError error) {
        return new PlannedSteps(List.of(), error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
