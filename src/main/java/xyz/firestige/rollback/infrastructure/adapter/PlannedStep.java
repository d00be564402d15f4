package xyz.firestige.rollback.infrastructure.adapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 计划中的单个回滚步骤
 *
 * @param name   步骤名称（在目标内唯一，写入步骤记录），例如 replace-batch-2
 * @param action 步骤动作，适配器据此分派，例如 replace-batch
 * @param params 动作参数（在计划阶段确定）
 */
public record PlannedStep(String name, String action, Map<String, Object> params) {

    public PlannedStep {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static PlannedStep of(String action) {
        return new PlannedStep(action, action, Map.of());
    }

    public static PlannedStep of(String name, String action, Map<String, Object> params) {
        return new PlannedStep(name, action, params);
    }

    @SuppressWarnings("unchecked")
    public <T> T param(String key) {
        return (T) params.get(key);
    }
}
