package xyz.firestige.rollback.infrastructure.adapter;

import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单个目标在一次执行内的上下文
 * <p>
 * 同一目标的步骤按顺序执行，前序步骤的产出（例如快照句柄、解析出的版本）通过 attributes 传给后续步骤
 */
public class AdapterContext {

    private final ExecutionId executionId;
    private final RollbackTarget target;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public AdapterContext(ExecutionId executionId, RollbackTarget target) {
        this.executionId = executionId;
        this.target = target;
    }

    public ExecutionId getExecutionId() {
        return executionId;
    }

    public RollbackTarget getTarget() {
        return target;
    }

    public void put(String key, Object value) {
        attributes.put(key, value);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = attributes.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }
}
