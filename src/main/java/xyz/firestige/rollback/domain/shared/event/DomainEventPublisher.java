package xyz.firestige.rollback.domain.shared.event;

import java.util.List;

/**
 * 领域事件发布器接口（技术无关）
 * <p>
 * 实现可以基于 Spring ApplicationEventPublisher，也可以是测试用的内存实现
 */
public interface DomainEventPublisher {

    /**
     * 发布单个领域事件
     */
    void publish(Object event);

    /**
     * 批量发布领域事件（按列表顺序）
     */
    default void publishAll(List<?> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        events.forEach(this::publish);
    }
}
