package xyz.firestige.rollback.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.rollback.domain.shared.event.DomainEventPublisher;

/**
 * Spring 进程内事件总线实现
 * <p>
 * 监听器默认同步执行；监听器抛出的异常只记录日志，不影响回滚执行本身
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SpringDomainEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(Object event) {
        if (event == null) {
            return;
        }
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("领域事件监听器执行异常, event: {}, error: {}", event, e.getMessage(), e);
        }
    }
}
