package xyz.firestige.rollback.infrastructure.execution;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 带前缀命名的守护线程工厂
 */
public class NamedThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicLong idx = new AtomicLong();

    public NamedThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, prefix + "-" + idx.incrementAndGet());
        t.setDaemon(true);
        return t;
    }
}
