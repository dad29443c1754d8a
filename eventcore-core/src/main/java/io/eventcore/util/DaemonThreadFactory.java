package io.eventcore.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates daemon threads named {@code <prefix>1}, {@code <prefix>2}, ...
 *
 * <p>Pools in this library never keep the JVM alive: the bus handler pool
 * ({@code eventcore-bus-}), async publish coordinators ({@code eventcore-publish-}) and
 * dispatcher workers ({@code eventcore-dispatcher-}). Anything a task lets escape is logged
 * at {@code SEVERE} against the thread's name.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + sequence.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(DaemonThreadFactory::logUncaught);
        return thread;
    }

    private static void logUncaught(Thread thread, Throwable error) {
        logger.log(Level.SEVERE, "Uncaught failure on thread " + thread.getName(), error);
    }
}
