package org.neuralchilli.orchestra.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Names threads {@code <prefix>-thread-N} and logs anything that escapes a task body.
 */
public class WorkerThreadFactory implements ThreadFactory {

    private static final Logger log = LoggerFactory.getLogger(WorkerThreadFactory.class);

    private final AtomicInteger counter = new AtomicInteger(0);
    private final String prefix;
    private final boolean daemon;

    public WorkerThreadFactory(String prefix, boolean daemon) {
        this.prefix = prefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + "-thread-" + counter.incrementAndGet());
        thread.setDaemon(daemon);
        thread.setUncaughtExceptionHandler((failed, error) ->
                log.error("Uncaught exception on {}", failed.getName(), error));
        return thread;
    }
}
