package com.phillippitts.reqlog.service.report;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Builds the background writer that drains pending writes to the diagnostic stream.
 *
 * <p>A single thread keeps writes in scheduling order. The queue is bounded; overflow is handled
 * by the configured {@link OverflowPolicy} instead of blocking the caller. The thread is a daemon
 * so an unflushed log line never keeps the process alive.
 */
public final class WriterPool {

    private static final int SHUTDOWN_AWAIT_SECONDS = 5;

    private WriterPool() {
    }

    public static ThreadPoolTaskExecutor create(int queueCapacity, OverflowPolicy overflow,
                                                String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setDaemon(true);
        executor.setRejectedExecutionHandler(overflow);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
        executor.initialize();
        return executor;
    }
}
