package com.phillippitts.reqlog.service.report;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * What the writer does when its queue of pending writes is full.
 *
 * <p>Either way the log call never blocks and the discarded write completes as
 * {@link WriteOutcome#DROPPED}.
 */
public enum OverflowPolicy implements RejectedExecutionHandler {

    /** Discard the write being scheduled. */
    DROP_NEWEST {
        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            PendingWrite.dropIfPending(task);
        }
    },

    /** Discard the oldest queued write to make room for the new one. */
    DROP_OLDEST {
        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                PendingWrite.dropIfPending(task);
                return;
            }
            PendingWrite.dropIfPending(executor.getQueue().poll());
            executor.execute(task);
        }
    }
}
