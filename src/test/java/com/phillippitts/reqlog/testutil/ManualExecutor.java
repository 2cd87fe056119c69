package com.phillippitts.reqlog.testutil;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

/**
 * Executor that only queues tasks until the test runs them.
 *
 * <p>Lets tests observe the state between "write scheduled" and "write performed".
 */
public class ManualExecutor implements Executor {

    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public synchronized void execute(Runnable command) {
        tasks.addLast(command);
    }

    public synchronized int pending() {
        return tasks.size();
    }

    /** Runs queued tasks in submission order until none remain. */
    public void runAll() {
        Runnable next;
        while ((next = poll()) != null) {
            next.run();
        }
    }

    private synchronized Runnable poll() {
        return tasks.pollFirst();
    }
}
