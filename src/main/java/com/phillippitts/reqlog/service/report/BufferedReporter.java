package com.phillippitts.reqlog.service.report;

import com.phillippitts.reqlog.service.format.EntryFormatter;
import com.phillippitts.reqlog.service.format.LevelStyle;

import java.io.OutputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Formats log entries into one reusable buffer and hands each result off for asynchronous write.
 *
 * <p>Rendering into the buffer and taking the snapshot run under one lock, so concurrent callers
 * never see each other's partial text. The buffer is cleared before the lock is released, and
 * only the immutable snapshot is handed to the writer. The caller returns as soon as the write is
 * scheduled; it never waits for I/O.
 *
 * <p>Delivery is best effort: a failed write is neither retried nor reported to the caller.
 */
public final class BufferedReporter {

    private static final int INITIAL_CAPACITY = 512;
    private static final int MAX_RETAINED_CAPACITY = 64 * 1024;

    private final StringBuilder buffer = new StringBuilder(INITIAL_CAPACITY);
    private final ReentrantLock bufferLock = new ReentrantLock();
    private final Object idle = new Object();

    private final EntryFormatter formatter;
    private final Clock clock;
    private final OutputStream stream;
    private final Executor writer;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public BufferedReporter(EntryFormatter formatter, Clock clock, OutputStream stream, Executor writer) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stream = Objects.requireNonNull(stream, "stream");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * Renders one entry and schedules its write.
     *
     * @param source    log source name
     * @param level     display style of the level
     * @param requestId resolved correlation id, null or empty for none
     * @param message   renders the message body into the buffer
     * @return completes once the write has finished, failed or been dropped
     */
    public CompletableFuture<WriteOutcome> accept(String source, LevelStyle level, String requestId,
                                                  Consumer<StringBuilder> message) {
        String snapshot;
        bufferLock.lock();
        try {
            formatter.format(buffer, clock.instant(), source, level, requestId, message);
            snapshot = buffer.toString();
        } finally {
            buffer.setLength(0);
            if (buffer.capacity() > MAX_RETAINED_CAPACITY) {
                buffer.trimToSize();
            }
            bufferLock.unlock();
        }
        return schedule(snapshot);
    }

    private CompletableFuture<WriteOutcome> schedule(String snapshot) {
        PendingWrite write = new PendingWrite(snapshot, stream);
        pending.incrementAndGet();
        CompletableFuture<WriteOutcome> done = write.completion().thenApply(this::record);
        try {
            writer.execute(write);
        } catch (RejectedExecutionException e) {
            write.drop();
        }
        return done;
    }

    private WriteOutcome record(WriteOutcome outcome) {
        switch (outcome) {
            case WRITTEN -> written.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
            case DROPPED -> dropped.incrementAndGet();
        }
        if (pending.decrementAndGet() == 0) {
            synchronized (idle) {
                idle.notifyAll();
            }
        }
        return outcome;
    }

    /**
     * Blocks until every write scheduled so far has completed.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitPendingWrites(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idle) {
            while (pending.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idle, remaining);
            }
        }
        return true;
    }

    public WriteStats stats() {
        return new WriteStats(pending.get(), written.get(), failed.get(), dropped.get());
    }
}
