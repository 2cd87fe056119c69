package com.phillippitts.reqlog.service.report;

import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.status.StatusLogger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * One snapshot of rendered text waiting to be flushed to the diagnostic stream.
 *
 * <p>The payload is written with a single {@code write} call so it reaches the stream whole.
 * Completion is signalled exactly once, whatever the outcome.
 */
final class PendingWrite implements Runnable {

    private static final Logger STATUS = StatusLogger.getLogger();

    private final String payload;
    private final OutputStream stream;
    private final CompletableFuture<WriteOutcome> completion = new CompletableFuture<>();

    PendingWrite(String payload, OutputStream stream) {
        this.payload = payload;
        this.stream = stream;
    }

    @Override
    public void run() {
        try {
            stream.write(payload.getBytes(StandardCharsets.UTF_8));
            stream.flush();
            completion.complete(WriteOutcome.WRITTEN);
        } catch (IOException | RuntimeException e) {
            STATUS.error("Unable to write log entry to diagnostic stream", e);
            completion.complete(WriteOutcome.FAILED);
        }
    }

    void drop() {
        completion.complete(WriteOutcome.DROPPED);
    }

    /** Drops {@code task} if it is a pending write; other tasks are ignored. */
    static void dropIfPending(Runnable task) {
        if (task instanceof PendingWrite write) {
            write.drop();
        }
    }

    CompletableFuture<WriteOutcome> completion() {
        return completion;
    }
}
