package com.phillippitts.reqlog.service.report;

import com.phillippitts.reqlog.service.format.EntryFormatter;
import com.phillippitts.reqlog.service.format.LevelStyle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class OverflowPolicyTest {

    private final GatedOutputStream sink = new GatedOutputStream();
    private ThreadPoolTaskExecutor pool;

    @AfterEach
    void tearDown() {
        sink.open();
        if (pool != null) {
            pool.shutdown();
        }
    }

    private BufferedReporter reporter(OverflowPolicy policy) {
        pool = WriterPool.create(1, policy, "reqlog-overflow-");
        return new BufferedReporter(new EntryFormatter(ZoneOffset.UTC, false),
                Clock.systemUTC(), sink, pool);
    }

    private static CompletableFuture<WriteOutcome> log(BufferedReporter reporter, String text) {
        return reporter.accept("orders", LevelStyle.INFO, null, sb -> sb.append(text));
    }

    @Test
    void dropNewestDiscardsIncomingWriteWhenQueueIsFull() throws InterruptedException {
        BufferedReporter reporter = reporter(OverflowPolicy.DROP_NEWEST);

        CompletableFuture<WriteOutcome> first = log(reporter, "first");
        sink.awaitBlocked();
        CompletableFuture<WriteOutcome> second = log(reporter, "second");
        CompletableFuture<WriteOutcome> third = log(reporter, "third");

        assertThat(third).isCompletedWithValue(WriteOutcome.DROPPED);
        assertThat(second).isNotDone();

        sink.open();

        assertThat(reporter.awaitPendingWrites(Duration.ofSeconds(5))).isTrue();
        assertThat(first).isCompletedWithValue(WriteOutcome.WRITTEN);
        assertThat(second).isCompletedWithValue(WriteOutcome.WRITTEN);
        assertThat(sink.text()).contains("first").contains("second").doesNotContain("third");
        assertThat(reporter.stats()).isEqualTo(new WriteStats(0, 2, 0, 1));
    }

    @Test
    void dropOldestDiscardsQueuedWriteWhenQueueIsFull() throws InterruptedException {
        BufferedReporter reporter = reporter(OverflowPolicy.DROP_OLDEST);

        CompletableFuture<WriteOutcome> first = log(reporter, "first");
        sink.awaitBlocked();
        CompletableFuture<WriteOutcome> second = log(reporter, "second");
        CompletableFuture<WriteOutcome> third = log(reporter, "third");

        assertThat(second).isCompletedWithValue(WriteOutcome.DROPPED);
        assertThat(third).isNotDone();

        sink.open();

        assertThat(reporter.awaitPendingWrites(Duration.ofSeconds(5))).isTrue();
        assertThat(first).isCompletedWithValue(WriteOutcome.WRITTEN);
        assertThat(third).isCompletedWithValue(WriteOutcome.WRITTEN);
        assertThat(sink.text()).contains("first").contains("third").doesNotContain("second");
    }

    @Test
    void writesScheduledAfterShutdownAreDropped() {
        BufferedReporter reporter = reporter(OverflowPolicy.DROP_OLDEST);
        sink.open();
        pool.shutdown();

        assertThat(log(reporter, "late")).isCompletedWithValue(WriteOutcome.DROPPED);
        await().atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> assertThat(reporter.stats().dropped()).isEqualTo(1));
    }

    /** Blocks every write until {@link #open()} is called. */
    private static final class GatedOutputStream extends OutputStream {

        private final ByteArrayOutputStream delegate = new ByteArrayOutputStream();
        private final CountDownLatch gate = new CountDownLatch(1);
        private final CountDownLatch blocked = new CountDownLatch(1);

        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            blocked.countDown();
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while gated");
            }
            delegate.write(b, off, len);
        }

        void open() {
            gate.countDown();
        }

        void awaitBlocked() throws InterruptedException {
            assertThat(blocked.await(5, TimeUnit.SECONDS)).isTrue();
        }

        String text() {
            return delegate.toString(StandardCharsets.UTF_8);
        }
    }
}
