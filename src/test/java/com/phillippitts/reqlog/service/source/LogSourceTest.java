package com.phillippitts.reqlog.service.source;

import com.phillippitts.reqlog.service.correlation.CorrelationStore;
import com.phillippitts.reqlog.service.format.ColorMode;
import com.phillippitts.reqlog.testutil.TestLoggerContexts;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.ThreadContext;
import org.apache.logging.log4j.core.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LogSourceTest {

    private static final String PREFIX = "18.10.26 09:05:07.042";

    private LoggerContext context;
    private ByteArrayOutputStream sink;
    private RequestLogging logging;
    private HttpServletRequest request;

    @BeforeEach
    void setUp() {
        ThreadContext.clearAll();
        context = TestLoggerContexts.isolated();
        sink = new ByteArrayOutputStream();
        request = mock(HttpServletRequest.class);
        when(request.getAttribute(CorrelationStore.REQUEST_ATTRIBUTE)).thenReturn("abc1");
        logging = build(LoggingSettings.defaults().withColor(ColorMode.NEVER));
    }

    @AfterEach
    void tearDown() {
        logging.close();
        context.stop();
        ThreadContext.clearAll();
    }

    private RequestLogging build(LoggingSettings settings) {
        return RequestLogging.builder()
                .settings(settings)
                .context(context)
                .stream(sink)
                .clock(Clock.fixed(Instant.parse("2026-10-18T09:05:07.042Z"), ZoneOffset.UTC))
                .writer(Runnable::run)
                .build();
    }

    private String output() {
        return sink.toString(StandardCharsets.UTF_8);
    }

    @Test
    void attachesIdFromRequestHandle() {
        logging.source("widgets").info(request, "Created widget {}", "w-9");

        assertThat(output()).isEqualTo(PREFIX + "         widgets  INFO REQ abc1 Created widget w-9\n");
    }

    @Test
    void omitsCorrelationColumnOutsideRequests() {
        logging.source("widgets").info("Cache warmed in {} ms", 12);

        assertThat(output()).isEqualTo(PREFIX + "         widgets  INFO Cache warmed in 12 ms\n");
    }

    @Test
    void fallsBackToAmbientIdWithoutHandle() {
        ThreadContext.put(CorrelationStore.CONTEXT_KEY, "amb5");

        logging.source("widgets").warning("Slow query");

        assertThat(output()).isEqualTo(PREFIX + "         widgets  WARN REQ amb5 Slow query\n");
    }

    @Test
    void requestHandleWinsOverAmbientId() {
        ThreadContext.put(CorrelationStore.CONTEXT_KEY, "amb5");

        logging.source("widgets").info(request, "Handled");

        assertThat(output()).contains(" REQ abc1 Handled").doesNotContain("amb5");
    }

    @Test
    void filtersCallsBelowThreshold() {
        logging.close();
        logging = build(LoggingSettings.defaults().withColor(ColorMode.NEVER).withLevel(LogLevel.WARNING));
        LogSource source = logging.source("widgets");

        source.debug(request, "hidden");
        source.info(request, "hidden");
        source.warning(request, "shown");
        source.error(request, "shown too");

        assertThat(output().lines()).hasSize(2);
        assertThat(source.isEnabled(Level.INFO)).isFalse();
        assertThat(source.isEnabled(Level.WARN)).isTrue();
    }

    @Test
    void debugIsShownAtDebugThreshold() {
        logging.close();
        logging = build(LoggingSettings.defaults().withColor(ColorMode.NEVER).withLevel(LogLevel.DEBUG));

        logging.source("widgets").debug(request, "Cache key {}", "k1");

        assertThat(output()).isEqualTo(PREFIX + "         widgets DEBUG REQ abc1 Cache key k1\n");
    }

    @Test
    void appTierPassesAnyThresholdWithBlankLabel() {
        logging.close();
        logging = build(LoggingSettings.defaults().withColor(ColorMode.NEVER).withLevel(LogLevel.ERROR));

        logging.source("widgets").app("Listening on {}", 8080);

        assertThat(output()).isEqualTo(PREFIX + "         widgets       Listening on 8080\n");
    }

    @Test
    void defaultSourceHasBlankNameColumn() {
        logging.source("").info("Started");

        assertThat(output()).isEqualTo(PREFIX + " " + " ".repeat(15) + "  INFO Started\n");
    }

    @Test
    void trailingThrowableIsRenderedWithEntry() {
        IllegalStateException failure = new IllegalStateException("boom");

        logging.source("jobs").error(request, "Job {} failed", "nightly", failure);

        String text = output();
        assertThat(text).startsWith(PREFIX + "            jobs ERROR REQ abc1 Job nightly failed\n"
                + "java.lang.IllegalStateException: boom\n");
        assertThat(text).contains("\tat ");
    }

    @Test
    void firstCallInitializesPipeline() {
        assertThat(logging.isInitialized()).isFalse();

        logging.source("widgets").info("hello");

        assertThat(logging.isInitialized()).isTrue();
        assertThat(logging.isInstalled()).isTrue();
    }
}
