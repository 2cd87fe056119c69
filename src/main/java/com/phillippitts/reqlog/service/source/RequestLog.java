package com.phillippitts.reqlog.service.source;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide entry point to request logging.
 *
 * <p>Usage:
 * <pre>{@code
 * // once, at startup (optional; otherwise defaults apply on first use)
 * RequestLog.initialize(LoggingSettings.defaults().withLevel(LogLevel.DEBUG));
 *
 * private static final LogSource LOG = RequestLog.source("app");
 * LOG.info(request, "Processed order {}", orderId);
 * }</pre>
 *
 * <p>The global {@link RequestLogging} is created once per lifetime. Settings passed to
 * {@link #initialize(LoggingSettings)} only take effect if nothing has logged through a source
 * before; later calls return the existing instance unchanged. Closing the global instance
 * releases it, so the next call creates a fresh one.
 */
public final class RequestLog {

    private static final AtomicReference<RequestLogging> GLOBAL = new AtomicReference<>();

    private RequestLog() {
    }

    /**
     * Creates the global pipeline with the given settings, if none exists yet, and initializes it.
     *
     * @return the global instance, which may predate this call
     */
    public static RequestLogging initialize(LoggingSettings settings) {
        RequestLogging logging = install(settings);
        logging.initialize();
        return logging;
    }

    /**
     * Returns the global pipeline, creating it with default settings on first use. Creation does
     * not initialize it; the first log call does.
     */
    public static RequestLogging current() {
        RequestLogging logging = GLOBAL.get();
        return logging != null ? logging : install(LoggingSettings.defaults());
    }

    /**
     * Creates a source bound to the global pipeline. Safe to call from static initializers: the
     * pipeline is looked up on every call, not at creation.
     */
    public static LogSource source(String name) {
        return new LogSource(name, RequestLog::current);
    }

    private static RequestLogging install(LoggingSettings settings) {
        RequestLogging existing = GLOBAL.get();
        if (existing != null) {
            return existing;
        }
        GLOBAL.compareAndSet(null, RequestLogging.builder().settings(settings).build());
        return GLOBAL.get();
    }

    /** Forgets {@code logging} if it is still the global pipeline. */
    static void release(RequestLogging logging) {
        GLOBAL.compareAndSet(logging, null);
    }

    /** Closes and forgets the global pipeline. */
    static void reset() {
        RequestLogging logging = GLOBAL.getAndSet(null);
        if (logging != null) {
            logging.close();
        }
    }
}
