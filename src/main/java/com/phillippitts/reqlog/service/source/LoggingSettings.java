package com.phillippitts.reqlog.service.source;

import com.phillippitts.reqlog.exception.RequestLoggingException;
import com.phillippitts.reqlog.service.format.ColorMode;
import com.phillippitts.reqlog.service.report.OverflowPolicy;

/**
 * Setup of a {@link RequestLogging} instance, fixed at construction.
 *
 * @param enabled          install the reporter at all
 * @param level            threshold applied to the root logger and every configured logger
 * @param backtraces       log stack-trace lines when a request handler fails
 * @param color            console color policy
 * @param queueCapacity    maximum number of writes waiting for the writer thread
 * @param overflow         what to discard when the queue is full
 * @param threadNamePrefix name prefix of the writer thread
 */
public record LoggingSettings(
        boolean enabled,
        LogLevel level,
        boolean backtraces,
        ColorMode color,
        int queueCapacity,
        OverflowPolicy overflow,
        String threadNamePrefix
) {

    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    public static final String DEFAULT_THREAD_NAME_PREFIX = "reqlog-writer-";

    public LoggingSettings {
        if (level == null) {
            throw new RequestLoggingException("Log level must not be null");
        }
        if (color == null) {
            throw new RequestLoggingException("Color mode must not be null");
        }
        if (overflow == null) {
            throw new RequestLoggingException("Overflow policy must not be null");
        }
        if (queueCapacity <= 0) {
            throw new RequestLoggingException("Writer queue capacity must be positive: " + queueCapacity);
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
        }
    }

    public static LoggingSettings defaults() {
        return new LoggingSettings(true, LogLevel.INFO, true, ColorMode.AUTO,
                DEFAULT_QUEUE_CAPACITY, OverflowPolicy.DROP_NEWEST, DEFAULT_THREAD_NAME_PREFIX);
    }

    public LoggingSettings withEnabled(boolean enabled) {
        return new LoggingSettings(enabled, level, backtraces, color, queueCapacity, overflow, threadNamePrefix);
    }

    public LoggingSettings withLevel(LogLevel level) {
        return new LoggingSettings(enabled, level, backtraces, color, queueCapacity, overflow, threadNamePrefix);
    }

    public LoggingSettings withBacktraces(boolean backtraces) {
        return new LoggingSettings(enabled, level, backtraces, color, queueCapacity, overflow, threadNamePrefix);
    }

    public LoggingSettings withColor(ColorMode color) {
        return new LoggingSettings(enabled, level, backtraces, color, queueCapacity, overflow, threadNamePrefix);
    }

    public LoggingSettings withQueue(int queueCapacity, OverflowPolicy overflow) {
        return new LoggingSettings(enabled, level, backtraces, color, queueCapacity, overflow, threadNamePrefix);
    }
}
