package com.phillippitts.reqlog.config.properties;

import com.phillippitts.reqlog.service.format.ColorMode;
import com.phillippitts.reqlog.service.report.OverflowPolicy;
import com.phillippitts.reqlog.service.source.LogLevel;
import com.phillippitts.reqlog.service.source.LoggingSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for request-correlated logging.
 *
 * <p>Example application.properties:
 * <pre>
 * reqlog.level=DEBUG
 * reqlog.color=NEVER
 * reqlog.writer.queue-capacity=5000
 * reqlog.writer.overflow=DROP_OLDEST
 * </pre>
 *
 * <p>Note: Bean created via {@link com.phillippitts.reqlog.ReqLogApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "reqlog")
@Validated
public class RequestLoggingProperties {

    /** Install the reporter; when false, Log4j2 keeps its configured appenders. */
    private boolean enabled = true;

    @NotNull(message = "Log level must not be null")
    private LogLevel level = LogLevel.INFO;

    /** Log stack-trace lines when a request handler fails. */
    private boolean backtraces = true;

    @NotNull(message = "Color mode must not be null")
    private ColorMode color = ColorMode.AUTO;

    @Valid
    private Writer writer = new Writer();

    @Valid
    private Traffic traffic = new Traffic();

    public LoggingSettings toSettings() {
        return new LoggingSettings(enabled, level, backtraces, color,
                writer.getQueueCapacity(), writer.getOverflow(), writer.getThreadNamePrefix());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public LogLevel getLevel() {
        return level;
    }

    public void setLevel(LogLevel level) {
        this.level = level;
    }

    public boolean isBacktraces() {
        return backtraces;
    }

    public void setBacktraces(boolean backtraces) {
        this.backtraces = backtraces;
    }

    public ColorMode getColor() {
        return color;
    }

    public void setColor(ColorMode color) {
        this.color = color;
    }

    public Writer getWriter() {
        return writer;
    }

    public void setWriter(Writer writer) {
        this.writer = writer;
    }

    public Traffic getTraffic() {
        return traffic;
    }

    public void setTraffic(Traffic traffic) {
        this.traffic = traffic;
    }

    /**
     * Background writer configuration.
     */
    public static class Writer {
        @Positive(message = "Writer queue capacity must be positive")
        private int queueCapacity = LoggingSettings.DEFAULT_QUEUE_CAPACITY;

        @NotNull(message = "Overflow policy must not be null")
        private OverflowPolicy overflow = OverflowPolicy.DROP_NEWEST;

        private String threadNamePrefix = LoggingSettings.DEFAULT_THREAD_NAME_PREFIX;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public OverflowPolicy getOverflow() {
            return overflow;
        }

        public void setOverflow(OverflowPolicy overflow) {
            this.overflow = overflow;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Traffic filter configuration.
     */
    public static class Traffic {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
