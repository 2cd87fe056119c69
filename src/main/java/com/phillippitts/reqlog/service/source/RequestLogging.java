package com.phillippitts.reqlog.service.source;

import com.phillippitts.reqlog.service.correlation.CorrelationStore;
import com.phillippitts.reqlog.service.correlation.ThreadContextCorrelationStore;
import com.phillippitts.reqlog.service.format.EntryFormatter;
import com.phillippitts.reqlog.service.format.TerminalDetector;
import com.phillippitts.reqlog.service.report.BufferedReporter;
import com.phillippitts.reqlog.service.report.RequestLogAppender;
import com.phillippitts.reqlog.service.report.WriteStats;
import com.phillippitts.reqlog.service.report.WriterPool;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.AbstractConfiguration;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.spi.ExtendedLogger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.OutputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Owns one request logging pipeline: its settings, correlation store, reporter and the Log4j2
 * appender that feeds it.
 *
 * <p>{@link #initialize()} runs once. It is triggered explicitly at startup or lazily by the first
 * {@link LogSource} call, and only then checks the terminal and builds the reporter, so color
 * detection sees the real runtime environment. Repeated calls leave the single installed
 * appender in place. {@link #close()} puts the context back the way it was found and allows a
 * later initialization.
 *
 * <p>Most applications use the process-wide instance behind {@link RequestLog}; separate
 * instances bound to their own {@link LoggerContext} are useful in tests.
 */
public final class RequestLogging implements AutoCloseable {

    /** Name of the appender installed on the root logger. */
    public static final String APPENDER_NAME = "RequestLog";

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final LoggingSettings settings;
    private final LoggerContext context;
    private final CorrelationStore correlationStore;
    private final TerminalDetector terminal;
    private final OutputStream stream;
    private final Clock clock;
    private final Executor writer;

    private volatile boolean initialized;
    private volatile RequestLogAppender appender;
    private ThreadPoolTaskExecutor ownedWriter;
    private Map<String, Appender> displacedAppenders = Map.of();
    private Map<LoggerConfig, Level> displacedLevels = Map.of();

    private RequestLogging(Builder builder) {
        this.settings = builder.settings;
        this.context = builder.context;
        this.correlationStore = builder.correlationStore;
        this.terminal = builder.terminal;
        this.stream = builder.stream;
        this.clock = builder.clock;
        this.writer = builder.writer;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a log source bound to this pipeline.
     *
     * @param name source name; the empty string denotes the default (root) source
     */
    public LogSource source(String name) {
        return new LogSource(name, () -> this);
    }

    /**
     * Installs the reporter on the root logger, replacing any appenders configured there, and
     * applies the configured level to every logger. Does nothing when disabled or already done.
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (settings.enabled()) {
            install();
        }
        initialized = true;
    }

    void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private void install() {
        boolean color = settings.color().resolve(terminal);
        Executor target = writer;
        if (target == null) {
            ownedWriter = WriterPool.create(settings.queueCapacity(), settings.overflow(),
                    settings.threadNamePrefix());
            target = ownedWriter;
        }
        OutputStream out = stream != null ? stream : System.err;
        BufferedReporter reporter = new BufferedReporter(
                new EntryFormatter(clock.getZone(), color), clock, out, target);

        RequestLogAppender installed = new RequestLogAppender(APPENDER_NAME, reporter, correlationStore);
        installed.start();

        Configuration configuration = context.getConfiguration();
        LoggerConfig root = configuration.getRootLogger();
        displacedAppenders = new LinkedHashMap<>(root.getAppenders());
        displacedAppenders.keySet().forEach(root::removeAppender);
        configuration.addAppender(installed);
        root.addAppender(installed, null, null);

        Level level = settings.level().toLog4j();
        displacedLevels = new LinkedHashMap<>();
        displacedLevels.put(root, root.getLevel());
        configuration.getLoggers().values().forEach(config -> displacedLevels.put(config, config.getLevel()));
        displacedLevels.keySet().forEach(config -> config.setLevel(level));
        context.updateLoggers();
        appender = installed;
    }

    ExtendedLogger logger(String name) {
        return context.getLogger(name);
    }

    /**
     * Waits for scheduled writes, detaches the appender, restores the root appenders and levels it
     * replaced and stops the writer it created. A closed instance that was the global pipeline is
     * no longer returned by {@link RequestLog}.
     */
    @Override
    public synchronized void close() {
        RequestLogAppender installed = appender;
        if (installed != null) {
            uninstall(installed);
        }
        initialized = false;
        RequestLog.release(this);
    }

    private void uninstall(RequestLogAppender installed) {
        try {
            installed.reporter().awaitPendingWrites(CLOSE_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Configuration configuration = context.getConfiguration();
        LoggerConfig root = configuration.getRootLogger();
        root.removeAppender(installed.getName());
        if (configuration instanceof AbstractConfiguration abstractConfiguration) {
            abstractConfiguration.removeAppender(installed.getName());
        }
        displacedAppenders.values().forEach(previous -> root.addAppender(previous, null, null));
        displacedLevels.forEach(LoggerConfig::setLevel);
        displacedAppenders = Map.of();
        displacedLevels = Map.of();
        context.updateLoggers();
        if (!installed.isStopped()) {
            installed.stop();
        }
        if (ownedWriter != null) {
            ownedWriter.shutdown();
            ownedWriter = null;
        }
        appender = null;
    }

    /**
     * Blocks until every write scheduled so far has completed.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitPendingWrites(Duration timeout) throws InterruptedException {
        RequestLogAppender installed = appender;
        return installed == null || installed.reporter().awaitPendingWrites(timeout);
    }

    public WriteStats writeStats() {
        RequestLogAppender installed = appender;
        return installed == null ? WriteStats.EMPTY : installed.reporter().stats();
    }

    public boolean isInitialized() {
        return initialized;
    }

    /** True while a reporter is attached to the root logger. */
    public boolean isInstalled() {
        return appender != null;
    }

    public LoggingSettings settings() {
        return settings;
    }

    public CorrelationStore correlationStore() {
        return correlationStore;
    }

    /**
     * Builder for {@link RequestLogging}. Every dependency has a production default.
     */
    public static final class Builder {

        private LoggingSettings settings = LoggingSettings.defaults();
        private LoggerContext context;
        private CorrelationStore correlationStore = new ThreadContextCorrelationStore();
        private TerminalDetector terminal = TerminalDetector.system();
        private OutputStream stream;
        private Clock clock = Clock.systemDefaultZone();
        private Executor writer;

        private Builder() {
            // use RequestLogging.builder()
        }

        public Builder settings(LoggingSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        /** Log4j2 context to install into; defaults to the caller's context. */
        public Builder context(LoggerContext context) {
            this.context = context;
            return this;
        }

        public Builder correlationStore(CorrelationStore correlationStore) {
            this.correlationStore = Objects.requireNonNull(correlationStore, "correlationStore");
            return this;
        }

        public Builder terminal(TerminalDetector terminal) {
            this.terminal = Objects.requireNonNull(terminal, "terminal");
            return this;
        }

        /** Diagnostic stream; defaults to {@code System.err} as seen at initialization time. */
        public Builder stream(OutputStream stream) {
            this.stream = stream;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Executor that runs writes; defaults to a bounded single-thread {@link WriterPool}. */
        public Builder writer(Executor writer) {
            this.writer = writer;
            return this;
        }

        public RequestLogging build() {
            if (context == null) {
                context = LoggerContext.getContext(false);
            }
            return new RequestLogging(this);
        }
    }
}
