package com.phillippitts.reqlog.service.source;

import com.phillippitts.reqlog.service.correlation.CorrelatedMessage;
import com.phillippitts.reqlog.service.format.LevelStyle;
import jakarta.servlet.ServletRequest;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.message.Message;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.apache.logging.log4j.spi.ExtendedLogger;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Named logging handle whose calls may name the request they belong to.
 *
 * <p>Each leveled method comes in two forms: with a request handle, whose correlation id is
 * attached to the Log4j2 event as metadata, and without one, in which case the reporter falls
 * back to the ambient id of the current thread. Templates use Log4j2's {@code {}} placeholders;
 * a trailing {@link Throwable} argument is logged with its stack trace.
 *
 * <pre>{@code
 * private static final LogSource LOG = RequestLog.source("app.widgets");
 *
 * LOG.info(request, "Created widget {}", id);
 * LOG.warning("Cache miss for {}", key);
 * }</pre>
 *
 * <p>Calls are evaluated eagerly, but only after the level check passes. The first call
 * initializes the owning {@link RequestLogging} if nothing did so before.
 */
public final class LogSource {

    private static final String FQCN = LogSource.class.getName();

    private final String name;
    private final Supplier<RequestLogging> owner;

    LogSource(String name, Supplier<RequestLogging> owner) {
        this.name = Objects.requireNonNull(name, "name");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public String name() {
        return name;
    }

    public void error(String format, Object... args) {
        log(Level.ERROR, null, format, args);
    }

    public void error(ServletRequest request, String format, Object... args) {
        log(Level.ERROR, request, format, args);
    }

    public void warning(String format, Object... args) {
        log(Level.WARN, null, format, args);
    }

    public void warning(ServletRequest request, String format, Object... args) {
        log(Level.WARN, request, format, args);
    }

    public void info(String format, Object... args) {
        log(Level.INFO, null, format, args);
    }

    public void info(ServletRequest request, String format, Object... args) {
        log(Level.INFO, request, format, args);
    }

    public void debug(String format, Object... args) {
        log(Level.DEBUG, null, format, args);
    }

    public void debug(ServletRequest request, String format, Object... args) {
        log(Level.DEBUG, request, format, args);
    }

    /** Logs at the unleveled tier, shown with a blank level label. */
    public void app(String format, Object... args) {
        log(LevelStyle.APP_LEVEL, null, format, args);
    }

    public void app(ServletRequest request, String format, Object... args) {
        log(LevelStyle.APP_LEVEL, request, format, args);
    }

    public boolean isEnabled(Level level) {
        RequestLogging logging = owner.get();
        logging.ensureInitialized();
        return logging.logger(name).isEnabled(level);
    }

    private void log(Level level, ServletRequest request, String format, Object[] args) {
        RequestLogging logging = owner.get();
        logging.ensureInitialized();
        ExtendedLogger logger = logging.logger(name);
        if (!logger.isEnabled(level)) {
            return;
        }
        String requestId = logging.correlationStore().idOf(request).orElse(null);
        Message message = new CorrelatedMessage(requestId, new ParameterizedMessage(format, args));
        logger.logMessage(FQCN, level, null, message, message.getThrowable());
    }
}
