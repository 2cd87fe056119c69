package com.phillippitts.reqlog.service.report;

import com.phillippitts.reqlog.service.correlation.CorrelatedMessage;
import com.phillippitts.reqlog.service.correlation.CorrelationStore;
import com.phillippitts.reqlog.service.format.LevelStyle;
import com.phillippitts.reqlog.util.StackTraces;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.message.Message;
import org.apache.logging.log4j.util.ReadOnlyStringMap;
import org.apache.logging.log4j.util.StringBuilderFormattable;

import java.util.Objects;

/**
 * Log4j2 appender that feeds every accepted event to a {@link BufferedReporter}.
 *
 * <p>Installed on the root logger, so it also receives events from code that never goes through
 * a {@code LogSource}. The correlation id is taken, in order, from a {@link CorrelatedMessage},
 * from the event's captured context data, and finally from the live ambient store.
 */
public final class RequestLogAppender extends AbstractAppender {

    private final BufferedReporter reporter;
    private final CorrelationStore correlationStore;

    public RequestLogAppender(String name, BufferedReporter reporter, CorrelationStore correlationStore) {
        super(name, null, null, true, Property.EMPTY_ARRAY);
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.correlationStore = Objects.requireNonNull(correlationStore, "correlationStore");
    }

    @Override
    public void append(LogEvent event) {
        String requestId = requestIdOf(event);
        try {
            reporter.accept(event.getLoggerName(), LevelStyle.of(event.getLevel()), requestId,
                    out -> render(event, out));
        } catch (RuntimeException e) {
            error("Unable to render log event from " + event.getLoggerName(), event, e);
        }
    }

    String requestIdOf(LogEvent event) {
        String explicit = CorrelatedMessage.requestIdOf(event.getMessage());
        if (explicit == null || explicit.isEmpty()) {
            ReadOnlyStringMap contextData = event.getContextData();
            explicit = contextData == null ? null : contextData.getValue(CorrelationStore.CONTEXT_KEY);
        }
        return correlationStore.resolve(explicit).orElse(null);
    }

    private static void render(LogEvent event, StringBuilder out) {
        Message message = event.getMessage();
        if (message instanceof StringBuilderFormattable formattable) {
            formattable.formatTo(out);
        } else if (message != null) {
            out.append(message.getFormattedMessage());
        }
        for (String line : StackTraces.lines(event.getThrown())) {
            out.append('\n').append(line);
        }
    }

    public BufferedReporter reporter() {
        return reporter;
    }
}
