package com.phillippitts.reqlog.service.correlation;

import org.apache.logging.log4j.message.Message;
import org.apache.logging.log4j.util.StringBuilderFormattable;

import java.util.Objects;

/**
 * Log4j2 message that carries a correlation id next to the caller's message.
 *
 * <p>The id travels as metadata and is not part of the formatted text; the reporter reads it
 * back with {@link #requestIdOf(Message)}.
 */
public final class CorrelatedMessage implements Message, StringBuilderFormattable {

    private static final long serialVersionUID = 1L;

    private final String requestId;
    private final Message delegate;

    public CorrelatedMessage(String requestId, Message delegate) {
        this.requestId = requestId;
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * Returns the carried id, or null when the message is not correlated.
     */
    public static String requestIdOf(Message message) {
        return message instanceof CorrelatedMessage correlated ? correlated.requestId : null;
    }

    @Override
    public String getFormattedMessage() {
        return delegate.getFormattedMessage();
    }

    @Override
    public String getFormat() {
        return delegate.getFormat();
    }

    @Override
    public Object[] getParameters() {
        return delegate.getParameters();
    }

    @Override
    public Throwable getThrowable() {
        return delegate.getThrowable();
    }

    @Override
    public void formatTo(StringBuilder buffer) {
        if (delegate instanceof StringBuilderFormattable formattable) {
            formattable.formatTo(buffer);
        } else {
            buffer.append(delegate.getFormattedMessage());
        }
    }

    @Override
    public String toString() {
        return "CorrelatedMessage[requestId=" + requestId + ", message=" + delegate.getFormattedMessage() + "]";
    }
}
