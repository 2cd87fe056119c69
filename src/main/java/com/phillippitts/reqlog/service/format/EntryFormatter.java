package com.phillippitts.reqlog.service.format;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.pattern.AnsiEscape;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Renders one log entry as a single console line.
 *
 * <p>Line shape, fields separated by one space:
 * <pre>
 * 18.10.26 15:42:32.529  reqlog.traffic  INFO REQ 7 GET /widgets 10.0.0.1 curl/8
 * &lt;timestamp&gt; &lt;source:15&gt; &lt;level:5&gt;&lt;request id or blank&gt; &lt;message&gt;
 * </pre>
 *
 * <p>Formatting has no side effects beyond appending to the supplied buffer. Color escapes are
 * emitted only when the formatter was built with color enabled.
 */
public final class EntryFormatter {

    /** Width of the right-aligned source column. */
    public static final int SOURCE_WIDTH = 15;

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("dd.MM.yy HH:mm:ss");
    private static final String BLANK_SOURCE = " ".repeat(SOURCE_WIDTH);
    private static final String RESET = sequence(AnsiEscape.NORMAL);

    private final ZoneId zone;
    private final boolean color;

    public EntryFormatter(ZoneId zone, boolean color) {
        this.zone = zone;
        this.color = color;
    }

    /**
     * Appends the rendered entry, including its trailing newline, to {@code out}.
     *
     * @param out       destination buffer
     * @param timestamp wall-clock time captured for this entry
     * @param source    log source name; the root logger name renders as a blank column
     * @param level     display style of the entry's level
     * @param requestId correlation id, null or empty when none was resolved
     * @param message   renders the caller's message into the buffer
     */
    public void format(StringBuilder out, Instant timestamp, String source, LevelStyle level,
                       String requestId, Consumer<StringBuilder> message) {
        styled(out, AnsiEscape.DIM, timestamp(timestamp));
        out.append(' ').append(sourceColumn(source)).append(' ');
        styled(out, level.color(), level.label());
        if (requestId != null && !requestId.isEmpty()) {
            styled(out, stripeOf(requestId), " REQ " + requestId);
        }
        out.append(' ');
        message.accept(out);
        out.append('\n');
    }

    /**
     * Formats {@code DD.MM.YY HH:MM:SS.mmm} in this formatter's zone.
     */
    public String timestamp(Instant instant) {
        String seconds = DATE_TIME.format(instant.atZone(zone));
        return seconds + '.' + String.format(Locale.ROOT, "%03d", millisField(instant.getNano()));
    }

    /**
     * Millisecond field for a sub-second fraction. Values that would round up to 1000 show as 999
     * so the seconds field never rolls over.
     */
    static int millisField(int nanos) {
        double fraction = nanos / 1_000_000.0;
        if (fraction > 999.0) {
            fraction = 999.0;
        }
        return (int) Math.round(fraction);
    }

    /**
     * Right-aligns the source name to {@link #SOURCE_WIDTH}. Longer names keep their trailing
     * characters, since the rightmost part of a dotted name is the most specific.
     */
    public static String sourceColumn(String source) {
        if (source == null || LogManager.ROOT_LOGGER_NAME.equals(source)) {
            return BLANK_SOURCE;
        }
        int length = source.length();
        if (length > SOURCE_WIDTH) {
            return source.substring(length - SOURCE_WIDTH);
        }
        return " ".repeat(SOURCE_WIDTH - length) + source;
    }

    /**
     * Picks the request id color from the parity of its last character. Generated ids end in an
     * incrementing digit, so consecutive requests alternate colors.
     */
    public static AnsiEscape stripeOf(String requestId) {
        char last = requestId.charAt(requestId.length() - 1);
        return (last & 1) == 0 ? AnsiEscape.CYAN : AnsiEscape.MAGENTA;
    }

    private void styled(StringBuilder out, AnsiEscape style, String text) {
        if (color) {
            out.append(sequence(style)).append(text).append(RESET);
        } else {
            out.append(text);
        }
    }

    static String sequence(AnsiEscape style) {
        return AnsiEscape.CSI.getCode() + style.getCode() + AnsiEscape.SUFFIX.getCode();
    }
}
