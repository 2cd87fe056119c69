package com.phillippitts.reqlog.service.traffic;

import com.phillippitts.reqlog.service.source.LogSource;
import com.phillippitts.reqlog.util.StackTraces;
import com.phillippitts.reqlog.util.TimeUtils;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.Level;

import java.io.IOException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Logs every HTTP request passing through: one INFO line when it starts, and either one INFO
 * line with status and latency when it completes, or ERROR lines with the failure and its stack
 * trace when the handler throws.
 *
 * <pre>
 *  reqlog.traffic  INFO REQ 3 GET /widgets 10.0.0.1 curl/8
 *  reqlog.traffic  INFO REQ 3 201 in 1512 μs
 *  reqlog.traffic  INFO REQ 4 302 /login in 88 μs
 *  reqlog.traffic ERROR REQ 5 Aborted by java.lang.IllegalStateException: boom
 * </pre>
 *
 * <p>Failures are observed, never swallowed: the original exception is rethrown unchanged.
 * Must run after {@link com.phillippitts.reqlog.config.logging.RequestIdFilter} so the request
 * already carries its correlation id.
 */
public class TrafficLogFilter implements Filter {

    /** Name of the log source used for traffic lines. */
    public static final String SOURCE_NAME = "reqlog.traffic";

    private final LogSource log;
    private final boolean backtraces;
    private final LongSupplier nanoTime;

    public TrafficLogFilter(LogSource log, boolean backtraces) {
        this(log, backtraces, System::nanoTime);
    }

    TrafficLogFilter(LogSource log, boolean backtraces, LongSupplier nanoTime) {
        this.log = Objects.requireNonNull(log, "log");
        this.backtraces = backtraces;
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http) || !(response instanceof HttpServletResponse httpResponse)) {
            chain.doFilter(request, response);
            return;
        }

        log.info(http, "{} {} {} {}", http.getMethod(), target(http), http.getRemoteAddr(), userAgent(http));

        long startNanos = nanoTime.getAsLong();
        try {
            chain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException | Error e) {
            logFailure(http, e);
            throw e;
        }
        double micros = TimeUtils.nanosToMicros(nanoTime.getAsLong() - startNanos);
        String elapsed = String.format(Locale.ROOT, "%.0f", micros);
        log.info(http, "{}{} in {} μs", httpResponse.getStatus(), location(httpResponse), elapsed);
    }

    private void logFailure(HttpServletRequest request, Throwable failure) {
        log.error(request, "Aborted by {}", failure.toString());
        if (backtraces && log.isEnabled(Level.ERROR)) {
            for (String line : StackTraces.lines(failure)) {
                log.error(request, "{}", line);
            }
        }
    }

    static String target(HttpServletRequest request) {
        String query = request.getQueryString();
        return query == null ? request.getRequestURI() : request.getRequestURI() + '?' + query;
    }

    static String userAgent(HttpServletRequest request) {
        Enumeration<String> values = request.getHeaders("User-Agent");
        if (values == null) {
            return "";
        }
        return String.join(" ", Collections.list(values));
    }

    private static String location(HttpServletResponse response) {
        String location = response.getHeader("Location");
        return location == null ? "" : " " + location;
    }
}
