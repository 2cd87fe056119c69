package com.phillippitts.reqlog.config.logging;

import com.phillippitts.reqlog.service.correlation.RequestIdGenerator;
import com.phillippitts.reqlog.service.correlation.ThreadContextCorrelationStore;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.Objects;

/**
 * Assigns a correlation id to every HTTP request.
 *
 * <p>The id comes from the {@code X-Request-ID} header when present and non-blank, otherwise
 * from an incrementing counter. It is stored as a request attribute, for call sites that pass the
 * request explicitly, and in Log4j2's ThreadContext under {@code requestId}, for everything else
 * running on the request thread. The response echoes it back in {@code X-Request-ID}.
 *
 * <p>The ThreadContext entry is always removed after the request, restoring any outer value, to
 * avoid leakage across pooled threads.
 */
public class RequestIdFilter implements Filter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final ThreadContextCorrelationStore store;
    private final RequestIdGenerator generator;

    public RequestIdFilter() {
        this(new ThreadContextCorrelationStore(), new RequestIdGenerator());
    }

    public RequestIdFilter(ThreadContextCorrelationStore store, RequestIdGenerator generator) {
        this.store = Objects.requireNonNull(store, "store");
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        String requestId = headerOrGenerate(http);
        if (response instanceof HttpServletResponse httpResponse) {
            httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
        }
        String previous = store.bind(http, requestId);
        try {
            chain.doFilter(request, response);
        } finally {
            store.unbind(previous);
        }
    }

    private String headerOrGenerate(HttpServletRequest request) {
        String v = request.getHeader(REQUEST_ID_HEADER);
        return (v == null || v.isBlank()) ? generator.next() : v.trim();
    }
}
