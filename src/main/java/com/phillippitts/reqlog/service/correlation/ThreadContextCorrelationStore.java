package com.phillippitts.reqlog.service.correlation;

import jakarta.servlet.ServletRequest;
import org.apache.logging.log4j.ThreadContext;

import java.util.Optional;

/**
 * {@link CorrelationStore} backed by the request attribute for explicit handles and by Log4j2's
 * {@link ThreadContext} for ambient lookup.
 */
public final class ThreadContextCorrelationStore implements CorrelationStore {

    @Override
    public Optional<String> idOf(ServletRequest request) {
        if (request == null) {
            return Optional.empty();
        }
        Object id = request.getAttribute(REQUEST_ATTRIBUTE);
        if (id instanceof String s && !s.isEmpty()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> currentId() {
        String id = ThreadContext.get(CONTEXT_KEY);
        return (id == null || id.isEmpty()) ? Optional.empty() : Optional.of(id);
    }

    /**
     * Binds the id to the request handle and to the current thread's context.
     *
     * @return the id previously held in the thread context, or null
     */
    public String bind(ServletRequest request, String id) {
        String previous = ThreadContext.get(CONTEXT_KEY);
        request.setAttribute(REQUEST_ATTRIBUTE, id);
        ThreadContext.put(CONTEXT_KEY, id);
        return previous;
    }

    /**
     * Removes the ambient id, restoring {@code previous} when one was saved by {@link #bind}.
     */
    public void unbind(String previous) {
        if (previous == null) {
            ThreadContext.remove(CONTEXT_KEY);
        } else {
            ThreadContext.put(CONTEXT_KEY, previous);
        }
    }
}
