package com.phillippitts.reqlog.service.correlation;

import jakarta.servlet.ServletRequest;

import java.util.Optional;

/**
 * Looks up the correlation id of the request a log call belongs to.
 *
 * <p>Two sources are consulted: an explicit request handle supplied by the call site, and the
 * ambient store bound to the current execution context. Absence is a normal outcome, for
 * instance during startup or in background tasks, and is never reported as an error.
 */
public interface CorrelationStore {

    /** MDC key under which the ambient correlation id is kept. */
    String CONTEXT_KEY = "requestId";

    /** Request attribute under which the explicit correlation id is kept. */
    String REQUEST_ATTRIBUTE = "reqlog.requestId";

    /**
     * Returns the correlation id attached to the given request handle.
     *
     * @param request request handle, may be null
     * @return the id, or empty if the handle is null or carries none
     */
    Optional<String> idOf(ServletRequest request);

    /**
     * Returns the correlation id of whatever request is logically current on this execution path.
     */
    Optional<String> currentId();

    /**
     * Resolves the id to display: the explicit id when present and non-empty, else the ambient one.
     *
     * @param explicitId id supplied by the call site, may be null or empty
     */
    default Optional<String> resolve(String explicitId) {
        if (explicitId != null && !explicitId.isEmpty()) {
            return Optional.of(explicitId);
        }
        return currentId();
    }
}
