package com.phillippitts.reqlog.service.correlation;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Mints correlation ids from an incrementing counter.
 *
 * <p>Ids are unique only among requests of one process run. Their last character is an
 * incrementing digit, which lets the console alternate colors between consecutive requests.
 */
public final class RequestIdGenerator {

    private final AtomicLong lastId = new AtomicLong();
    private final String prefix;

    public RequestIdGenerator() {
        this("");
    }

    public RequestIdGenerator(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public String next() {
        return prefix + lastId.incrementAndGet();
    }
}
