package com.phillippitts.reqlog.exception;

/**
 * Base exception for request logging setup errors.
 *
 * <p>Raised only while building or configuring the logging pipeline. Once a log source is
 * usable, no exception from this subsystem reaches application code.
 */
public class RequestLoggingException extends RuntimeException {

    public RequestLoggingException(String message) {
        super(message);
    }
}
