/**
 * Exceptions raised by the request logging subsystem.
 *
 * <p>{@link com.phillippitts.reqlog.exception.RequestLoggingException} signals invalid settings
 * or a failed setup step. Failures on the log path itself (write errors, rendering errors) are
 * never thrown; they are counted and reported on Log4j's status logger.
 *
 * @since 1.0
 */
package com.phillippitts.reqlog.exception;
