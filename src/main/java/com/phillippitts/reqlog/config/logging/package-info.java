/**
 * Servlet-side wiring of request correlation.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.reqlog.config.logging.RequestIdFilter} - Servlet filter that
 *       assigns a correlation id to every HTTP request and binds it to the request and to
 *       Log4j2's ThreadContext</li>
 * </ul>
 *
 * <p>Correlation keys:
 * <ul>
 *   <li>{@code requestId} - ThreadContext key read by the reporter as the ambient fallback</li>
 *   <li>{@code reqlog.requestId} - request attribute read when a call site passes the request</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 18.10.26 15:42:32.529  reqlog.traffic  INFO REQ 12 GET /ping 127.0.0.1 curl/8.4.0
 * </pre>
 *
 * @see com.phillippitts.reqlog.service.traffic.TrafficLogFilter
 * @see org.apache.logging.log4j.ThreadContext
 * @since 1.0
 */
package com.phillippitts.reqlog.config.logging;
