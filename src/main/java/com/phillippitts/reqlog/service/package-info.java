/**
 * Request-correlated logging pipeline.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.correlation} - Resolves the correlation id of a log call, from an
 *       explicit request handle or from Log4j2's ThreadContext</li>
 *   <li>{@code service.format} - Renders one log entry as a fixed-column console line</li>
 *   <li>{@code service.report} - Buffers rendered entries and writes them off the caller's
 *       thread through a Log4j2 appender</li>
 *   <li>{@code service.source} - Named log sources and the lifecycle of the pipeline</li>
 *   <li>{@code service.traffic} - Servlet filter logging start, completion and failure of
 *       every request</li>
 * </ul>
 *
 * <p>Nothing here depends on Spring except the writer pool, which reuses Spring's
 * {@code ThreadPoolTaskExecutor}; the pipeline can be used outside an application context.
 *
 * @see com.phillippitts.reqlog.service.source.RequestLog
 * @since 1.0
 */
package com.phillippitts.reqlog.service;
