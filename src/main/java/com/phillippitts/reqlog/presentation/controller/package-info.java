/**
 * REST controllers.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.reqlog.presentation.controller.PingController}
 *       - {@code GET /ping} logs with the request handle and returns the correlation id;
 *       {@code GET /ping/fail} raises so the traffic filter's failure path can be observed</li>
 * </ul>
 *
 * <p>No exception handler advice is registered: handler failures propagate through
 * the servlet filters so the traffic filter can log them.
 *
 * @since 1.0
 */
package com.phillippitts.reqlog.presentation.controller;
