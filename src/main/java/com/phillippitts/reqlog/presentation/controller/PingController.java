package com.phillippitts.reqlog.presentation.controller;

import com.phillippitts.reqlog.service.correlation.CorrelationStore;
import com.phillippitts.reqlog.service.source.LogSource;
import com.phillippitts.reqlog.service.source.RequestLogging;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Lightweight endpoints that traverse the logging filters so the correlated console output
 * can be checked by eye or by tests.
 */
@RestController
class PingController {

    private final LogSource log;
    private final CorrelationStore correlationStore;

    PingController(RequestLogging requestLogging) {
        this.log = requestLogging.source("reqlog.ping");
        this.correlationStore = requestLogging.correlationStore();
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping(HttpServletRequest request) {
        log.info(request, "Ping received");
        String requestId = correlationStore.idOf(request).orElse("");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "requestId", requestId
        ));
    }

    @GetMapping("/ping/fail")
    ResponseEntity<Map<String, Object>> fail(HttpServletRequest request) {
        log.warning(request, "Failing on purpose");
        throw new IllegalStateException("Ping failure requested");
    }
}
