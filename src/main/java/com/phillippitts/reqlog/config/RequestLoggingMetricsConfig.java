package com.phillippitts.reqlog.config;

import com.phillippitts.reqlog.service.source.RequestLogging;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the log writer's counters via Micrometer.
 *
 * <ul>
 *   <li>reqlog.writes.pending - Writes scheduled but not yet completed</li>
 *   <li>reqlog.writes.written - Cumulative count of entries written to the stream</li>
 *   <li>reqlog.writes.failed - Cumulative count of writes the stream rejected</li>
 *   <li>reqlog.writes.dropped - Cumulative count of writes discarded on queue overflow</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/reqlog.writes.dropped}.
 */
@Configuration
public class RequestLoggingMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(RequestLoggingMetricsConfig.class);

    @Bean
    public MeterBinder requestLoggingMetrics(RequestLogging requestLogging) {
        return registry -> {
            Gauge.builder("reqlog.writes.pending", requestLogging, l -> l.writeStats().pending())
                    .description("Log writes scheduled but not yet completed")
                    .register(registry);

            Gauge.builder("reqlog.writes.written", requestLogging, l -> l.writeStats().written())
                    .description("Log entries written to the diagnostic stream")
                    .register(registry);

            Gauge.builder("reqlog.writes.failed", requestLogging, l -> l.writeStats().failed())
                    .description("Log writes rejected by the diagnostic stream")
                    .register(registry);

            Gauge.builder("reqlog.writes.dropped", requestLogging, l -> l.writeStats().dropped())
                    .description("Log writes discarded because the writer queue was full")
                    .register(registry);

            LOG.debug("Request logging metrics registered: reqlog.writes.*");
        };
    }
}
