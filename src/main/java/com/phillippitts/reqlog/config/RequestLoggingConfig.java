package com.phillippitts.reqlog.config;

import com.phillippitts.reqlog.config.logging.RequestIdFilter;
import com.phillippitts.reqlog.config.properties.RequestLoggingProperties;
import com.phillippitts.reqlog.service.source.RequestLog;
import com.phillippitts.reqlog.service.source.RequestLogging;
import com.phillippitts.reqlog.service.traffic.TrafficLogFilter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Wires request-correlated logging into the servlet container.
 *
 * <p>Initializes the process-wide {@link RequestLog} from {@link RequestLoggingProperties}
 * during context startup, so the reporter is in place before the first request, and registers
 * the two filters in order:
 * <ol>
 *   <li>{@link RequestIdFilter} - assigns the correlation id</li>
 *   <li>{@link TrafficLogFilter} - logs start, completion and failure of each request
 *       (disable with {@code reqlog.traffic.enabled=false})</li>
 * </ol>
 */
@Configuration
public class RequestLoggingConfig {

    private static final Logger LOG = LogManager.getLogger(RequestLoggingConfig.class);

    private final RequestLoggingProperties properties;

    public RequestLoggingConfig(RequestLoggingProperties properties) {
        this.properties = properties;
    }

    /**
     * The global logging pipeline. Closing it on shutdown flushes pending writes.
     */
    @Bean(destroyMethod = "close")
    public RequestLogging requestLogging() {
        RequestLogging logging = RequestLog.initialize(properties.toSettings());
        if (logging.isInstalled()) {
            LOG.info("Request logging installed: level={}, overflow={}, queueCapacity={}",
                    logging.settings().level(),
                    logging.settings().overflow(),
                    logging.settings().queueCapacity());
        } else {
            LOG.info("Request logging disabled; Log4j2 appenders left as configured");
        }
        return logging;
    }

    @Bean
    public FilterRegistrationBean<RequestIdFilter> requestIdFilter() {
        FilterRegistrationBean<RequestIdFilter> registration = new FilterRegistrationBean<>(new RequestIdFilter());
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        registration.addUrlPatterns("/*");
        return registration;
    }

    @Bean
    @ConditionalOnProperty(prefix = "reqlog.traffic", name = "enabled", matchIfMissing = true)
    public FilterRegistrationBean<TrafficLogFilter> trafficLogFilter(RequestLogging requestLogging) {
        TrafficLogFilter filter = new TrafficLogFilter(
                requestLogging.source(TrafficLogFilter.SOURCE_NAME),
                requestLogging.settings().backtraces());
        FilterRegistrationBean<TrafficLogFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 1);
        registration.addUrlPatterns("/*");
        return registration;
    }
}
