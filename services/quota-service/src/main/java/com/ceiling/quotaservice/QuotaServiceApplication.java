package com.ceiling.quotaservice;

import com.ceiling.quotaservice.config.QuotaProperties;
import com.ceiling.quotaservice.config.QuotaServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Ceiling quota service: hosts the quota decision engine behind a REST API.
 *
 * <p>WHY: The engine itself is a plain library ({@code ceiling-quota-core}). This application wires
 * it to Spring: the engine and its reporter executor become beans, every
 * {@link com.ceiling.quota.QuotaReporterRegistration} bean is registered at startup, and decisions,
 * listings and overrides are exposed under {@code /api/v1/quotas}.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID and caller propagation (HTTP filter)
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({QuotaServiceProperties.class, QuotaProperties.class})
public class QuotaServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(QuotaServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(QuotaServiceApplication.class, args);
        log.info("Ceiling quota service started successfully");
    }
}
