package com.ceiling.quotaservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of this service instance.
 *
 * <p>WHY: Spring Boot binds YAML/env properties to this record at startup and validates them via
 * Bean Validation. A missing name fails startup instead of producing unlabelled metrics.
 *
 * <pre>
 * ceiling:
 *   service:
 *     name: quota-service
 *     environment: production
 *     description: Quota decision engine
 * </pre>
 *
 * @param name Service name used for logging, metrics, and tracing. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description.
 */
@ConfigurationProperties(prefix = "ceiling.service")
@Validated
public record QuotaServiceProperties(@NotBlank String name, String environment, String description) {

    /** Applies defaults for optional fields. Runs before Bean Validation. */
    public QuotaServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
