package com.ceiling.quotaservice.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Quota engine settings, bound from {@code ceiling.quota.*}.
 *
 * <pre>
 * ceiling:
 *   quota:
 *     enabled: true
 *     aggregator-threads: 4
 * </pre>
 *
 * @param enabled whether quotas are enforced; when false every decision fails as disabled
 * @param aggregatorThreads idle threads kept by the usage reporter pool; the pool grows past this
 *                          so every reporter of a fan-out runs in parallel
 */
@ConfigurationProperties(prefix = "ceiling.quota")
@Validated
public record QuotaProperties(boolean enabled, @Positive int aggregatorThreads) {

    public static final int DEFAULT_AGGREGATOR_THREADS = 4;

    public QuotaProperties {
        if (aggregatorThreads == 0) {
            aggregatorThreads = DEFAULT_AGGREGATOR_THREADS;
        }
    }
}
