package com.ceiling.quotaservice.config;

import com.ceiling.observability.MetricFactory;
import com.ceiling.observability.SpanHelper;
import com.ceiling.quota.QuotaService;
import com.ceiling.quota.QuotaServices;
import com.ceiling.quota.QuotaStore;
import com.ceiling.quota.store.InMemoryQuotaStore;
import com.ceiling.quotaservice.infrastructure.metrics.InstrumentedQuotaService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the quota engine and its collaborators.
 *
 * <p>WHY: The engine lives in a framework-free library. Spring only decides which implementation
 * runs (enabled or disabled), which store backs overrides, and how it is instrumented. A deployment
 * with a persistent store declares its own {@link QuotaStore} bean and the in-memory one backs off.
 */
@Configuration
public class QuotaEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(QuotaEngineConfig.class);

    static final String INSTRUMENTATION_NAME = "com.ceiling.quota";

    /**
     * Pool for usage reporters. It grows with demand so every reporter of a fan-out starts at once,
     * which the aggregator needs to fail fast; {@code aggregator-threads} idle threads are kept.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService quotaReporterExecutor(QuotaProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "quota-reporter-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Starting quota reporter pool keeping {} idle threads", properties.aggregatorThreads());
        return new ThreadPoolExecutor(properties.aggregatorThreads(), Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(), threadFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaStore quotaStore() {
        log.info("No QuotaStore configured, keeping quota overrides in memory");
        return new InMemoryQuotaStore();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, QuotaServiceProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }

    @Bean
    public Tracer quotaTracer() {
        return GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME);
    }

    @Bean
    public SpanHelper spanHelper(Tracer tracer) {
        return new SpanHelper(tracer);
    }

    @Bean
    public QuotaService quotaService(QuotaProperties properties, QuotaStore store,
                                     ExecutorService quotaReporterExecutor,
                                     MetricFactory metricFactory, SpanHelper spanHelper) {
        QuotaService engine = QuotaServices.create(properties.enabled(), store, quotaReporterExecutor);
        return new InstrumentedQuotaService(engine, metricFactory, spanHelper);
    }
}
