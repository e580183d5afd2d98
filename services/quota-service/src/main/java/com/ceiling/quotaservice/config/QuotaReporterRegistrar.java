package com.ceiling.quotaservice.config;

import com.ceiling.observability.CorrelationContext;
import com.ceiling.observability.CorrelationContextHolder;
import com.ceiling.quota.QuotaReporterRegistration;
import com.ceiling.quota.QuotaService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Registers every {@link QuotaReporterRegistration} bean with the engine once all singletons exist.
 *
 * <p>WHY: Services contribute their usage reporter and default limits as plain beans. Registering
 * them here keeps that contribution declarative, and a duplicate service name surfaces as a
 * registration conflict that fails startup.
 */
@Component
public class QuotaReporterRegistrar implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(QuotaReporterRegistrar.class);

    private final QuotaService quotaService;
    private final ObjectProvider<QuotaReporterRegistration> registrations;

    public QuotaReporterRegistrar(QuotaService quotaService,
                                  ObjectProvider<QuotaReporterRegistration> registrations) {
        this.quotaService = quotaService;
        this.registrations = registrations;
    }

    @Override
    public void afterSingletonsInstantiated() {
        CorrelationContextHolder.runWithContext(CorrelationContext.generate(), () ->
                registrations.orderedStream().forEach(registration -> {
                    log.debug("Registering quota usage source {}", registration.service());
                    quotaService.registerUsageSource(registration);
                }));
    }
}
