package com.ceiling.quota;

import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@link QuotaService} matching the enforcement toggle.
 */
public final class QuotaServices {

    private static final Logger log = LoggerFactory.getLogger(QuotaServices.class);

    private QuotaServices() {
        // utility class
    }

    /**
     * Returns an enforcing engine when {@code enabled}, otherwise the disabled stub. Callers use
     * the same contract either way.
     *
     * @param enabled  the quota enforcement toggle
     * @param store    override persistence (unused when disabled)
     * @param executor reporter fan-out executor (unused when disabled)
     */
    public static QuotaService create(boolean enabled, QuotaStore store, Executor executor) {
        if (!enabled) {
            log.info("Quota enforcement disabled");
            return new DisabledQuotaService();
        }
        return new DefaultQuotaService(store, executor);
    }
}
