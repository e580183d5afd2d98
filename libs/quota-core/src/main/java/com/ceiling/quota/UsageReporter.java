package com.ceiling.quota;

/**
 * Reports the current usage of the targets a service owns.
 * <p>
 * Each service registers one reporter with the quota engine at startup. The engine calls it once
 * per quota check for that service, and concurrently with every other reporter when listing
 * quotas. Implementations must therefore be thread-safe.
 * <p>
 * A reporter should return an entry for every tag it owns that is covered by the context's scope
 * parameters (see {@link ScopeParameters#covers(Scope)}). Any runtime exception it throws is
 * propagated unchanged to the caller of the engine.
 */
@FunctionalInterface
public interface UsageReporter {

    /**
     * Counts current usage.
     *
     * @param context scope parameters and cancellation flag for this report
     * @return usage per tag
     */
    QuotaMap report(ReportContext context);
}
