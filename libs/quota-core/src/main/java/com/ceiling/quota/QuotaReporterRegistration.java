package com.ceiling.quota;

/**
 * What a service contributes to the quota engine when it starts.
 *
 * @param service       identifier of the registering service; every default limit tag must name it
 * @param reporter      the service's usage reporter
 * @param defaultLimits limits that apply when no override exists
 */
public record QuotaReporterRegistration(String service, UsageReporter reporter, QuotaMap defaultLimits) {

    public QuotaReporterRegistration {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be null or blank");
        }
        if (reporter == null) {
            throw new IllegalArgumentException("reporter must not be null");
        }
        // Own copy: the caller's map stays mutable, the checked one must not.
        QuotaMap copy = new QuotaMap();
        copy.merge(defaultLimits);
        defaultLimits = copy;
        for (var entry : defaultLimits.entries()) {
            if (!entry.getKey().service().equals(service)) {
                throw new IllegalArgumentException(
                        "default limit " + entry.getKey() + " is not owned by service " + service);
            }
        }
    }

    /** A copy of the default limits; the registration itself cannot be changed. */
    @Override
    public QuotaMap defaultLimits() {
        QuotaMap copy = new QuotaMap();
        copy.merge(defaultLimits);
        return copy;
    }
}
