package com.ceiling.quota;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Maps service identifiers to their usage reporters.
 * <p>
 * Registrations happen once per service, at startup; lookups happen on every quota check. Lookups
 * and snapshots take the read lock and never block each other. Registration takes the write lock.
 * Entries are never replaced or removed.
 */
public final class ReporterRegistry {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, UsageReporter> reporters = new LinkedHashMap<>();

    /**
     * Registers a service's reporter.
     *
     * @throws QuotaException with {@link QuotaErrorCode#REGISTRATION_CONFLICT} if the service is
     *                        already registered; the existing reporter stays in place
     */
    public void register(String service, UsageReporter reporter) {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be null or blank");
        }
        if (reporter == null) {
            throw new IllegalArgumentException("reporter must not be null");
        }
        lock.writeLock().lock();
        try {
            if (reporters.containsKey(service)) {
                throw new QuotaException(QuotaErrorCode.REGISTRATION_CONFLICT,
                        "target service: " + service + " already exists");
            }
            reporters.put(service, reporter);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<UsageReporter> lookup(String service) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(reporters.get(service));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String service) {
        return lookup(service).isPresent();
    }

    /**
     * Returns a copy of the current registrations in registration order. The copy is taken under
     * a brief read lock, so callers can fan out over it without holding any lock.
     */
    public Map<String, UsageReporter> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(reporters));
        } finally {
            lock.readLock().unlock();
        }
    }
}
