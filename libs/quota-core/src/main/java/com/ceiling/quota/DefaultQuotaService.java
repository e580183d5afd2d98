package com.ceiling.quota;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The enforcing {@link QuotaService}.
 * <p>
 * Owns the reporter registry and the process-wide default limits for its lifetime; both are only
 * written by {@link #registerUsageSource(QuotaReporterRegistration)}. Overrides live in the
 * {@link QuotaStore} and are looked up on every call, never merged into the defaults.
 */
public final class DefaultQuotaService implements QuotaService {

    private static final Logger log = LoggerFactory.getLogger(DefaultQuotaService.class);

    private final QuotaStore store;
    private final ReporterRegistry registry = new ReporterRegistry();
    private final QuotaMap defaultLimits = new QuotaMap();
    private final ReentrantLock registrationLock = new ReentrantLock();
    private final LimitResolver limitResolver;
    private final UsageAggregator usageAggregator;

    /**
     * @param store    override persistence
     * @param executor runs usage reporters in parallel when listing quotas
     */
    public DefaultQuotaService(QuotaStore store, Executor executor) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
        this.limitResolver = new LimitResolver(defaultLimits, store);
        this.usageAggregator = new UsageAggregator(registry, executor);
    }

    @Override
    public boolean checkQuotaReachedForRequest(RequestContext requestContext, String targetService) {
        if (requestContext == null) {
            log.debug("No request context for {} quota check, treating as background caller", targetService);
            return false;
        }
        return checkQuotaReached(targetService, requestContext.scopeParameters());
    }

    /**
     * {@inheritDoc}
     * <p>
     * Only the target service's reporter is consulted. Every effective limit is evaluated in
     * default-limit order: a zero limit or usage at the limit answers "reached" at once. A limited
     * tag the reporter did not report fails the check, but only after the remaining tags had the
     * chance to answer "reached", so the outcome does not depend on tag order.
     */
    @Override
    public boolean checkQuotaReached(String targetService, ScopeParameters scopeParameters, ReportContext parent) {
        if (scopeParameters == null) {
            throw new IllegalArgumentException("scopeParameters must not be null");
        }
        Map<Tag, Long> limits = limitResolver.resolve(targetService, scopeParameters);

        UsageReporter reporter = registry.lookup(targetService)
                .orElseThrow(() -> new QuotaException(QuotaErrorCode.UNKNOWN_TARGET_SERVICE,
                        "unknown quota target service: " + targetService));
        ReportContext context = new ReportContext(scopeParameters, parent);
        if (context.isCancelled()) {
            throw new CancellationException("quota check for " + targetService + " cancelled by caller");
        }
        QuotaMap usage = reporter.report(context);
        if (context.isCancelled()) {
            throw new CancellationException("quota check for " + targetService + " cancelled by caller");
        }
        if (usage == null) {
            usage = new QuotaMap();
        }

        Tag missingUsage = null;
        for (Map.Entry<Tag, Long> entry : limits.entrySet()) {
            Tag tag = entry.getKey();
            long limit = entry.getValue();
            if (limit < 0) {
                continue;
            }
            if (limit == 0) {
                log.debug("Quota reached for {}: limit is 0", tag);
                return true;
            }
            OptionalLong used = usage.get(tag);
            if (used.isEmpty()) {
                if (missingUsage == null) {
                    missingUsage = tag;
                }
                continue;
            }
            if (used.getAsLong() >= limit) {
                log.debug("Quota reached for {}: used {} of {}", tag, used.getAsLong(), limit);
                return true;
            }
        }
        if (missingUsage != null) {
            throw new QuotaException(QuotaErrorCode.USAGE_UNAVAILABLE, "no usage for target: " + missingUsage);
        }
        return false;
    }

    @Override
    public List<QuotaStatus> listQuotas(String scope, long id, ReportContext parent) {
        Scope quotaScope = Scope.fromValue(scope);
        ScopeParameters scopeParameters = ScopeParameters.of(quotaScope, id);

        QuotaMap overrides = store.getOverrides(scopeParameters);
        QuotaMap usage = usageAggregator.aggregate(scopeParameters, parent);

        List<QuotaStatus> rows = new ArrayList<>();
        for (Map.Entry<Tag, Long> entry : defaultLimits.entries()) {
            Tag tag = entry.getKey();
            if (tag.scope() != quotaScope) {
                continue;
            }
            long limit = overrides.get(tag).orElse(entry.getValue());
            long used = usage.get(tag).orElse(0L);
            rows.add(new QuotaStatus(tag.target(), limit, scopeParameters.orgId(), scopeParameters.userId(),
                    used, tag.service(), quotaScope));
        }
        return Collections.unmodifiableList(rows);
    }

    @Override
    public void updateQuota(UpdateQuotaCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command must not be null");
        }
        if (!defaultLimits.targets().contains(command.target())) {
            throw new QuotaException(QuotaErrorCode.UNKNOWN_TARGET, "unknown quota target: " + command.target());
        }
        Scope scope = command.scope();
        // Several services may limit a target of the same name; the override applies to each.
        List<Tag> tags = defaultLimits.entries().stream()
                .map(Map.Entry::getKey)
                .filter(t -> t.target().equals(command.target()) && t.scope() == scope)
                .toList();
        if (tags.isEmpty()) {
            throw new QuotaException(QuotaErrorCode.UNKNOWN_TARGET,
                    "quota target " + command.target() + " has no " + scope.value() + " limit");
        }

        for (Tag tag : tags) {
            store.updateOverride(new QuotaOverride(tag, command.orgId(), command.userId(), command.limit()));
            log.info("Quota override for {} set to {} (org={}, user={})",
                    tag, command.limit(), command.orgId(), command.userId());
        }
    }

    @Override
    public void deleteByUser(long userId) {
        store.deleteOverridesForUser(userId);
        log.info("Removed quota overrides of user {}", userId);
    }

    @Override
    public void registerUsageSource(QuotaReporterRegistration registration) {
        if (registration == null) {
            throw new IllegalArgumentException("registration must not be null");
        }
        registrationLock.lock();
        try {
            if (registry.contains(registration.service())) {
                throw new QuotaException(QuotaErrorCode.REGISTRATION_CONFLICT,
                        "target service: " + registration.service() + " already exists");
            }
            defaultLimits.merge(registration.defaultLimits());
            registry.register(registration.service(), registration.reporter());
        } finally {
            registrationLock.unlock();
        }
        log.info("Registered quota usage source {} with {} default limits",
                registration.service(), registration.defaultLimits().size());
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    /**
     * Services registered so far, in registration order.
     */
    public List<String> registeredServices() {
        return List.copyOf(registry.snapshot().keySet());
    }

    /**
     * Snapshot of the merged default limits of all registered services.
     */
    public QuotaMap defaultLimits() {
        QuotaMap copy = new QuotaMap();
        copy.merge(defaultLimits);
        return copy;
    }
}
