package com.ceiling.quota.store;

import com.ceiling.quota.QuotaMap;
import com.ceiling.quota.QuotaOverride;
import com.ceiling.quota.QuotaStore;
import com.ceiling.quota.Scope;
import com.ceiling.quota.ScopeParameters;
import com.ceiling.quota.Tag;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link QuotaStore} that keeps overrides in memory for the lifetime of the process.
 * <p>
 * Suitable for single-instance deployments and tests. Overrides are lost on restart.
 */
public final class InMemoryQuotaStore implements QuotaStore {

    private record Key(Tag tag, long orgId, long userId) {
    }

    private final Map<Key, Long> overrides = new ConcurrentHashMap<>();

    @Override
    public QuotaMap getOverrides(ScopeParameters scopeParameters) {
        QuotaMap visible = new QuotaMap();
        overrides.forEach((key, limit) -> {
            if (isVisible(key, scopeParameters)) {
                visible.put(key.tag(), limit);
            }
        });
        return visible;
    }

    @Override
    public void updateOverride(QuotaOverride override) {
        overrides.put(new Key(override.tag(), override.orgId(), override.userId()), override.limit());
    }

    @Override
    public void deleteOverridesForUser(long userId) {
        overrides.keySet().removeIf(key -> key.tag().scope() == Scope.USER && key.userId() == userId);
    }

    /** Number of stored overrides. */
    public int size() {
        return overrides.size();
    }

    private static boolean isVisible(Key key, ScopeParameters params) {
        return switch (key.tag().scope()) {
            case GLOBAL -> true;
            case ORG -> params.orgId() != 0 && key.orgId() == params.orgId();
            case USER -> params.userId() != 0 && key.userId() == params.userId();
        };
    }
}
