package com.ceiling.quota;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Computes the effective limits of one service for one caller: the default limit of every tag the
 * service owns, replaced by the caller's override where one exists.
 * <p>
 * Only tags whose scope is covered by the scope parameters are returned (see
 * {@link ScopeParameters#covers(Scope)}), so a caller without parameters is only ever held to
 * global limits. The result keeps the iteration order of the default limits.
 */
public final class LimitResolver {

    private final QuotaMap defaultLimits;
    private final QuotaStore store;

    public LimitResolver(QuotaMap defaultLimits, QuotaStore store) {
        if (defaultLimits == null) {
            throw new IllegalArgumentException("defaultLimits must not be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.defaultLimits = defaultLimits;
        this.store = store;
    }

    /**
     * Resolves effective limits.
     *
     * @param service         the service whose tags to resolve
     * @param scopeParameters the caller
     * @return effective limit per tag, in default-limit order
     * @throws RuntimeException whatever the store throws when fetching overrides
     */
    public Map<Tag, Long> resolve(String service, ScopeParameters scopeParameters) {
        QuotaMap overrides = store.getOverrides(scopeParameters);

        Map<Tag, Long> effective = new LinkedHashMap<>();
        for (Map.Entry<Tag, Long> entry : defaultLimits.entries()) {
            Tag tag = entry.getKey();
            if (!tag.service().equals(service) || !scopeParameters.covers(tag.scope())) {
                continue;
            }
            OptionalLong override = overrides.get(tag);
            effective.put(tag, override.isPresent() ? override.getAsLong() : entry.getValue());
        }
        return Collections.unmodifiableMap(effective);
    }
}
