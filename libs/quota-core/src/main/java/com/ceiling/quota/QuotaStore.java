package com.ceiling.quota;

/**
 * Persistence port for administrator overrides.
 * <p>
 * The engine never caches what the store returns and never retries a failed call: any runtime
 * exception thrown here reaches the engine's caller unchanged.
 */
public interface QuotaStore {

    /**
     * Returns the overrides visible to a caller with the given parameters: global overrides, plus
     * the organization's when {@code orgId} is set, plus the user's when {@code userId} is set.
     */
    QuotaMap getOverrides(ScopeParameters scopeParameters);

    /**
     * Creates or replaces an override. Repeating the same write has no further effect.
     */
    void updateOverride(QuotaOverride override);

    /**
     * Removes every user-scoped override of the given user.
     */
    void deleteOverridesForUser(long userId);
}
