package com.ceiling.quota;

/**
 * Identifies whose usage a quota decision is about.
 * <p>
 * A zero id means "not applicable". {@link #none()} (both zero) stands for a caller without
 * scope, such as an unauthenticated request, for which only global limits apply.
 *
 * @param orgId  organization id, or 0
 * @param userId user id, or 0
 */
public record ScopeParameters(long orgId, long userId) {

    private static final ScopeParameters NONE = new ScopeParameters(0, 0);

    public ScopeParameters {
        if (orgId < 0 || userId < 0) {
            throw new IllegalArgumentException("orgId and userId must not be negative");
        }
    }

    /** Parameters of a caller without organization or user. */
    public static ScopeParameters none() {
        return NONE;
    }

    public static ScopeParameters forOrg(long orgId) {
        return new ScopeParameters(orgId, 0);
    }

    public static ScopeParameters forUser(long userId) {
        return new ScopeParameters(0, userId);
    }

    /**
     * Builds the parameters that address a single scope: the org id for {@link Scope#ORG}, the user
     * id for {@link Scope#USER}, nothing for {@link Scope#GLOBAL}.
     */
    public static ScopeParameters of(Scope scope, long id) {
        return switch (scope) {
            case GLOBAL -> NONE;
            case ORG -> forOrg(id);
            case USER -> forUser(id);
        };
    }

    /**
     * Whether limits of the given scope apply to a caller with these parameters: global limits
     * always do, org limits need an org id, user limits need a user id.
     */
    public boolean covers(Scope scope) {
        return switch (scope) {
            case GLOBAL -> true;
            case ORG -> orgId != 0;
            case USER -> userId != 0;
        };
    }
}
