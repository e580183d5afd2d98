package com.ceiling.quota;

/**
 * What the quota engine needs to know about an inbound call, as extracted by the hosting service.
 *
 * @param orgId         organization the caller acts for (0 if none)
 * @param userId        the calling user (0 if none)
 * @param authenticated whether the caller is signed in
 */
public record RequestContext(long orgId, long userId, boolean authenticated) {

    public static RequestContext authenticated(long orgId, long userId) {
        return new RequestContext(orgId, userId, true);
    }

    public static RequestContext anonymous() {
        return new RequestContext(0, 0, false);
    }

    /**
     * Scope parameters for a quota check on behalf of this caller: org and user when signed in,
     * none otherwise.
     */
    public ScopeParameters scopeParameters() {
        return authenticated ? new ScopeParameters(orgId, userId) : ScopeParameters.none();
    }
}
