package com.ceiling.quota;

import java.util.List;

/**
 * Quota decision engine.
 * <p>
 * Services register a usage reporter and their default limits at startup through
 * {@link #registerUsageSource(QuotaReporterRegistration)}. Afterwards callers ask whether a service's
 * limits are reached for a caller, list limits and usage for a scope, and manage overrides.
 * <p>
 * Implementations are thread-safe. All failures are runtime exceptions: {@link QuotaException} for
 * the engine's own categories, or the unchanged exception of a failing store or reporter. A failed
 * check means "unable to decide" and must not be treated as "not reached".
 */
public interface QuotaService {

    /**
     * Checks quota for an inbound request.
     * <p>
     * A {@code null} request context marks a background or system-internal caller: the answer is
     * always "not reached", deliberately failing open so internal jobs are never blocked by
     * enforcement. Signed-in callers are checked against global, org and user limits; anonymous
     * callers against global limits only.
     *
     * @param requestContext the caller, or null for background work
     * @param targetService  the service owning the resource about to be consumed
     */
    boolean checkQuotaReachedForRequest(RequestContext requestContext, String targetService);

    /**
     * Checks whether any applicable limit of {@code targetService} is reached for the caller.
     *
     * @param targetService   the service owning the resource about to be consumed
     * @param scopeParameters the caller; {@link ScopeParameters#none()} restricts to global limits
     * @return true if some limit is zero or has usage at or above it
     * @throws QuotaException {@link QuotaErrorCode#UNKNOWN_TARGET_SERVICE} when no reporter is
     *                        registered for the service, {@link QuotaErrorCode#USAGE_UNAVAILABLE}
     *                        when the reporter omitted a limited tag
     */
    default boolean checkQuotaReached(String targetService, ScopeParameters scopeParameters) {
        return checkQuotaReached(targetService, scopeParameters, null);
    }

    /**
     * Like {@link #checkQuotaReached(String, ScopeParameters)}, with the reporter's context following
     * the caller's {@code parent} context.
     *
     * @param parent caller context; cancelling it cancels the report, or null
     * @throws java.util.concurrent.CancellationException if {@code parent} was cancelled
     */
    boolean checkQuotaReached(String targetService, ScopeParameters scopeParameters, ReportContext parent);

    /**
     * Lists effective limit and current usage of every target with a default limit in the scope.
     *
     * @param scope canonical scope name ({@code global}, {@code org}, {@code user})
     * @param id    the organization or user id for org and user scopes; ignored for global
     * @throws QuotaException {@link QuotaErrorCode#INVALID_SCOPE} for an unknown scope name
     */
    default List<QuotaStatus> listQuotas(String scope, long id) {
        return listQuotas(scope, id, null);
    }

    /**
     * Like {@link #listQuotas(String, long)}, with the reporters' shared context following the
     * caller's {@code parent} context.
     *
     * @param parent caller context; cancelling it cancels the reporters, or null
     * @throws java.util.concurrent.CancellationException if {@code parent} was cancelled or the
     *                                                    calling thread was interrupted
     */
    List<QuotaStatus> listQuotas(String scope, long id, ReportContext parent);

    /**
     * Stores an override for every default-limit tag with the command's target at the command's
     * scope. A target name contributed by several services is overridden for each of them.
     *
     * @throws QuotaException {@link QuotaErrorCode#UNKNOWN_TARGET} when no registered service
     *                        contributed the target (the store is not called)
     */
    void updateQuota(UpdateQuotaCommand command);

    /**
     * Removes every user-scoped override of a user.
     */
    void deleteByUser(long userId);

    /**
     * Registers a service's usage reporter and default limits. Expected during startup only.
     *
     * @throws QuotaException {@link QuotaErrorCode#REGISTRATION_CONFLICT} if the service is
     *                        already registered
     */
    void registerUsageSource(QuotaReporterRegistration registration);

    /**
     * Whether enforcement is active.
     */
    boolean isEnabled();
}
