package com.ceiling.quota;

/**
 * Administrator request to override the limit of a target.
 * <p>
 * The override applies to the user when {@code userId} is set, otherwise to the organization when
 * {@code orgId} is set, otherwise globally.
 *
 * @param target the limited resource, as contributed by some service's default limits
 * @param limit  new limit (negative = unlimited, zero = blocked)
 * @param orgId  organization id, or 0
 * @param userId user id, or 0
 */
public record UpdateQuotaCommand(String target, long limit, long orgId, long userId) {

    public UpdateQuotaCommand {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target must not be null or blank");
        }
        if (orgId < 0 || userId < 0) {
            throw new IllegalArgumentException("orgId and userId must not be negative");
        }
    }

    /** The scope this override applies to. */
    public Scope scope() {
        if (userId != 0) {
            return Scope.USER;
        }
        if (orgId != 0) {
            return Scope.ORG;
        }
        return Scope.GLOBAL;
    }
}
