package com.ceiling.quota;

/**
 * One row of a quota listing: the effective limit and current usage of a target in a scope.
 *
 * @param target  the limited resource
 * @param limit   effective limit (override if present, else default)
 * @param orgId   the listed organization, or 0
 * @param userId  the listed user, or 0
 * @param used    current usage (0 when the owning service reported none)
 * @param service the owning service
 * @param scope   the listed scope
 */
public record QuotaStatus(
        String target,
        long limit,
        long orgId,
        long userId,
        long used,
        String service,
        Scope scope
) {
}
