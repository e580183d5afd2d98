package com.ceiling.quotaservice.api;

import com.ceiling.quota.QuotaStatus;

/**
 * One row of a quota listing as returned over HTTP.
 *
 * @param scope the scope's wire value ({@code global}, {@code org}, {@code user})
 */
public record QuotaStatusResponse(
        String target, long limit, long orgId, long userId, long used, String service, String scope) {

    public static QuotaStatusResponse from(QuotaStatus status) {
        return new QuotaStatusResponse(status.target(), status.limit(), status.orgId(), status.userId(),
                status.used(), status.service(), status.scope().value());
    }
}
