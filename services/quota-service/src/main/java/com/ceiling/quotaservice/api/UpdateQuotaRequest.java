package com.ceiling.quotaservice.api;

import com.ceiling.quota.UpdateQuotaCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Body of {@code PUT /api/v1/quotas}.
 *
 * @param target the limited resource to override
 * @param limit  new limit: negative for unlimited, zero to block
 * @param orgId  organization to override for, or 0
 * @param userId user to override for, or 0; takes precedence over {@code orgId}
 */
public record UpdateQuotaRequest(
        @NotBlank String target,
        @NotNull Long limit,
        @PositiveOrZero long orgId,
        @PositiveOrZero long userId) {

    public UpdateQuotaCommand toCommand() {
        return new UpdateQuotaCommand(target, limit, orgId, userId);
    }
}
