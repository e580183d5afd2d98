package com.ceiling.quotaservice.api;

/** Outcome of a quota check for the calling principal. */
public record QuotaCheckResponse(String targetService, boolean reached) {
}
