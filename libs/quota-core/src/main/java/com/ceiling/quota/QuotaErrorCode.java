package com.ceiling.quota;

/**
 * Distinguishable failure categories of the quota engine.
 * <p>
 * Callers branch on the code, never on the message. The message id is stable and doubles as the
 * problem type suffix in HTTP error responses.
 */
public enum QuotaErrorCode {

    /** Quota enforcement is switched off; every operation but registration fails with this. */
    FEATURE_DISABLED("quota.disabled"),

    /** Scope name is not one of global, org, user. */
    INVALID_SCOPE("quota.invalid-scope"),

    /** A tag key does not decompose into service, target and scope. */
    MALFORMED_TAG("quota.malformed-tag"),

    /** Update refers to a target no registered service contributed. */
    UNKNOWN_TARGET("quota.invalid-target"),

    /** Check refers to a service with no registered usage reporter. */
    UNKNOWN_TARGET_SERVICE("quota.invalid-target-service"),

    /** A service tried to register its usage reporter a second time. */
    REGISTRATION_CONFLICT("quota.target-service-conflict"),

    /** A reporter succeeded but omitted a tag that has a positive limit. */
    USAGE_UNAVAILABLE("quota.usage-unavailable");

    private final String messageId;

    QuotaErrorCode(String messageId) {
        this.messageId = messageId;
    }

    /** The stable, machine-readable identifier. */
    public String messageId() {
        return messageId;
    }
}
