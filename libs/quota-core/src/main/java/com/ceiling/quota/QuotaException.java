package com.ceiling.quota;

/**
 * Raised by the quota engine for its own failure categories.
 * <p>
 * Failures of collaborators (the override store, a usage reporter) are not wrapped in this type:
 * they reach the caller as the exception the collaborator threw.
 */
public class QuotaException extends RuntimeException {

    private final QuotaErrorCode code;

    public QuotaException(QuotaErrorCode code, String message) {
        super(message);
        if (code == null) {
            throw new IllegalArgumentException("code must not be null");
        }
        this.code = code;
    }

    public QuotaErrorCode code() {
        return code;
    }

    static QuotaException disabled() {
        return new QuotaException(QuotaErrorCode.FEATURE_DISABLED, "quota enforcement is disabled");
    }
}
