package com.ceiling.quota;

/**
 * Breadth at which a limit applies.
 */
public enum Scope {

    GLOBAL("global"),
    ORG("org"),
    USER("user");

    private final String value;

    Scope(String value) {
        this.value = value;
    }

    /** The canonical string representation, as used inside tag keys. */
    public String value() {
        return value;
    }

    /**
     * Parses a canonical scope name.
     *
     * @throws QuotaException with {@link QuotaErrorCode#INVALID_SCOPE} for anything else
     */
    public static Scope fromValue(String value) {
        for (Scope scope : values()) {
            if (scope.value.equals(value)) {
                return scope;
            }
        }
        throw new QuotaException(QuotaErrorCode.INVALID_SCOPE, "invalid quota scope: " + value);
    }
}
