package com.ceiling.quota;

/**
 * Composite key of one limit or usage entry: the owning service, the limited target resource and
 * the scope.
 * <p>
 * The canonical text form is {@code service:target:scope}. Components are non-blank and never
 * contain the separator, so every tag decomposes in exactly one way. {@link #parse(String)} is the
 * only way to turn an opaque key back into a tag, and rejects anything that is not exactly three
 * well-formed parts.
 *
 * @param service the service that owns the target and reports its usage
 * @param target  the limited resource (e.g. "dashboards", "api_keys")
 * @param scope   the scope the limit applies to
 */
public record Tag(String service, String target, Scope scope) {

    static final char SEPARATOR = ':';

    public Tag {
        requireComponent("service", service);
        requireComponent("target", target);
        if (scope == null) {
            throw new QuotaException(QuotaErrorCode.MALFORMED_TAG, "tag scope must not be null");
        }
    }

    /**
     * Decomposes a canonical tag key.
     *
     * @throws QuotaException with {@link QuotaErrorCode#MALFORMED_TAG} if the key is not
     *                        {@code service:target:scope} with a recognized scope
     */
    public static Tag parse(String key) {
        if (key == null) {
            throw new QuotaException(QuotaErrorCode.MALFORMED_TAG, "tag must not be null");
        }
        String[] parts = key.split(String.valueOf(SEPARATOR), -1);
        if (parts.length != 3) {
            throw new QuotaException(QuotaErrorCode.MALFORMED_TAG, "malformed quota tag: " + key);
        }
        Scope scope;
        try {
            scope = Scope.fromValue(parts[2]);
        } catch (QuotaException e) {
            throw new QuotaException(QuotaErrorCode.MALFORMED_TAG,
                    "malformed quota tag: " + key + " (" + e.getMessage() + ")");
        }
        return new Tag(parts[0], parts[1], scope);
    }

    /** Returns the canonical {@code service:target:scope} key. */
    public String key() {
        return service + SEPARATOR + target + SEPARATOR + scope.value();
    }

    @Override
    public String toString() {
        return key();
    }

    private static void requireComponent(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new QuotaException(QuotaErrorCode.MALFORMED_TAG, "tag " + name + " must not be blank");
        }
        if (value.indexOf(SEPARATOR) >= 0) {
            throw new QuotaException(QuotaErrorCode.MALFORMED_TAG,
                    "tag " + name + " must not contain '" + SEPARATOR + "': " + value);
        }
    }
}
