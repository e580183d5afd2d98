package com.ceiling.observability;

import java.util.UUID;

/**
 * Immutable correlation context that flows with a request through the quota service.
 * <p>
 * Every incoming request establishes a {@code CorrelationContext}. Its values are injected into
 * SLF4J MDC so every log line written while deciding a quota carries the caller's organization and
 * user, including lines written by usage reporters on the aggregator's worker threads.
 *
 * @param correlationId unique ID for the business flow
 * @param orgId         organization the caller acts for (nullable for system callers)
 * @param userId        authenticated user performing the action (nullable for anonymous or system callers)
 * @param requestId     unique ID for this specific request (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String orgId,
        String userId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for organization ID. */
    public static final String MDC_ORG_ID = "orgId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Ensures correlationId is never null or blank.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context carrying only a correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /**
     * Creates a context with a freshly generated correlation ID, for work that starts inside the
     * service (startup registration, scheduled jobs).
     */
    public static CorrelationContext generate() {
        return of(UUID.randomUUID().toString());
    }
}
