package com.ceiling.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a correlation context is set, the MDC keys (correlationId, orgId, userId, requestId) are
 * populated so that every log statement on this thread includes them. When cleared, all MDC keys
 * are removed.
 * <p>
 * Thread pools do not inherit thread-locals. Work handed to an executor must capture the caller's
 * context with {@link #propagate(Supplier)} or run under {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Executes a {@link Runnable} with the given correlation context set, then restores
     * the previous context (or clears if there was none).
     *
     * @param context the correlation context for the duration of the runnable
     * @param runnable the work to execute
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        callWithContext(context, () -> {
            runnable.run();
            return null;
        });
    }

    /**
     * Value-returning variant of {@link #runWithContext(CorrelationContext, Runnable)}.
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> supplier) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return supplier.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Captures the calling thread's context and returns a supplier that re-establishes it on
     * whichever thread eventually runs it. Returns the supplier unchanged when no context is set.
     *
     * @param supplier the work to hand off
     * @return a supplier carrying the caller's correlation context
     */
    public static <T> Supplier<T> propagate(Supplier<T> supplier) {
        CorrelationContext captured = CONTEXT.get();
        if (captured == null) {
            return supplier;
        }
        return () -> callWithContext(captured, supplier);
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_ORG_ID, ctx.orgId());
        setMdc(CorrelationContext.MDC_USER_ID, ctx.userId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_ORG_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }
}
