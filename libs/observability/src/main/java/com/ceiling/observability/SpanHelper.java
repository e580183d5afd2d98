package com.ceiling.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that attaches the current
 * {@link CorrelationContext} to every span it starts.
 * <p>
 * Does not configure the SDK. The hosting service supplies the tracer (a no-op tracer when no SDK
 * is installed).
 */
public final class SpanHelper {

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new internal span. A runtime exception marks the span as failed,
     * is recorded on it, and is rethrown unchanged.
     *
     * @param spanName   name for the span
     * @param attributes span attributes
     * @param work       the work to execute within the span
     * @param <T>        return type
     * @return the result of the work
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.orgId() != null) {
                span.setAttribute("org.id", ctx.orgId());
            }
            if (ctx.userId() != null) {
                span.setAttribute("user.id", ctx.userId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Void variant of {@link #inSpan(String, Map, Supplier)}.
     */
    public void runInSpan(String spanName, Map<String, String> attributes, Runnable work) {
        inSpan(spanName, attributes, () -> {
            work.run();
            return null;
        });
    }
}
