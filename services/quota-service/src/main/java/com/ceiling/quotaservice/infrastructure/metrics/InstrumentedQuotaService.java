package com.ceiling.quotaservice.infrastructure.metrics;

import com.ceiling.observability.MetricFactory;
import com.ceiling.observability.SpanHelper;
import com.ceiling.quota.QuotaReporterRegistration;
import com.ceiling.quota.QuotaService;
import com.ceiling.quota.QuotaStatus;
import com.ceiling.quota.ReportContext;
import com.ceiling.quota.RequestContext;
import com.ceiling.quota.ScopeParameters;
import com.ceiling.quota.UpdateQuotaCommand;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Decorates a {@link QuotaService} with Micrometer meters and OpenTelemetry spans.
 *
 * <p>Meters:
 *
 * <ul>
 *   <li>{@code quota.checks} counter, tagged {@code target} and {@code outcome}
 *       ({@code reached}, {@code not_reached}, {@code error})
 *   <li>{@code quota.list.duration} timer, tagged {@code scope}
 *   <li>{@code quota.registrations} counter, only while enforcement is enabled
 * </ul>
 *
 * <p>Errors pass through unchanged; only the outcome tag records them.
 */
public class InstrumentedQuotaService implements QuotaService {

    static final String CHECKS = "quota.checks";
    static final String LIST_DURATION = "quota.list.duration";
    static final String REGISTRATIONS = "quota.registrations";

    private final QuotaService delegate;
    private final MetricFactory metrics;
    private final SpanHelper spans;

    public InstrumentedQuotaService(QuotaService delegate, MetricFactory metrics, SpanHelper spans) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        this.delegate = delegate;
        this.metrics = metrics;
        this.spans = spans;
    }

    @Override
    public boolean checkQuotaReachedForRequest(RequestContext requestContext, String targetService) {
        return countCheck(targetService, () ->
                delegate.checkQuotaReachedForRequest(requestContext, targetService));
    }

    @Override
    public boolean checkQuotaReached(String targetService, ScopeParameters scopeParameters, ReportContext parent) {
        return countCheck(targetService, () ->
                delegate.checkQuotaReached(targetService, scopeParameters, parent));
    }

    @Override
    public List<QuotaStatus> listQuotas(String scope, long id, ReportContext parent) {
        Timer timer = metrics.timer(LIST_DURATION, "Time to list quotas with usage", "scope", String.valueOf(scope));
        return timer.record(() -> spans.inSpan("quota.list", Map.of("quota.scope", String.valueOf(scope)),
                () -> delegate.listQuotas(scope, id, parent)));
    }

    @Override
    public void updateQuota(UpdateQuotaCommand command) {
        spans.runInSpan("quota.update", Map.of("quota.target", command == null ? "" : command.target()),
                () -> delegate.updateQuota(command));
    }

    @Override
    public void deleteByUser(long userId) {
        delegate.deleteByUser(userId);
    }

    @Override
    public void registerUsageSource(QuotaReporterRegistration registration) {
        delegate.registerUsageSource(registration);
        // disabled engines drop registrations, so there is nothing to count
        if (delegate.isEnabled()) {
            metrics.counter(REGISTRATIONS, "Usage sources registered with the quota engine").increment();
        }
    }

    @Override
    public boolean isEnabled() {
        return delegate.isEnabled();
    }

    private boolean countCheck(String targetService, Supplier<Boolean> check) {
        String target = String.valueOf(targetService);
        try {
            boolean reached = spans.inSpan("quota.check", Map.of("quota.target", target), check);
            metrics.counter(CHECKS, "Quota decisions", "target", target,
                    "outcome", reached ? "reached" : "not_reached").increment();
            return reached;
        } catch (RuntimeException e) {
            metrics.counter(CHECKS, "Quota decisions", "target", target, "outcome", "error").increment();
            throw e;
        }
    }
}
