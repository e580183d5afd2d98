package com.ceiling.quota;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handed to a {@link UsageReporter} for one report: whose usage to count, and whether the result
 * is still wanted.
 * <p>
 * Cancellation is cooperative. During aggregation every reporter shares one context, which is
 * cancelled as soon as any reporter fails or the waiting caller is interrupted. A reporter may poll
 * {@link #isCancelled()} between expensive steps and stop early; if it ignores the flag its result
 * is simply discarded.
 * <p>
 * Callers hand their own cancellation to the engine by passing a context as the parent of the one
 * the engine creates: cancelling the parent cancels every child. A caller with a deadline cancels
 * its context when the deadline passes.
 */
public final class ReportContext {

    private final ScopeParameters scopeParameters;
    private final ReportContext parent;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public ReportContext(ScopeParameters scopeParameters) {
        this(scopeParameters, null);
    }

    /**
     * @param scopeParameters whose usage to count
     * @param parent          caller context whose cancellation this context follows, or null
     */
    public ReportContext(ScopeParameters scopeParameters, ReportContext parent) {
        if (scopeParameters == null) {
            throw new IllegalArgumentException("scopeParameters must not be null");
        }
        this.scopeParameters = scopeParameters;
        this.parent = parent;
    }

    /**
     * Creates a context that only carries cancellation, for callers that pass it as a parent.
     */
    public static ReportContext cancellable() {
        return new ReportContext(ScopeParameters.none());
    }

    public ScopeParameters scopeParameters() {
        return scopeParameters;
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    /**
     * Marks the context cancelled. Children created with this context as parent see it too.
     *
     * @return true if this call did the cancelling, false if it already was cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }
}
