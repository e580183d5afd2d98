package com.ceiling.quota;

import com.ceiling.observability.CorrelationContextHolder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects current usage from every registered reporter into one {@link QuotaMap}.
 * <p>
 * Reporters run concurrently on the supplied executor, one task each, sharing a single
 * {@link ReportContext}. Aggregation is all-or-nothing: the first reporter to fail cancels the
 * shared context, the aggregator still waits for every started task, and then rethrows that first
 * failure as-is. Results that arrive after the cancellation are discarded.
 * <p>
 * The caller can cancel too: by passing a parent {@link ReportContext} that it cancels later, or by
 * interrupting the thread waiting in {@link #aggregate}. Either cancels the shared context and the
 * aggregation fails with {@link CancellationException}. The executor must be able to start every
 * reporter at once; with fewer threads than reporters, a failing reporter can queue behind slow
 * ones and the fan-out no longer fails fast.
 * <p>
 * The reporter set is snapshotted before fanning out, so no registry lock is held while reporters
 * run. The caller's correlation context is carried onto the worker threads.
 */
public final class UsageAggregator {

    private static final Logger log = LoggerFactory.getLogger(UsageAggregator.class);

    private final ReporterRegistry registry;
    private final Executor executor;

    /**
     * @param registry source of the reporters to fan out to
     * @param executor runs one task per reporter; must be able to run them in parallel
     */
    public UsageAggregator(ReporterRegistry registry, Executor executor) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.registry = registry;
        this.executor = executor;
    }

    /**
     * Asks every registered reporter for usage under the given parameters and merges the reports.
     *
     * @return the union of all reports
     * @throws RuntimeException the first failure raised by any reporter, unchanged
     */
    public QuotaMap aggregate(ScopeParameters scopeParameters) {
        return aggregate(scopeParameters, null);
    }

    /**
     * Like {@link #aggregate(ScopeParameters)}, with the reporters' shared context following the
     * caller's {@code parent} context.
     *
     * @param parent caller context whose cancellation stops the aggregation, or null
     * @throws CancellationException if the caller cancelled or the waiting thread was interrupted
     */
    public QuotaMap aggregate(ScopeParameters scopeParameters, ReportContext parent) {
        if (parent != null && parent.isCancelled()) {
            throw new CancellationException("usage aggregation cancelled by caller");
        }
        Map<String, UsageReporter> reporters = registry.snapshot();
        QuotaMap usage = new QuotaMap();
        if (reporters.isEmpty()) {
            return usage;
        }

        ReportContext context = new ReportContext(scopeParameters, parent);
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        List<CompletableFuture<Void>> tasks = new ArrayList<>(reporters.size());

        try {
            for (Map.Entry<String, UsageReporter> entry : reporters.entrySet()) {
                String service = entry.getKey();
                UsageReporter reporter = entry.getValue();
                CompletableFuture<Void> task = CompletableFuture
                        .supplyAsync(CorrelationContextHolder.propagate(() -> reporter.report(context)), executor)
                        .thenAccept(partial -> {
                            if (!context.isCancelled()) {
                                usage.merge(partial);
                            }
                        })
                        .whenComplete((ignored, failure) -> {
                            if (failure != null) {
                                recordFailure(service, unwrap(failure), firstFailure, context);
                            }
                        });
                tasks.add(task);
            }
        } catch (RejectedExecutionException e) {
            recordFailure("<executor>", e, firstFailure, context);
        }

        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]))
                    .handle((ignored, failure) -> null)
                    .get();
        } catch (InterruptedException e) {
            context.cancel();
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} usage reporters, cancelling aggregation", reporters.size());
            CancellationException cancellation =
                    new CancellationException("interrupted while waiting for usage reporters");
            cancellation.initCause(e);
            throw cancellation;
        } catch (ExecutionException e) {
            // handle() completes normally, so the combined future cannot fail
            throw new IllegalStateException("waiting for usage reporters failed", e.getCause());
        }

        Throwable failure = firstFailure.get();
        if (failure != null) {
            throw propagate(failure);
        }
        if (context.isCancelled()) {
            throw new CancellationException("usage aggregation cancelled by caller");
        }
        log.debug("Aggregated {} usage entries from {} reporters", usage.size(), reporters.size());
        return usage;
    }

    private static void recordFailure(String service, Throwable failure,
                                      AtomicReference<Throwable> firstFailure, ReportContext context) {
        if (firstFailure.compareAndSet(null, failure)) {
            context.cancel();
            log.warn("Usage reporter for {} failed, cancelling aggregation: {}", service, failure.toString());
        } else {
            log.debug("Usage reporter for {} also failed after cancellation: {}", service, failure.toString());
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private static RuntimeException propagate(Throwable failure) {
        if (failure instanceof RuntimeException runtime) {
            return runtime;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("usage reporter failed", failure);
    }
}
