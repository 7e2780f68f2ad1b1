package com.vigil.monitoring.health;

import com.vigil.monitoring.check.CheckCategory;
import com.vigil.monitoring.check.CheckResult;
import com.vigil.monitoring.check.HealthCheck;
import com.vigil.observability.CorrelationContext;
import com.vigil.observability.CorrelationContextHolder;
import com.vigil.observability.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs health probes concurrently and aggregates them into a {@link HealthReport}.
 * <p>
 * Categories run concurrently and so do the probes inside each category. Every probe is bounded
 * by {@code checkTimeout}; a probe that does not finish in time is reported as
 * {@link HealthStatus#ERROR} while its task keeps running in the background. If assembling a
 * whole category fails, that category reports a single ERROR result and the rest of the report
 * is unaffected.
 * <p>
 * No future is ever joined on a pool thread, so the executor may be small without risk of
 * starvation.
 */
public final class HealthReporter {

    private static final Logger log = LoggerFactory.getLogger(HealthReporter.class);

    /** Default per-probe timeout. */
    public static final Duration DEFAULT_CHECK_TIMEOUT = Duration.ofSeconds(15);

    private final Map<CheckCategory, List<HealthCheck>> fullChecks;
    private final List<HealthCheck> quickChecks;
    private final Executor executor;
    private final Duration checkTimeout;
    private final Clock clock;

    /**
     * @param fullChecks   probes of a full run, grouped by category
     * @param quickChecks  the subset used for liveness
     * @param executor     executor the probes run on
     * @param checkTimeout upper bound for a single probe
     * @param clock        clock for report timestamps
     */
    public HealthReporter(Map<CheckCategory, List<HealthCheck>> fullChecks, List<HealthCheck> quickChecks,
                          Executor executor, Duration checkTimeout, Clock clock) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (checkTimeout == null || checkTimeout.isZero() || checkTimeout.isNegative()) {
            throw new IllegalArgumentException("checkTimeout must be positive");
        }
        this.fullChecks = new EnumMap<>(CheckCategory.class);
        fullChecks.forEach((category, checks) -> this.fullChecks.put(category, List.copyOf(checks)));
        this.quickChecks = List.copyOf(quickChecks);
        this.executor = executor;
        this.checkTimeout = checkTimeout;
        this.clock = clock;
    }

    /**
     * Runs every configured category.
     */
    public HealthReport runFullHealthCheck() {
        return run("full", fullChecks);
    }

    /**
     * Runs the liveness subset (server ping, relational storage, cache and the primary dependency).
     */
    public HealthReport runQuickHealthCheck() {
        Map<CheckCategory, List<HealthCheck>> grouped = new EnumMap<>(CheckCategory.class);
        for (HealthCheck check : quickChecks) {
            grouped.computeIfAbsent(check.category(), c -> new ArrayList<>()).add(check);
        }
        return run("quick", grouped);
    }

    private HealthReport run(String mode, Map<CheckCategory, List<HealthCheck>> checks) {
        long start = System.nanoTime();
        CorrelationContext context = CorrelationContextHolder.currentOrNew();

        Map<CheckCategory, CompletableFuture<CategoryReport>> futures = new EnumMap<>(CheckCategory.class);
        checks.forEach((category, categoryChecks) -> futures.put(category, runCategory(category, categoryChecks, context)));

        Map<CheckCategory, CategoryReport> categories = new LinkedHashMap<>();
        futures.forEach((category, future) -> categories.put(category, future.join()));

        List<HealthStatus> statuses = categories.values().stream().map(CategoryReport::status).toList();
        List<CheckResult> all = categories.values().stream().flatMap(r -> r.checks().stream()).toList();
        HealthReport report = new HealthReport(clock.instant(), mode, HealthStatus.worstOf(statuses),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), categories, HealthSummary.of(all));

        log.info("{} health check finished: {} in {}ms ({} checks, {} issues)", mode, report.overallStatus(),
                report.executionTimeMs(), report.summary().totalChecks(), report.summary().issues());
        return report;
    }

    private CompletableFuture<CategoryReport> runCategory(CheckCategory category, List<HealthCheck> checks,
                                                          CorrelationContext context) {
        try {
            List<CompletableFuture<CheckResult>> results = checks.stream()
                    .map(check -> runCheck(check, context))
                    .toList();
            return CompletableFuture.allOf(results.toArray(new CompletableFuture[0]))
                    .thenApply(ignored -> CategoryReport.of(category,
                            results.stream().map(CompletableFuture::join).toList()))
                    .exceptionally(e -> categoryFailure(category, e));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(categoryFailure(category, e));
        }
    }

    private CompletableFuture<CheckResult> runCheck(HealthCheck check, CorrelationContext context) {
        long timeoutMs = checkTimeout.toMillis();
        return CompletableFuture
                .supplyAsync(() -> CorrelationContextHolder.callWithContext(context, check::check), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    String error = cause instanceof TimeoutException
                            ? "Timed out after " + timeoutMs + "ms"
                            : "Probe failed: " + cause.getMessage();
                    log.warn("Check {}:{} did not complete: {}", check.category().key(), check.name(), error);
                    return CheckResult.failed(check.name(), check.category(), HealthStatus.ERROR, error, timeoutMs);
                });
    }

    private static CategoryReport categoryFailure(CheckCategory category, Throwable e) {
        log.error("Category {} failed as a whole", category.key(), e);
        return CategoryReport.of(category, List.of(CheckResult.failed(category.key(), category,
                HealthStatus.ERROR, "Category failed: " + e.getMessage(), null)));
    }
}
