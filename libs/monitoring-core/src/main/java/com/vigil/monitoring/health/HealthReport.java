package com.vigil.monitoring.health;

import com.vigil.monitoring.check.CheckCategory;
import com.vigil.monitoring.check.CheckResult;
import com.vigil.observability.HealthStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of a full or quick health run.
 *
 * @param timestamp       when the run finished
 * @param mode            {@code full} or {@code quick}
 * @param overallStatus   worst status across categories
 * @param executionTimeMs wall-clock duration of the run
 * @param categories      per-category results in category order
 * @param summary         issue counts across all checks
 */
public record HealthReport(
        Instant timestamp,
        String mode,
        HealthStatus overallStatus,
        long executionTimeMs,
        Map<CheckCategory, CategoryReport> categories,
        HealthSummary summary
) {

    public HealthReport {
        categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    public List<CheckResult> allChecks() {
        return categories.values().stream()
                .flatMap(report -> report.checks().stream())
                .toList();
    }

    /** Returns true only for a fully healthy run; anything degraded or worse maps to 503. */
    public boolean isServing() {
        return overallStatus == HealthStatus.HEALTHY;
    }
}
