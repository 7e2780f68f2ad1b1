package com.vigil.monitoring.check;

import com.vigil.observability.HealthStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a single probe.
 *
 * @param checkName name of the probe, unique within its category
 * @param category  category the probe belongs to
 * @param status    resulting status
 * @param latencyMs time spent probing; null when the probe never ran
 * @param error     failure description; null on success
 * @param timestamp when the result was produced
 * @param metrics   probe-specific measurements (never null)
 */
public record CheckResult(
        String checkName,
        CheckCategory category,
        HealthStatus status,
        Long latencyMs,
        String error,
        Instant timestamp,
        Map<String, Object> metrics
) {

    public CheckResult {
        if (checkName == null || checkName.isBlank()) {
            throw new IllegalArgumentException("checkName must not be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        timestamp = timestamp != null ? timestamp : Instant.now();
        metrics = metrics == null || metrics.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static CheckResult of(String checkName, CheckCategory category, HealthStatus status,
                                 long latencyMs, Map<String, Object> metrics) {
        return new CheckResult(checkName, category, status, latencyMs, null, Instant.now(), metrics);
    }

    public static CheckResult healthy(String checkName, CheckCategory category, long latencyMs) {
        return of(checkName, category, HealthStatus.HEALTHY, latencyMs, Map.of());
    }

    public static CheckResult failed(String checkName, CheckCategory category, HealthStatus status,
                                     String error, Long latencyMs) {
        return new CheckResult(checkName, category, status, latencyMs, error, Instant.now(), Map.of());
    }

    /** Key identifying this probe across runs, e.g. {@code storage:mongodb}. */
    public String key() {
        return category.key() + ":" + checkName;
    }
}
