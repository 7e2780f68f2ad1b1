package com.vigil.monitoring.check;

import com.vigil.observability.HealthStatus;

import java.util.Map;

/**
 * What a probe observed, before latency and identity are attached.
 *
 * @param status  classified status
 * @param error   failure description, null on success
 * @param metrics measurements to report
 */
public record ProbeOutcome(HealthStatus status, String error, Map<String, Object> metrics) {

    public ProbeOutcome {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        metrics = metrics != null ? metrics : Map.of();
    }

    public static ProbeOutcome healthy() {
        return new ProbeOutcome(HealthStatus.HEALTHY, null, Map.of());
    }

    public static ProbeOutcome of(HealthStatus status, Map<String, Object> metrics) {
        return new ProbeOutcome(status, null, metrics);
    }

    public static ProbeOutcome failure(HealthStatus status, String error) {
        return new ProbeOutcome(status, error, Map.of());
    }
}
