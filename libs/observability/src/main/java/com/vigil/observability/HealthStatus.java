package com.vigil.observability;

import java.util.Collection;

/**
 * Health status for an individual probe, a category of probes, or the whole platform.
 * <p>
 * Statuses are ordered by a fixed severity rank. {@link #UNHEALTHY} and {@link #ERROR} share a
 * rank: an error means the probe itself could not complete, which is treated as seriously as a
 * dependency reporting itself down.
 */
public enum HealthStatus {

    /** The component is functioning normally. */
    HEALTHY(0),

    /** The component responds, but slower than expected. */
    DEGRADED(1),

    /** A threshold was crossed that needs attention before it becomes an outage. */
    WARNING(2),

    /** The component is down or rejecting work. */
    UNHEALTHY(3),

    /** The probe could not complete (timeout, transport failure, unexpected exception). */
    ERROR(3),

    /** The component is down or about to lose data; immediate action required. */
    CRITICAL(4);

    private final int severity;

    HealthStatus(int severity) {
        this.severity = severity;
    }

    /** Severity rank; higher is worse. */
    public int severity() {
        return severity;
    }

    /** Returns true when this status ranks strictly worse than {@code other}. */
    public boolean isWorseThan(HealthStatus other) {
        return severity > other.severity;
    }

    /** Returns true for any status other than {@link #HEALTHY}. */
    public boolean isProblem() {
        return this != HEALTHY;
    }

    /**
     * Returns the worse of two statuses. On equal rank the first argument wins, so aggregation
     * is stable for a fixed input order.
     */
    public static HealthStatus worst(HealthStatus a, HealthStatus b) {
        return b.isWorseThan(a) ? b : a;
    }

    /**
     * Returns the worst status in the collection, or {@link #HEALTHY} when it is empty.
     */
    public static HealthStatus worstOf(Collection<HealthStatus> statuses) {
        HealthStatus result = HEALTHY;
        for (HealthStatus status : statuses) {
            if (status != null) {
                result = worst(result, status);
            }
        }
        return result;
    }
}
