package com.vigil.monitoring.check;

/**
 * A single bounded probe of one dependency.
 * <p>
 * Implementations must not throw: every failure is reported as a {@link CheckResult} with an
 * error status. {@link AbstractTimedCheck} provides this contract together with latency
 * measurement.
 */
public interface HealthCheck {

    /** Probe name, unique within its category. */
    String name();

    CheckCategory category();

    CheckResult check();
}
