package com.vigil.monitoring.check;

import com.vigil.observability.HealthStatus;

/**
 * Liveness of one storage backend. Each backend has its own instance, so one failing backend
 * never affects the result of another.
 */
public final class StorageBackendCheck extends AbstractTimedCheck {

    private final StorageProbe probe;

    public StorageBackendCheck(String backendName, StorageProbe probe) {
        super(backendName, CheckCategory.STORAGE);
        if (probe == null) {
            throw new IllegalArgumentException("probe must not be null");
        }
        this.probe = probe;
    }

    @Override
    protected ProbeOutcome probe() throws Exception {
        probe.ping();
        return ProbeOutcome.healthy();
    }

    @Override
    protected HealthStatus failureStatus() {
        return HealthStatus.UNHEALTHY;
    }
}
