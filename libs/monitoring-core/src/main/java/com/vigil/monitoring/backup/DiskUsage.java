package com.vigil.monitoring.backup;

import com.vigil.observability.HealthStatus;

import java.util.Map;

/**
 * Root filesystem usage and sizes of tracked directories.
 *
 * @param status             HEALTHY, WARNING or CRITICAL
 * @param usedPercent        used share of the root filesystem, −1 when it could not be read
 * @param directorySizesMb   size per tracked directory in MB, −1 when unreadable
 * @param error              why usage could not be determined, null otherwise
 */
public record DiskUsage(HealthStatus status, double usedPercent, Map<String, Long> directorySizesMb, String error) {

    public DiskUsage {
        directorySizesMb = directorySizesMb != null ? Map.copyOf(directorySizesMb) : Map.of();
    }
}
