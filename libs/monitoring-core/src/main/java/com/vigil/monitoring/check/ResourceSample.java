package com.vigil.monitoring.check;

/**
 * Point-in-time resource readings of the host.
 *
 * @param loadAverage      one-minute system load average, negative when unavailable
 * @param cores            number of available processors
 * @param totalMemoryBytes physical memory size
 * @param freeMemoryBytes  free physical memory
 */
public record ResourceSample(double loadAverage, int cores, long totalMemoryBytes, long freeMemoryBytes) {

    public double cpuPercent() {
        if (loadAverage < 0 || cores <= 0) {
            return 0.0;
        }
        return loadAverage / cores * 100.0;
    }

    public double memoryPercent() {
        if (totalMemoryBytes <= 0) {
            return 0.0;
        }
        return (double) (totalMemoryBytes - freeMemoryBytes) / totalMemoryBytes * 100.0;
    }
}
