package com.vigil.monitoring.correlation;

/**
 * Change in average time-to-first-byte between two measurement sets.
 */
public record PerformanceTrend(TrendDirection direction, long averageTtfbMs, long previousAverageTtfbMs,
                               long ttfbDeltaMs) {
}
