package com.vigil.monitoring.correlation;

/**
 * Change in vulnerability counts between two scans.
 */
public record SecurityTrend(TrendDirection direction, long criticalDelta, long highDelta, long totalDelta) {
}
