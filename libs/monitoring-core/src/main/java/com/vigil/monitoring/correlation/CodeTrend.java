package com.vigil.monitoring.correlation;

/**
 * Change in code-quality counters between two scans.
 *
 * @param direction          WORSE when debug statements grew
 * @param debugStatements    current debug statement count
 * @param debugDelta         change in debug statements
 * @param todoDelta          change in TODO markers
 * @param debugGrowthPercent relative growth of debug statements, 0 when there is no previous count
 */
public record CodeTrend(TrendDirection direction, long debugStatements, long debugDelta, long todoDelta,
                        double debugGrowthPercent) {
}
