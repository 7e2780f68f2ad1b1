package com.vigil.monitoring.correlation;

import java.util.List;

/**
 * Run-over-run trend helpers used by agents and the correlation engine.
 */
public final class TrendCalculator {

    static final double SLOWER_FACTOR = 1.2;
    static final double FASTER_FACTOR = 0.8;

    private TrendCalculator() {
    }

    /**
     * Compares vulnerability totals. Without a previous scan the direction is FIRST_SCAN.
     */
    public static SecurityTrend securityTrend(VulnerabilityCounts current, VulnerabilityCounts previous) {
        if (previous == null) {
            return new SecurityTrend(TrendDirection.FIRST_SCAN, 0, 0, 0);
        }
        long totalDelta = current.total() - previous.total();
        return new SecurityTrend(compare(totalDelta), current.critical() - previous.critical(),
                current.high() - previous.high(), totalDelta);
    }

    /**
     * Compares debug statement and TODO counts; the direction follows debug statements.
     */
    public static CodeTrend codeTrend(long debugStatements, long todos, Long previousDebugStatements,
                                      Long previousTodos) {
        if (previousDebugStatements == null) {
            return new CodeTrend(TrendDirection.FIRST_SCAN, debugStatements, 0, 0, 0.0);
        }
        long debugDelta = debugStatements - previousDebugStatements;
        long todoDelta = previousTodos != null ? todos - previousTodos : 0;
        double growth = previousDebugStatements > 0 ? (double) debugDelta / previousDebugStatements * 100.0 : 0.0;
        return new CodeTrend(compare(debugDelta), debugStatements, debugDelta, todoDelta, growth);
    }

    /**
     * Compares average TTFB: SLOWER above 120% of the previous average, FASTER below 80%.
     */
    public static PerformanceTrend performanceTrend(List<Double> currentTtfbMs, List<Double> previousTtfbMs) {
        double current = average(currentTtfbMs);
        if (previousTtfbMs == null || previousTtfbMs.isEmpty()) {
            return new PerformanceTrend(TrendDirection.FIRST_SCAN, Math.round(current), 0, 0);
        }
        double previous = average(previousTtfbMs);
        TrendDirection direction = current > previous * SLOWER_FACTOR ? TrendDirection.SLOWER
                : current < previous * FASTER_FACTOR ? TrendDirection.FASTER
                : TrendDirection.STABLE;
        return new PerformanceTrend(direction, Math.round(current), Math.round(previous),
                Math.round(current - previous));
    }

    private static TrendDirection compare(long delta) {
        if (delta > 0) {
            return TrendDirection.WORSE;
        }
        return delta < 0 ? TrendDirection.BETTER : TrendDirection.STABLE;
    }

    private static double average(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
