package com.vigil.monitoring.correlation;

public enum TrendDirection {
    FIRST_SCAN,
    WORSE,
    BETTER,
    STABLE,
    SLOWER,
    FASTER
}
