package com.vigil.monitoring.baseline;

public enum AnomalyDirection {
    ABOVE_NORMAL,
    BELOW_NORMAL,
    NORMAL
}
