package com.vigil.monitoring.baseline;

import com.vigil.monitoring.history.MetricAccessor;

/**
 * One entry of the anomaly checklist.
 *
 * @param agentName  agent whose history holds the metric
 * @param action     history action to read
 * @param metricPath metric identifier, also used in the issue fingerprint
 * @param label      human-readable name used in issue titles
 * @param accessor   extracts the value from a history entry
 */
public record MetricCheck(String agentName, String action, String metricPath, String label,
                          MetricAccessor accessor) {

    public MetricCheck {
        if (agentName == null || action == null || metricPath == null) {
            throw new IllegalArgumentException("agentName, action and metricPath must not be null");
        }
        accessor = accessor != null ? accessor : MetricAccessor.path(metricPath);
        label = label != null ? label : metricPath;
    }

    public static MetricCheck of(String agentName, String action, String metricPath, String label) {
        return new MetricCheck(agentName, action, metricPath, label, null);
    }

    /** Fingerprint of issues raised for this metric: {@code anomaly:<agent>:<metric>}. */
    public String fingerprint() {
        return "anomaly:" + agentName + ":" + metricPath;
    }
}
