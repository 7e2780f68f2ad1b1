package com.vigil.monitoring.baseline;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a checklist run.
 *
 * @param checked   number of checklist entries evaluated
 * @param anomalies detected anomalies
 * @param skipped   entries without a current value or baseline, with the reason
 * @param errors    entries that failed, with the error message
 * @param autoClosed number of anomaly issues closed because they were not re-detected
 */
public record BatchAnomalyReport(int checked, List<Anomaly> anomalies, Map<String, String> skipped,
                                 Map<String, String> errors, int autoClosed) {

    /**
     * One detected anomaly and the issue it raised.
     */
    public record Anomaly(MetricCheck check, double value, Baseline baseline, AnomalyResult result, String issueId) {
    }
}
