package com.vigil.monitoring.baseline;

import com.vigil.monitoring.history.HistoryEntry;
import com.vigil.monitoring.history.HistoryStore;
import com.vigil.monitoring.history.MetricAccessor;
import com.vigil.monitoring.issue.AgentIssue;
import com.vigil.monitoring.issue.AgentIssueTracker;
import com.vigil.monitoring.issue.IssueSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Rolling baselines over agent history and z-score anomaly detection.
 * <p>
 * A baseline uses the last {@value #BASELINE_WINDOW} samples and needs at least
 * {@value #MIN_SAMPLES} numeric values. A value is anomalous when it lies more than
 * {@value #Z_THRESHOLD} standard deviations from the mean.
 */
public final class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    public static final int BASELINE_WINDOW = 14;
    public static final int MIN_SAMPLES = 3;
    public static final double Z_THRESHOLD = 2.0;
    public static final double HIGH_SEVERITY_Z = 3.0;

    /** Agent name under which anomaly issues are raised. */
    public static final String AGENT_NAME = "anomaly-detection";
    public static final String ISSUE_CATEGORY = "anomaly";

    private final HistoryStore history;
    private final AgentIssueTracker issues;
    private final List<MetricCheck> checklist;

    public BaselineService(HistoryStore history, AgentIssueTracker issues, List<MetricCheck> checklist) {
        if (history == null) {
            throw new IllegalArgumentException("history must not be null");
        }
        this.history = history;
        this.issues = issues;
        this.checklist = List.copyOf(checklist);
    }

    /**
     * Baseline of the last {@value #BASELINE_WINDOW} samples of a metric. Empty when fewer than
     * {@value #MIN_SAMPLES} values could be extracted; never throws for missing data.
     */
    public Optional<Baseline> calculateBaseline(String agentName, String action, String metricPath) {
        List<HistoryEntry> samples = history.recent(agentName, action, BASELINE_WINDOW);
        return compute(agentName, action, metricPath, samples, MetricAccessor.path(metricPath));
    }

    /**
     * Classifies {@code value} against {@code baseline}. A null baseline or one with zero variance
     * never yields an anomaly.
     */
    public AnomalyResult detectAnomaly(double value, Baseline baseline) {
        if (baseline == null) {
            return AnomalyResult.notEvaluated(AnomalyResult.INSUFFICIENT_DATA);
        }
        if (baseline.stdDev() == 0.0) {
            return AnomalyResult.notEvaluated(AnomalyResult.NO_VARIANCE);
        }
        double z = (value - baseline.mean()) / baseline.stdDev();
        boolean anomaly = Math.abs(z) > Z_THRESHOLD;
        AnomalyDirection direction = !anomaly ? AnomalyDirection.NORMAL
                : z > 0 ? AnomalyDirection.ABOVE_NORMAL : AnomalyDirection.BELOW_NORMAL;
        return new AnomalyResult(anomaly, round(z), direction,
                round(baseline.mean() + Z_THRESHOLD * baseline.stdDev()),
                round(baseline.mean() - Z_THRESHOLD * baseline.stdDev()), null);
    }

    /**
     * Evaluates every checklist entry: the newest sample is the current value and the
     * {@value #BASELINE_WINDOW} samples before it form the baseline. Each anomaly raises (or
     * refreshes) an issue; anomaly issues not detected in this run are auto-closed afterwards.
     * A failing entry is recorded and never stops the others.
     */
    public BatchAnomalyReport runBatchAnomalyCheck() {
        List<BatchAnomalyReport.Anomaly> anomalies = new ArrayList<>();
        Map<String, String> skipped = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        Set<String> detected = new HashSet<>();

        for (MetricCheck check : checklist) {
            String id = check.agentName() + ":" + check.metricPath();
            try {
                List<HistoryEntry> samples = history.recent(check.agentName(), check.action(), BASELINE_WINDOW + 1);
                if (samples.isEmpty()) {
                    skipped.put(id, "no_history");
                    continue;
                }
                OptionalDouble current = check.accessor().extract(samples.get(0));
                if (current.isEmpty()) {
                    skipped.put(id, "no_current_value");
                    continue;
                }
                Optional<Baseline> baseline = compute(check.agentName(), check.action(), check.metricPath(),
                        samples.subList(1, samples.size()), check.accessor());
                AnomalyResult result = detectAnomaly(current.getAsDouble(), baseline.orElse(null));
                if (result.reason() != null) {
                    skipped.put(id, result.reason());
                    continue;
                }
                if (result.anomaly()) {
                    detected.add(check.fingerprint());
                    AgentIssue issue = raise(check, current.getAsDouble(), baseline.get(), result);
                    anomalies.add(new BatchAnomalyReport.Anomaly(check, current.getAsDouble(), baseline.get(),
                            result, issue != null ? issue.issueId() : null));
                }
            } catch (RuntimeException e) {
                log.warn("Anomaly check {} failed: {}", id, e.getMessage(), e);
                errors.put(id, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        int closed = 0;
        if (issues != null) {
            try {
                closed = issues.autoCloseIssues(AGENT_NAME, ISSUE_CATEGORY, detected).size();
            } catch (RuntimeException e) {
                log.warn("Auto-closing anomaly issues failed: {}", e.getMessage(), e);
            }
        }
        log.info("Anomaly check: {} metrics, {} anomalies, {} skipped, {} errors", checklist.size(),
                anomalies.size(), skipped.size(), errors.size());
        return new BatchAnomalyReport(checklist.size(), anomalies, skipped, errors, closed);
    }

    public List<MetricCheck> checklist() {
        return checklist;
    }

    private AgentIssue raise(MetricCheck check, double value, Baseline baseline, AnomalyResult result) {
        if (issues == null) {
            return null;
        }
        IssueSeverity severity = Math.abs(result.deviationInStdDevs()) > HIGH_SEVERITY_Z
                ? IssueSeverity.HIGH : IssueSeverity.MEDIUM;
        String side = result.direction() == AnomalyDirection.ABOVE_NORMAL ? "above" : "below";
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("metric", check.metricPath());
        details.put("value", value);
        details.put("mean", baseline.mean());
        details.put("stdDev", baseline.stdDev());
        details.put("deviation", result.deviationInStdDevs());
        details.put("direction", result.direction().name());
        details.put("thresholdUpper", result.thresholdUpper());
        details.put("thresholdLower", result.thresholdLower());
        details.put("sampleCount", baseline.sampleCount());
        return issues.raiseIssue(AGENT_NAME, check.fingerprint(), severity, ISSUE_CATEGORY,
                "Anomaly: " + check.label() + " " + side + " normal",
                String.format("%s is %.2f, %.2fσ %s the %d-sample mean of %.2f", check.label(), value,
                        Math.abs(result.deviationInStdDevs()), side, baseline.sampleCount(), baseline.mean()),
                details, null);
    }

    private static Optional<Baseline> compute(String agentName, String action, String metricPath,
                                              List<HistoryEntry> samples, MetricAccessor accessor) {
        double[] values = samples.stream()
                .limit(BASELINE_WINDOW)
                .map(accessor::extract)
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .toArray();
        if (values.length < MIN_SAMPLES) {
            return Optional.empty();
        }
        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / values.length;
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        double stdDev = Math.sqrt(squares / values.length);
        return Optional.of(new Baseline(agentName, action, metricPath, round(mean), round(stdDev), min, max,
                values.length));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
