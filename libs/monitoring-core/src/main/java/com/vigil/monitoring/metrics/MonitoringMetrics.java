package com.vigil.monitoring.metrics;

import com.vigil.monitoring.agent.AggregatedAgentRun;
import com.vigil.monitoring.alert.DispatchResult;
import com.vigil.monitoring.health.CategoryReport;
import com.vigil.monitoring.health.HealthReport;
import com.vigil.monitoring.issue.AgentIssue;
import com.vigil.observability.MetricFactory;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instruments of the monitoring pipeline. Status gauges carry the severity rank of
 * {@link com.vigil.observability.HealthStatus} (0 healthy to 4 critical).
 */
public final class MonitoringMetrics {

    private final MetricFactory metrics;

    public MonitoringMetrics(MetricFactory metrics) {
        this.metrics = metrics;
    }

    public void recordHealthReport(HealthReport report) {
        metrics.gauge("vigil.health.overall", "Overall status severity", "mode", report.mode())
                .set(report.overallStatus().severity());
        for (CategoryReport category : report.categories().values()) {
            metrics.gauge("vigil.health.category", "Category status severity", "category", category.category().key())
                    .set(category.status().severity());
        }
        metrics.timer("vigil.health.duration", "Health run duration", "mode", report.mode())
                .record(report.executionTimeMs(), TimeUnit.MILLISECONDS);
    }

    public void recordDispatch(DispatchResult result) {
        metrics.counter("vigil.alerts", "Alert dispatch attempts",
                "outcome", result.outcome().name().toLowerCase(Locale.ROOT),
                "urgency", String.valueOf(result.urgency())).increment();
    }

    public void recordIssue(AgentIssue issue, boolean created) {
        if (created) {
            metrics.counter("vigil.issues.raised", "Issues opened", "severity", issue.severity().key()).increment();
        } else {
            metrics.counter("vigil.issues.recurred", "Repeated detections of open issues",
                    "severity", issue.severity().key()).increment();
        }
    }

    public void recordAgentRun(AggregatedAgentRun run) {
        String outcome = run.success() ? "success" : "failure";
        metrics.counter("vigil.agent.runs", "Agent runs", "agent", run.agentKey(), "outcome", outcome).increment();
        metrics.timer("vigil.agent.duration", "Agent run duration", "agent", run.agentKey())
                .record(run.durationMs(), TimeUnit.MILLISECONDS);
    }
}
