package com.vigil.healthmonitor.agent;

import com.vigil.monitoring.agent.AgentDescriptor;
import com.vigil.monitoring.agent.AgentOutcome;
import com.vigil.monitoring.agent.SharedAgent;
import com.vigil.monitoring.alert.AlertDispatcher;
import com.vigil.monitoring.alert.DispatchResult;
import com.vigil.monitoring.check.CheckResult;
import com.vigil.monitoring.health.HealthReport;
import com.vigil.monitoring.health.HealthReporter;
import com.vigil.monitoring.history.HistoryEntry;
import com.vigil.monitoring.history.HistoryStore;
import com.vigil.monitoring.issue.AgentIssueTracker;
import com.vigil.monitoring.issue.IssueSeverity;
import com.vigil.monitoring.metrics.MonitoringMetrics;
import com.vigil.observability.HealthStatus;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Full platform health run: probes every category, records the result, alerts on problems and
 * keeps one issue open per failing probe until it recovers.
 */
@Component
@Order(10)
public class HealthMonitorAgent implements SharedAgent {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitorAgent.class);

    public static final String KEY = "health-monitor";
    public static final String ACTION = "health_check";
    static final String ISSUE_CATEGORY = "health";

    private static final AgentDescriptor DESCRIPTOR =
            new AgentDescriptor(KEY, "Health Monitor", "Platform health", "A", "1.0.0", false);

    private final HealthReporter reporter;
    private final AlertDispatcher dispatcher;
    private final AgentIssueTracker issues;
    private final HistoryStore history;
    private final MonitoringMetrics metrics;

    public HealthMonitorAgent(
            HealthReporter reporter,
            AlertDispatcher dispatcher,
            AgentIssueTracker issues,
            HistoryStore history,
            MonitoringMetrics metrics) {
        this.reporter = reporter;
        this.dispatcher = dispatcher;
        this.issues = issues;
        this.history = history;
        this.metrics = metrics;
    }

    @Override
    public AgentDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public AgentOutcome execute() {
        HealthReport report = reporter.runFullHealthCheck();
        metrics.recordHealthReport(report);
        List<DispatchResult> alerts = dispatcher.dispatchHealthReport(report);
        trackIssues(report);
        persist(report);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("overallStatus", report.overallStatus().name());
        details.put("summary", report.summary());
        details.put("alerts", alerts.size());
        String summary =
                String.format(
                        "Platform %s: %d critical, %d unhealthy, %d warning of %d checks",
                        report.overallStatus(),
                        report.summary().critical(),
                        report.summary().unhealthy(),
                        report.summary().warning(),
                        report.summary().totalChecks());
        return AgentOutcome.success(summary, details);
    }

    private void trackIssues(HealthReport report) {
        try {
            Set<String> active = new HashSet<>();
            for (CheckResult check : report.allChecks()) {
                IssueSeverity severity = severityOf(check.status());
                if (severity == null) {
                    continue;
                }
                String fingerprint = "health:" + check.key();
                active.add(fingerprint);
                issues.raiseIssue(
                        KEY,
                        fingerprint,
                        severity,
                        ISSUE_CATEGORY,
                        check.category().key() + "/" + check.checkName() + " is " + check.status().name(),
                        check.error() != null ? check.error() : "Check reported " + check.status().name(),
                        Map.of("status", check.status().name(), "metrics", check.metrics()),
                        null);
            }
            issues.autoCloseIssues(KEY, ISSUE_CATEGORY, active);
        } catch (RuntimeException e) {
            log.warn("Could not update health issues: {}", e.getMessage(), e);
        }
    }

    private void persist(HealthReport report) {
        Map<String, Object> categories = new LinkedHashMap<>();
        report.categories().forEach((category, result) -> categories.put(category.key(), result.status().name()));
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalChecks", report.summary().totalChecks());
        summary.put("critical", report.summary().critical());
        summary.put("unhealthy", report.summary().unhealthy());
        summary.put("warning", report.summary().warning());
        summary.put("degraded", report.summary().degraded());

        Map<String, Object> recorded = new LinkedHashMap<>();
        recorded.put("summary", summary);
        recorded.put("categories", categories);
        recorded.put("executionTimeMs", report.executionTimeMs());
        try {
            history.append(
                    HistoryEntry.of(
                            KEY,
                            ACTION,
                            report.timestamp(),
                            report.overallStatus().name().toLowerCase(Locale.ROOT),
                            "Health check " + report.overallStatus(),
                            recorded));
        } catch (RuntimeException e) {
            log.warn("Could not persist health check: {}", e.getMessage(), e);
        }
    }

    static IssueSeverity severityOf(HealthStatus status) {
        return switch (status) {
            case CRITICAL -> IssueSeverity.CRITICAL;
            case UNHEALTHY, ERROR -> IssueSeverity.HIGH;
            case WARNING -> IssueSeverity.MEDIUM;
            case DEGRADED -> IssueSeverity.LOW;
            case HEALTHY -> null;
        };
    }
}
