package com.vigil.healthmonitor.agent;

import com.vigil.monitoring.agent.AgentDescriptor;
import com.vigil.monitoring.agent.AgentOutcome;
import com.vigil.monitoring.agent.SharedAgent;
import com.vigil.monitoring.correlation.CorrelationEngine;
import com.vigil.monitoring.correlation.CorrelationReport;
import com.vigil.monitoring.correlation.Finding;
import com.vigil.monitoring.issue.AgentIssueTracker;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Weekly cross-agent correlation. Each correlation (not insight) is kept as an issue until a
 * later run no longer finds it.
 */
@Component
@Order(60)
public class CorrelationAgent implements SharedAgent {

    private static final Logger log = LoggerFactory.getLogger(CorrelationAgent.class);

    static final String ISSUE_CATEGORY = "correlation";

    private static final AgentDescriptor DESCRIPTOR =
            new AgentDescriptor(
                    CorrelationEngine.AGENT_NAME, "Correlation Engine", "Cross-agent patterns", "B", "1.0.0", false);

    private final CorrelationEngine engine;
    private final AgentIssueTracker issues;

    public CorrelationAgent(CorrelationEngine engine, AgentIssueTracker issues) {
        this.engine = engine;
        this.issues = issues;
    }

    @Override
    public AgentDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public AgentOutcome execute() {
        CorrelationReport report = engine.runWeeklyCorrelation();
        try {
            Set<String> active = new HashSet<>();
            for (Finding correlation : report.correlations()) {
                String fingerprint = "correlation:" + correlation.type();
                active.add(fingerprint);
                issues.raiseIssue(
                        CorrelationEngine.AGENT_NAME,
                        fingerprint,
                        correlation.severity(),
                        ISSUE_CATEGORY,
                        correlation.type(),
                        correlation.description(),
                        Map.of("agents", correlation.agents(), "evidence", correlation.evidence()),
                        null);
            }
            issues.autoCloseIssues(CorrelationEngine.AGENT_NAME, ISSUE_CATEGORY, active);
        } catch (RuntimeException e) {
            log.warn("Could not update correlation issues: {}", e.getMessage(), e);
        }

        String summary =
                report.correlations().size() + " correlations, " + report.insights().size() + " insights";
        Map<String, Object> details =
                Map.of(
                        "correlations", report.correlations().stream().map(Finding::type).toList(),
                        "insights", report.insights().stream().map(Finding::type).toList(),
                        "errors", report.errors());
        return report.errors().isEmpty()
                ? AgentOutcome.success(summary, details)
                : AgentOutcome.failure(summary, details);
    }
}
