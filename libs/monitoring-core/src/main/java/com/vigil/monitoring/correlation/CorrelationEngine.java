package com.vigil.monitoring.correlation;

import com.vigil.monitoring.history.HistoryEntry;
import com.vigil.monitoring.history.HistoryStore;
import com.vigil.monitoring.history.MetricAccessor;
import com.vigil.monitoring.issue.AgentIssue;
import com.vigil.monitoring.issue.IssueSeverity;
import com.vigil.monitoring.issue.IssueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Weekly detection of patterns that span several agents.
 * <p>
 * Each heuristic runs independently; a heuristic that fails is recorded in
 * {@link CorrelationReport#errors()} and the others still run. The report is appended to history
 * under action {@value #ACTION}.
 */
public final class CorrelationEngine {

    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    public static final String AGENT_NAME = "correlation-engine";
    public static final String ACTION = "weekly_correlation";

    static final double DEBUG_GROWTH_FACTOR = 1.1;
    static final long DEBUG_STATEMENT_FLOOR = 300;
    static final int HEALTH_WINDOW = 7;
    static final int PERSISTENT_HEALTH_THRESHOLD = 3;
    static final Duration BACKLOG_AGE = Duration.ofDays(7);
    static final int BACKLOG_THRESHOLD = 3;

    private final HistoryStore history;
    private final IssueStore issues;
    private final CorrelationSources sources;
    private final Clock clock;

    public CorrelationEngine(HistoryStore history, IssueStore issues, CorrelationSources sources, Clock clock) {
        this.history = history;
        this.issues = issues;
        this.sources = sources;
        this.clock = clock;
    }

    public CorrelationReport runWeeklyCorrelation() {
        List<Finding> correlations = new ArrayList<>();
        List<Finding> insights = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();

        runHeuristic("security_performance", errors, () -> securityPerformanceDecline().ifPresent(correlations::add));
        runHeuristic("debug_statements", errors, () -> debugStatementGrowth().ifPresent(insights::add));
        runHeuristic("health", errors, () -> persistentHealthIssues().ifPresent(correlations::add));
        runHeuristic("issue_backlog", errors, () -> issueBacklog().ifPresent(insights::add));

        CorrelationReport report = new CorrelationReport(clock.instant(), correlations, insights, errors);
        persist(report);
        log.info("Weekly correlation: {} correlations, {} insights, {} heuristics failed",
                correlations.size(), insights.size(), errors.size());
        return report;
    }

    Optional<Finding> securityPerformanceDecline() {
        List<HistoryEntry> scans = history.recent(sources.securityAgent(), sources.securityAction(), 2);
        List<HistoryEntry> checks = history.recent(sources.performanceAgent(), sources.performanceAction(), 2);
        if (scans.isEmpty() || checks.isEmpty()) {
            return Optional.empty();
        }
        SecurityTrend security = TrendCalculator.securityTrend(vulnerabilities(scans.get(0)),
                scans.size() > 1 ? vulnerabilities(scans.get(1)) : null);
        PerformanceTrend performance = TrendCalculator.performanceTrend(ttfbValues(checks.get(0)),
                checks.size() > 1 ? ttfbValues(checks.get(1)) : List.of());

        if (security.direction() == TrendDirection.WORSE
                && (performance.direction() == TrendDirection.SLOWER || performance.direction() == TrendDirection.WORSE)) {
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("vulnerabilityDelta", security.totalDelta());
            evidence.put("criticalDelta", security.criticalDelta());
            evidence.put("averageTtfbMs", performance.averageTtfbMs());
            evidence.put("previousAverageTtfbMs", performance.previousAverageTtfbMs());
            return Optional.of(new Finding("security_performance_decline", IssueSeverity.HIGH,
                    "Security posture and page performance declined in the same period",
                    List.of(sources.securityAgent(), sources.performanceAgent()), evidence));
        }
        return Optional.empty();
    }

    Optional<Finding> debugStatementGrowth() {
        List<HistoryEntry> scans = history.recent(sources.codeAgent(), sources.codeAction(), 2);
        if (scans.size() < 2) {
            return Optional.empty();
        }
        long current = count(scans.get(0), "debugStatements");
        long previous = count(scans.get(1), "debugStatements");
        if (current > previous * DEBUG_GROWTH_FACTOR && current > DEBUG_STATEMENT_FLOOR) {
            CodeTrend trend = TrendCalculator.codeTrend(current, count(scans.get(0), "todos"), previous,
                    count(scans.get(1), "todos"));
            return Optional.of(new Finding("debug_statement_growth", IssueSeverity.LOW,
                    String.format("Debug statements grew %.0f%% to %d", trend.debugGrowthPercent(), current),
                    List.of(sources.codeAgent()),
                    Map.of("current", current, "previous", previous, "todoDelta", trend.todoDelta())));
        }
        return Optional.empty();
    }

    Optional<Finding> persistentHealthIssues() {
        List<HistoryEntry> runs = history.recent(sources.healthAgent(), sources.healthAction(), HEALTH_WINDOW);
        long problematic = runs.stream().filter(CorrelationEngine::hadProblems).count();
        if (problematic > PERSISTENT_HEALTH_THRESHOLD) {
            return Optional.of(new Finding("persistent_health_issues", IssueSeverity.MEDIUM,
                    problematic + " of the last " + runs.size() + " health runs reported warnings or unhealthy services",
                    List.of(sources.healthAgent()),
                    Map.of("problematicRuns", problematic, "runs", runs.size())));
        }
        return Optional.empty();
    }

    Optional<Finding> issueBacklog() {
        Instant cutoff = clock.instant().minus(BACKLOG_AGE);
        List<AgentIssue> stale = issues.findActive().stream()
                .filter(issue -> issue.detectedAt() != null && issue.detectedAt().isBefore(cutoff))
                .toList();
        if (stale.size() > BACKLOG_THRESHOLD) {
            List<String> agents = stale.stream().map(AgentIssue::agentName).distinct().toList();
            return Optional.of(new Finding("issue_backlog", IssueSeverity.MEDIUM,
                    stale.size() + " open issues are older than " + BACKLOG_AGE.toDays() + " days",
                    agents, Map.of("staleIssues", stale.size())));
        }
        return Optional.empty();
    }

    private static boolean hadProblems(HistoryEntry run) {
        if (run.status() != null && !"healthy".equalsIgnoreCase(run.status())) {
            return true;
        }
        return positive(run, "summary.warning") || positive(run, "summary.unhealthy")
                || positive(run, "summary.critical");
    }

    private static boolean positive(HistoryEntry entry, String path) {
        OptionalDouble value = MetricAccessor.path(path).extract(entry);
        return value.isPresent() && value.getAsDouble() > 0;
    }

    private static long count(HistoryEntry entry, String path) {
        OptionalDouble value = MetricAccessor.path(path).extract(entry);
        return value.isPresent() ? (long) value.getAsDouble() : 0L;
    }

    private static VulnerabilityCounts vulnerabilities(HistoryEntry scan) {
        return new VulnerabilityCounts(count(scan, "vulnerabilities.total"), count(scan, "vulnerabilities.critical"),
                count(scan, "vulnerabilities.high"));
    }

    private static List<Double> ttfbValues(HistoryEntry check) {
        Object checks = check.metrics().get("checks");
        List<Double> values = new ArrayList<>();
        if (checks instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map && map.get("ttfb") != null) {
                    try {
                        values.add(Double.parseDouble(String.valueOf(map.get("ttfb"))));
                    } catch (NumberFormatException e) {
                        values.add(0.0);
                    }
                }
            }
        }
        if (values.isEmpty()) {
            MetricAccessor.path("averageTtfbMs").extract(check).ifPresent(values::add);
        }
        return values;
    }

    private void runHeuristic(String name, Map<String, String> errors, Runnable heuristic) {
        try {
            heuristic.run();
        } catch (RuntimeException e) {
            log.warn("Correlation heuristic {} failed: {}", name, e.getMessage(), e);
            errors.put(name, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void persist(CorrelationReport report) {
        try {
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("correlations", report.correlations().stream().map(CorrelationEngine::toMap).toList());
            metrics.put("insights", report.insights().stream().map(CorrelationEngine::toMap).toList());
            metrics.put("errors", report.errors());
            history.append(HistoryEntry.of(AGENT_NAME, ACTION, report.generatedAt(), "completed",
                    report.correlations().size() + " correlations, " + report.insights().size() + " insights",
                    metrics));
        } catch (RuntimeException e) {
            log.warn("Could not persist correlation report: {}", e.getMessage(), e);
        }
    }

    private static Map<String, Object> toMap(Finding finding) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", finding.type());
        map.put("severity", finding.severity().key());
        map.put("description", finding.description());
        map.put("agents", finding.agents());
        map.put("evidence", finding.evidence());
        return map;
    }
}
