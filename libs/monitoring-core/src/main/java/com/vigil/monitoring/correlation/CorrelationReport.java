package com.vigil.monitoring.correlation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Weekly correlation output. {@code errors} maps a heuristic name to why it could not run.
 */
public record CorrelationReport(Instant generatedAt, List<Finding> correlations, List<Finding> insights,
                                Map<String, String> errors) {

    public CorrelationReport {
        correlations = List.copyOf(correlations);
        insights = List.copyOf(insights);
        errors = Map.copyOf(errors);
    }
}
