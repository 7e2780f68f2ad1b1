package com.vigil.monitoring.history;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Extracts one numeric measurement from a history entry.
 */
@FunctionalInterface
public interface MetricAccessor {

    OptionalDouble extract(HistoryEntry entry);

    /**
     * Accessor for a dotted path into {@link HistoryEntry#metrics()}, e.g. {@code summary.totalChecks}.
     * Missing keys and non-numeric values yield an empty result.
     */
    static MetricAccessor path(String dottedPath) {
        if (dottedPath == null || dottedPath.isBlank()) {
            throw new IllegalArgumentException("dottedPath must not be null or blank");
        }
        String[] segments = dottedPath.split("\\.");
        return entry -> {
            Object current = entry.metrics();
            for (String segment : segments) {
                if (!(current instanceof Map<?, ?> map)) {
                    return OptionalDouble.empty();
                }
                current = map.get(segment);
            }
            if (current instanceof Number number) {
                double value = number.doubleValue();
                return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
            }
            if (current instanceof String text) {
                try {
                    return OptionalDouble.of(Double.parseDouble(text.trim()));
                } catch (NumberFormatException e) {
                    return OptionalDouble.empty();
                }
            }
            return OptionalDouble.empty();
        };
    }
}
