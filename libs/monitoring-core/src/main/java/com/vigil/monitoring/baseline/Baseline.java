package com.vigil.monitoring.baseline;

/**
 * Statistics of one metric over recent history. Mean and standard deviation are population
 * values rounded to two decimals.
 */
public record Baseline(String agentName, String action, String metricPath, double mean, double stdDev,
                       double min, double max, int sampleCount) {
}
