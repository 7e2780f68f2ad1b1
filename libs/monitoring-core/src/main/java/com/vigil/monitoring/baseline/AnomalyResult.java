package com.vigil.monitoring.baseline;

/**
 * Verdict of {@link BaselineService#detectAnomaly(double, Baseline)}.
 *
 * @param anomaly            whether the value lies outside the ±2σ band
 * @param deviationInStdDevs z-score rounded to two decimals (0 when not computable)
 * @param direction          side of the band the value is on
 * @param thresholdUpper     mean + 2σ, null without a usable baseline
 * @param thresholdLower     mean − 2σ, null without a usable baseline
 * @param reason             {@code no_variance} or {@code insufficient_data} when no verdict was possible
 */
public record AnomalyResult(boolean anomaly, double deviationInStdDevs, AnomalyDirection direction,
                            Double thresholdUpper, Double thresholdLower, String reason) {

    public static final String NO_VARIANCE = "no_variance";
    public static final String INSUFFICIENT_DATA = "insufficient_data";

    static AnomalyResult notEvaluated(String reason) {
        return new AnomalyResult(false, 0.0, AnomalyDirection.NORMAL, null, null, reason);
    }
}
