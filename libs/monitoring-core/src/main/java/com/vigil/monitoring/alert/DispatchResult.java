package com.vigil.monitoring.alert;

import java.util.List;

/**
 * Outcome of one dispatch attempt.
 *
 * @param alertKey key the alert was dispatched under
 * @param outcome  whether it was sent, suppressed by cooldown, or failed
 * @param urgency  urgency of the alert
 * @param channels channels reported by the notifier (empty unless sent)
 * @param error    failure description when {@code outcome} is FAILED
 */
public record DispatchResult(String alertKey, Outcome outcome, int urgency, List<String> channels, String error) {

    public enum Outcome {
        SENT,
        SUPPRESSED,
        FAILED
    }

    public DispatchResult {
        channels = channels != null ? List.copyOf(channels) : List.of();
    }

    static DispatchResult sent(String alertKey, int urgency, List<String> channels) {
        return new DispatchResult(alertKey, Outcome.SENT, urgency, channels, null);
    }

    static DispatchResult suppressed(String alertKey, int urgency) {
        return new DispatchResult(alertKey, Outcome.SUPPRESSED, urgency, List.of(), null);
    }

    static DispatchResult failed(String alertKey, int urgency, String error) {
        return new DispatchResult(alertKey, Outcome.FAILED, urgency, List.of(), error);
    }

    public boolean isSent() {
        return outcome == Outcome.SENT;
    }
}
