package com.vigil.monitoring.alert;

import java.util.Map;

/**
 * Message handed to a {@link Notifier}.
 *
 * @param subject  short headline
 * @param message  body text
 * @param urgency  1 (informational) to 5 (page immediately)
 * @param category alert category, e.g. {@code health}
 * @param metadata structured context for the transport
 */
public record Notification(String subject, String message, int urgency, String category, Map<String, Object> metadata) {

    public Notification {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        if (urgency < 1 || urgency > 5) {
            throw new IllegalArgumentException("urgency must be between 1 and 5");
        }
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
