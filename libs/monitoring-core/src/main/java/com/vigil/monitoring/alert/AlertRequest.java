package com.vigil.monitoring.alert;

import java.util.Map;

/**
 * An alert to dispatch.
 *
 * @param alertKey deduplication key, e.g. {@code storage:mongodb:unhealthy}
 * @param urgency  1 to 5
 * @param subject  headline
 * @param message  body
 * @param category alert category
 * @param metadata structured context
 */
public record AlertRequest(String alertKey, int urgency, String subject, String message, String category,
                           Map<String, Object> metadata) {

    public AlertRequest {
        if (alertKey == null || alertKey.isBlank()) {
            throw new IllegalArgumentException("alertKey must not be null or blank");
        }
        metadata = metadata != null ? metadata : Map.of();
    }

    Notification toNotification() {
        return new Notification(subject, message, urgency, category, metadata);
    }
}
