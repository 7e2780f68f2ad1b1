package com.vigil.monitoring.alert;

import java.util.List;

/**
 * Channels a notification was delivered through.
 */
public record NotificationReceipt(List<String> channels) {

    public NotificationReceipt {
        channels = channels != null ? List.copyOf(channels) : List.of();
    }
}
