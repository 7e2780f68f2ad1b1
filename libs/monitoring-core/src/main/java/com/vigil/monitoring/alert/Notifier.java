package com.vigil.monitoring.alert;

/**
 * Outbound notification transport. Implementations may throw unchecked exceptions on delivery
 * failure; {@link AlertDispatcher} catches them.
 */
public interface Notifier {

    NotificationReceipt sendNotification(Notification notification);
}
