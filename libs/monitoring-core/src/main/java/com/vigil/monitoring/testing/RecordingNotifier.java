package com.vigil.monitoring.testing;

import com.vigil.monitoring.alert.Notification;
import com.vigil.monitoring.alert.NotificationReceipt;
import com.vigil.monitoring.alert.Notifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link Notifier} that records every notification and can be told to fail.
 */
public final class RecordingNotifier implements Notifier {

    private final List<Notification> sent = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    @Override
    public NotificationReceipt sendNotification(Notification notification) {
        if (failure != null) {
            throw failure;
        }
        sent.add(notification);
        return new NotificationReceipt(List.of("recording"));
    }

    public List<Notification> sent() {
        return List.copyOf(sent);
    }

    public RecordingNotifier failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public RecordingNotifier succeed() {
        this.failure = null;
        return this;
    }
}
