package io.storefront.toolkit.streams.telemetry;

import io.storefront.toolkit.core.id.EventIds;
import io.storefront.toolkit.streams.channel.StreamChannel;

import java.time.Duration;
import java.util.Objects;

public class NotificationStream {

    private final StreamChannel<Notification> notifications = new StreamChannel<>("notifications");

    public StreamChannel<Notification> notifications() {
        return notifications;
    }

    public Notification show(NotificationType type, String message) {
        return show(type, message, null, null);
    }

    /**
     * Publishes a notification with a freshly assigned id.
     *
     * @return the published notification
     */
    public Notification show(NotificationType type, String message, Duration duration, Object data) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        Notification notification = new Notification(EventIds.next(), type, message, duration, data);
        notifications.emit(notification);
        return notification;
    }
}
