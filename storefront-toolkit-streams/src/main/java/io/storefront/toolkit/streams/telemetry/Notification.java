package io.storefront.toolkit.streams.telemetry;

import java.time.Duration;

/**
 * User-facing notification.
 *
 * @param id       unique id, assigned by {@link NotificationStream}
 * @param type     severity
 * @param message  text
 * @param duration how long to show it; null means the consumer's default
 * @param data     optional payload, may be null
 */
public record Notification(String id, NotificationType type, String message, Duration duration, Object data) {
}
