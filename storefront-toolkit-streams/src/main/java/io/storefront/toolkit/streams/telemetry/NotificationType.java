package io.storefront.toolkit.streams.telemetry;

public enum NotificationType {
    SUCCESS,
    ERROR,
    WARNING,
    INFO
}
