package io.storefront.toolkit.streams.telemetry;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
