package io.storefront.toolkit.streams.telemetry;

import java.time.Instant;

/**
 * @param level     severity
 * @param message   text
 * @param data      optional structured context, may be null
 * @param timestamp creation time
 * @param id        unique id
 */
public record LogEntry(LogLevel level, String message, Object data, Instant timestamp, String id) {
}
