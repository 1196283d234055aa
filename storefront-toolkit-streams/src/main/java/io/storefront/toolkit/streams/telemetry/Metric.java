package io.storefront.toolkit.streams.telemetry;

import java.time.Instant;
import java.util.Map;

/**
 * @param type      metric name, e.g. {@code operation_duration}
 * @param value     measured value
 * @param tags      dimensions, never null
 * @param timestamp recording time
 * @param id        unique id
 */
public record Metric(String type, double value, Map<String, String> tags, Instant timestamp, String id) {

    public Metric {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }
}
