package io.storefront.toolkit.streams.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one round of health checks.
 *
 * @param status    overall state
 * @param timestamp when the round finished
 * @param checks    per-check outcome, in registration order
 */
public record HealthStatus(HealthState status, Instant timestamp, Map<String, Boolean> checks) {

    public HealthStatus {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    public static HealthStatus unknown(Instant timestamp) {
        return new HealthStatus(HealthState.UNKNOWN, timestamp, Map.of());
    }
}
