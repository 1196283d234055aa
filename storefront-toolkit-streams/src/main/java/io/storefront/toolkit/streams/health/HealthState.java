package io.storefront.toolkit.streams.health;

public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    UNKNOWN
}
