package io.storefront.toolkit.runtime;

import io.storefront.toolkit.resilience.breaker.CircuitState;
import io.storefront.toolkit.resilience.pool.PoolStats;
import io.storefront.toolkit.resilience.ratelimit.RateLimiterStats;
import io.storefront.toolkit.streams.health.HealthState;
import lombok.Builder;

/**
 * Health summary of one {@link ResilientService}.
 * <p>
 * The status follows the breaker: CLOSED is HEALTHY, HALF_OPEN is DEGRADED, OPEN is UNHEALTHY.
 *
 * @param service             service name
 * @param status              overall state
 * @param circuitState        breaker state
 * @param failureCount        breaker failure count
 * @param cacheSize           cached entries, possibly including expired ones
 * @param rateLimiter         current rate window
 * @param pool                parallel execution slots
 * @param heapUsedMb          JVM heap in use, MB
 * @param heapTotalMb         JVM heap committed, MB
 */
@Builder
public record ServiceHealth(
    String service,
    HealthState status,
    CircuitState circuitState,
    int failureCount,
    int cacheSize,
    RateLimiterStats rateLimiter,
    PoolStats pool,
    double heapUsedMb,
    double heapTotalMb
) {

    public boolean isHealthy() {
        return status == HealthState.HEALTHY;
    }

    static HealthState statusOf(CircuitState circuitState) {
        return switch (circuitState) {
            case CLOSED -> HealthState.HEALTHY;
            case HALF_OPEN -> HealthState.DEGRADED;
            case OPEN -> HealthState.UNHEALTHY;
        };
    }
}
