package io.storefront.toolkit.resilience.breaker;

import io.storefront.toolkit.core.config.ToolkitConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Circuit breaker tuning.
 *
 * @param threshold    consecutive failures (in CLOSED) that open the circuit
 * @param callTimeout  per-call deadline; a timeout counts as a failure
 * @param resetTimeout time OPEN must last before a trial call is admitted
 */
public record CircuitBreakerConfig(int threshold, Duration callTimeout, Duration resetTimeout) {

    public static final int DEFAULT_THRESHOLD = 5;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(30);

    public CircuitBreakerConfig {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1, got: " + threshold);
        }
        Objects.requireNonNull(callTimeout, "callTimeout cannot be null");
        Objects.requireNonNull(resetTimeout, "resetTimeout cannot be null");
        if (callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be positive, got: " + callTimeout);
        }
        if (resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout cannot be negative, got: " + resetTimeout);
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_THRESHOLD, DEFAULT_CALL_TIMEOUT, DEFAULT_RESET_TIMEOUT);
    }

    /**
     * Reads {@code breaker.threshold}, {@code breaker.call-timeout-ms} and
     * {@code breaker.reset-timeout-ms}, falling back to the defaults.
     */
    public static CircuitBreakerConfig from(ToolkitConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return new CircuitBreakerConfig(
            config.getInt("breaker.threshold", DEFAULT_THRESHOLD),
            config.getDuration("breaker.call-timeout-ms", DEFAULT_CALL_TIMEOUT),
            config.getDuration("breaker.reset-timeout-ms", DEFAULT_RESET_TIMEOUT)
        );
    }
}
