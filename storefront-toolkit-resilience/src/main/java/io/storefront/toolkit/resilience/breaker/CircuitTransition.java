package io.storefront.toolkit.resilience.breaker;

import java.time.Instant;

/**
 * A state change of a named breaker.
 *
 * @param breakerName breaker that changed
 * @param from        previous state
 * @param to          new state
 * @param timestamp   when the change happened, per the breaker's clock
 */
public record CircuitTransition(String breakerName, CircuitState from, CircuitState to, Instant timestamp) {
}
