package io.storefront.toolkit.resilience.breaker;

/**
 * Circuit breaker states.
 * <ul>
 *   <li><b>CLOSED</b>: calls pass through, failures are counted</li>
 *   <li><b>OPEN</b>: calls fail fast until the reset timeout elapses</li>
 *   <li><b>HALF_OPEN</b>: one trial call decides between CLOSED and OPEN</li>
 * </ul>
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
