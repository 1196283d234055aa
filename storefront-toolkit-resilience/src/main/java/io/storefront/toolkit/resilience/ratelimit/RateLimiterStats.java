package io.storefront.toolkit.resilience.ratelimit;

/**
 * Snapshot of a {@link RateLimiter}'s current window.
 *
 * @param currentRequests   accepted requests still inside the window
 * @param maxRequests       window capacity
 * @param windowMs          window length
 * @param remainingRequests capacity left, never negative
 */
public record RateLimiterStats(int currentRequests, int maxRequests, long windowMs, int remainingRequests) {
}
