package io.storefront.toolkit.resilience.ratelimit;

import io.storefront.toolkit.core.config.ToolkitConfig;
import io.storefront.toolkit.core.error.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sliding-window admission control.
 * <p>
 * Keeps the timestamps of accepted requests. Before every check, timestamps at least
 * {@code window} old are purged; a request is accepted while fewer than {@code maxRequests}
 * remain. {@link #waitForSlot()} polls on the shared scheduler until a request is accepted.
 */
public class RateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    public static final int DEFAULT_MAX_REQUESTS = 100;
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private final int maxRequests;
    private final long windowMs;
    private final Duration pollInterval;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    // Guarded by this
    private final Deque<Long> accepted = new ArrayDeque<>();

    public RateLimiter(ScheduledExecutorService scheduler, Clock clock) {
        this(DEFAULT_MAX_REQUESTS, DEFAULT_WINDOW, DEFAULT_POLL_INTERVAL, scheduler, clock);
    }

    public RateLimiter(
        int maxRequests,
        Duration window,
        Duration pollInterval,
        ScheduledExecutorService scheduler,
        Clock clock
    ) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1, got: " + maxRequests);
        }
        Objects.requireNonNull(window, "window cannot be null");
        Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
        }
        this.maxRequests = maxRequests;
        this.windowMs = window.toMillis();
        this.pollInterval = pollInterval;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Builds a limiter from the {@code ratelimit.*} keys.
     */
    public static RateLimiter from(ToolkitConfig config, ScheduledExecutorService scheduler, Clock clock) {
        Objects.requireNonNull(config, "config cannot be null");
        return new RateLimiter(
            config.getInt("ratelimit.max-requests", DEFAULT_MAX_REQUESTS),
            config.getDuration("ratelimit.window-ms", DEFAULT_WINDOW),
            config.getDuration("ratelimit.poll-interval-ms", DEFAULT_POLL_INTERVAL),
            scheduler,
            clock
        );
    }

    /**
     * Admits one request if the window has room, recording it.
     *
     * @return true if accepted
     */
    public synchronized boolean checkLimit() {
        long now = clock.millis();
        purge(now);
        if (accepted.size() < maxRequests) {
            accepted.addLast(now);
            return true;
        }
        return false;
    }

    /**
     * Like {@link #checkLimit()}, for callers that prefer an exception.
     *
     * @throws RateLimitedException if the window is full
     */
    public void acquireOrThrow() {
        if (!checkLimit()) {
            throw new RateLimitedException(maxRequests, windowMs);
        }
    }

    /**
     * Completes once a request has been accepted. Polls every {@code pollInterval}; there is no
     * deadline, and the future only fails if the scheduler stops accepting tasks.
     *
     * @return a future completing when the caller has been admitted
     */
    public CompletableFuture<Void> waitForSlot() {
        CompletableFuture<Void> admitted = new CompletableFuture<>();
        poll(admitted);
        return admitted;
    }

    private void poll(CompletableFuture<Void> admitted) {
        if (checkLimit()) {
            admitted.complete(null);
            return;
        }
        logger.trace("Rate limit reached ({} per {}ms), polling again in {}ms",
            maxRequests, windowMs, pollInterval.toMillis());
        try {
            scheduler.schedule(() -> poll(admitted), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            admitted.completeExceptionally(e);
        }
    }

    public synchronized RateLimiterStats getStats() {
        purge(clock.millis());
        int current = accepted.size();
        return new RateLimiterStats(current, maxRequests, windowMs, Math.max(0, maxRequests - current));
    }

    // Caller holds the monitor
    private void purge(long now) {
        while (!accepted.isEmpty() && now - accepted.peekFirst() >= windowMs) {
            accepted.pollFirst();
        }
    }
}
