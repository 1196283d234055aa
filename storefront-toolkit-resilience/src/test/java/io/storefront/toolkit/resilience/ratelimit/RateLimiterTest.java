package io.storefront.toolkit.resilience.ratelimit;

import io.storefront.toolkit.core.error.RateLimitedException;
import io.storefront.toolkit.core.time.ManualClock;
import io.storefront.toolkit.core.time.Schedulers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class RateLimiterTest {

    private ScheduledExecutorService scheduler;
    private ManualClock clock;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newScheduler("ratelimit-test", 1);
        clock = new ManualClock();
        limiter = new RateLimiter(2, Duration.ofMillis(1000), Duration.ofMillis(10), scheduler, clock);
    }

    @AfterEach
    void tearDown() {
        Schedulers.shutdown(scheduler, 1000);
    }

    @Test
    void shouldAcceptUpToMaxRequestsPerWindow() {
        assertThat(limiter.checkLimit()).isTrue();
        assertThat(limiter.checkLimit()).isTrue();
        assertThat(limiter.checkLimit()).isFalse();
    }

    @Test
    void shouldAdmitAgainOnceOldestEntryLeavesWindow() {
        limiter.checkLimit();
        clock.advance(Duration.ofMillis(500));
        limiter.checkLimit();

        clock.advance(Duration.ofMillis(499));
        assertThat(limiter.checkLimit()).isFalse();

        clock.advance(Duration.ofMillis(1));
        assertThat(limiter.checkLimit()).isTrue();
        assertThat(limiter.checkLimit()).isFalse();
    }

    @Test
    void rejectedChecksShouldNotConsumeCapacity() {
        limiter.checkLimit();
        limiter.checkLimit();
        limiter.checkLimit();

        assertThat(limiter.getStats()).isEqualTo(new RateLimiterStats(2, 2, 1000, 0));
    }

    @Test
    void statsShouldReflectPurgedWindow() {
        limiter.checkLimit();
        clock.advance(Duration.ofMillis(1000));

        assertThat(limiter.getStats().currentRequests()).isZero();
        assertThat(limiter.getStats().remainingRequests()).isEqualTo(2);
    }

    @Test
    void acquireOrThrowShouldRaiseWhenFull() {
        limiter.acquireOrThrow();
        limiter.acquireOrThrow();

        assertThatThrownBy(limiter::acquireOrThrow)
            .isInstanceOf(RateLimitedException.class)
            .hasMessageContaining("2 requests per 1000ms");
    }

    @Test
    void waitForSlotShouldCompleteImmediatelyWhenCapacityAvailable() {
        assertThat(limiter.waitForSlot()).isCompleted();
    }

    @Test
    void waitForSlotShouldPollUntilWindowFrees() {
        limiter.checkLimit();
        limiter.checkLimit();

        CompletableFuture<Void> waiting = limiter.waitForSlot();
        assertThat(waiting).isNotDone();

        clock.advance(Duration.ofMillis(1000));

        await().atMost(Duration.ofSeconds(2)).until(waiting::isDone);
        assertThat(waiting).isCompleted();
        assertThat(limiter.getStats().currentRequests()).isEqualTo(1);
    }
}
