package io.storefront.toolkit.streams.health;

import io.storefront.toolkit.core.time.ManualClock;
import io.storefront.toolkit.core.time.Schedulers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class HealthCheckStreamTest {

    private ScheduledExecutorService scheduler;
    private HealthCheckStream health;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newScheduler("health-test", 1);
        health = new HealthCheckStream(Duration.ofMillis(30), scheduler, new ManualClock());
    }

    @AfterEach
    void tearDown() {
        health.close();
        Schedulers.shutdown(scheduler, 1000);
    }

    @Test
    void shouldStartUnknown() {
        assertThat(health.current().status()).isEqualTo(HealthState.UNKNOWN);
        assertThat(health.current().checks()).isEmpty();
    }

    @Test
    void allPassingChecksShouldBeHealthy() {
        health.addHealthCheck("database", () -> CompletableFuture.completedFuture(true));
        health.addHealthCheck("cache", () -> CompletableFuture.completedFuture(true));

        HealthStatus status = health.performHealthChecks().join();

        assertThat(status.status()).isEqualTo(HealthState.HEALTHY);
        assertThat(status.checks()).containsExactly(
            Map.entry("database", true), Map.entry("cache", true));
    }

    @Test
    void failingOrThrowingCheckShouldBeUnhealthy() {
        health.addHealthCheck("database", () -> CompletableFuture.completedFuture(true));
        health.addHealthCheck("search", () -> CompletableFuture.completedFuture(false));
        health.addHealthCheck("payments", () -> {
            throw new IllegalStateException("unreachable");
        });

        HealthStatus status = health.performHealthChecks().join();

        assertThat(status.status()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(status.checks())
            .containsEntry("database", true)
            .containsEntry("search", false)
            .containsEntry("payments", false);
        assertThat(health.current()).isEqualTo(status);
    }

    @Test
    void startShouldPublishPeriodically() {
        List<HealthStatus> received = new CopyOnWriteArrayList<>();
        health.health().subscribe(received::add);
        health.addHealthCheck("database", () -> CompletableFuture.completedFuture(true));

        health.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> received.size() >= 3);
        assertThat(received.get(0).status()).isEqualTo(HealthState.UNKNOWN);
        assertThat(received.get(1).status()).isEqualTo(HealthState.HEALTHY);
    }
}
