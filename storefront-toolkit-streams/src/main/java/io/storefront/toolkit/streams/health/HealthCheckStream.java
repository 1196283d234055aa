package io.storefront.toolkit.streams.health;

import io.storefront.toolkit.core.async.Futures;
import io.storefront.toolkit.core.async.Settled;
import io.storefront.toolkit.streams.channel.SnapshotChannel;
import io.storefront.toolkit.streams.channel.StreamChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs named asynchronous checks on a timer and publishes the combined {@link HealthStatus}.
 * <p>
 * The status is HEALTHY when every check reports true, UNHEALTHY when any check reports false
 * or fails. Until the first round completes it is UNKNOWN.
 *
 * <pre>{@code
 * HealthCheckStream health = new HealthCheckStream(Duration.ofSeconds(30), scheduler, clock);
 * health.addHealthCheck("database", () -> db.ping());
 * health.health().subscribe(status -> log.info("health: {}", status.status()));
 * health.start();
 * }</pre>
 */
public class HealthCheckStream implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HealthCheckStream.class);

    private final Duration checkInterval;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final SnapshotChannel<HealthStatus> health;
    private final Map<String, Supplier<CompletableFuture<Boolean>>> checks = new LinkedHashMap<>();

    // Guarded by checks
    private ScheduledFuture<?> poller;

    public HealthCheckStream(Duration checkInterval, ScheduledExecutorService scheduler, Clock clock) {
        this.checkInterval = Objects.requireNonNull(checkInterval, "checkInterval cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        if (checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalArgumentException("checkInterval must be positive, got: " + checkInterval);
        }
        this.health = new SnapshotChannel<>("health", HealthStatus.unknown(clock.instant()));
    }

    /**
     * Health snapshots; new subscribers receive the latest status first.
     */
    public StreamChannel<HealthStatus> health() {
        return health;
    }

    public HealthStatus current() {
        return health.current();
    }

    /**
     * Registers (or replaces) a named check.
     */
    public void addHealthCheck(String name, Supplier<CompletableFuture<Boolean>> check) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(check, "check cannot be null");
        synchronized (checks) {
            checks.put(name, check);
        }
    }

    public void removeHealthCheck(String name) {
        synchronized (checks) {
            checks.remove(name);
        }
    }

    public void start() {
        synchronized (checks) {
            if (poller != null) {
                return;
            }
            try {
                poller = scheduler.scheduleAtFixedRate(this::performHealthChecks,
                    checkInterval.toMillis(), checkInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                throw new IllegalStateException("Scheduler rejected health checks", e);
            }
        }
        logger.info("Health checks started, every {}ms", checkInterval.toMillis());
    }

    /**
     * Runs every registered check concurrently and publishes the result.
     *
     * @return the published status; never fails
     */
    public CompletableFuture<HealthStatus> performHealthChecks() {
        List<String> names;
        List<CompletableFuture<Boolean>> running = new ArrayList<>();
        synchronized (checks) {
            names = new ArrayList<>(checks.keySet());
            for (Supplier<CompletableFuture<Boolean>> check : checks.values()) {
                running.add(Futures.invoke(check));
            }
        }

        return Futures.allSettled(running).thenApply(outcomes -> {
            Map<String, Boolean> results = new LinkedHashMap<>();
            HealthState overall = HealthState.HEALTHY;
            for (int i = 0; i < names.size(); i++) {
                Settled<Boolean> outcome = outcomes.get(i);
                boolean passed = outcome.isFulfilled() && Boolean.TRUE.equals(outcome.value());
                if (outcome.isRejected()) {
                    logger.warn("Health check '{}' failed: {}", names.get(i), outcome.error().toString());
                }
                results.put(names.get(i), passed);
                if (!passed) {
                    overall = HealthState.UNHEALTHY;
                }
            }
            HealthStatus status = new HealthStatus(overall, clock.instant(), results);
            health.emit(status);
            logger.debug("Health: {} {}", overall, results);
            return status;
        });
    }

    public void stop() {
        synchronized (checks) {
            if (poller != null) {
                poller.cancel(false);
                poller = null;
                logger.info("Health checks stopped");
            }
        }
    }

    @Override
    public void close() {
        stop();
        health.complete();
    }
}
