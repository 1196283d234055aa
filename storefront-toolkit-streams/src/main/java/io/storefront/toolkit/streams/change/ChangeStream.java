package io.storefront.toolkit.streams.change;

import io.storefront.toolkit.core.async.Futures;
import io.storefront.toolkit.streams.channel.StreamChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Polls a change feed and emits every change individually, in the order the feed returned them.
 * Poll failures are logged and polling continues.
 *
 * @param <T> change type
 */
public class ChangeStream<T> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ChangeStream.class);

    private final Supplier<CompletableFuture<List<T>>> fetchChanges;
    private final Duration pollInterval;
    private final ScheduledExecutorService scheduler;
    private final StreamChannel<T> changes = new StreamChannel<>("changes");
    private final AtomicBoolean polling = new AtomicBoolean(false);

    // Guarded by this
    private ScheduledFuture<?> poller;

    public ChangeStream(
        Supplier<CompletableFuture<List<T>>> fetchChanges,
        Duration pollInterval,
        ScheduledExecutorService scheduler
    ) {
        this.fetchChanges = Objects.requireNonNull(fetchChanges, "fetchChanges cannot be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
        }
    }

    public StreamChannel<T> changes() {
        return changes;
    }

    public synchronized void start() {
        if (poller != null || changes.isCompleted()) {
            return;
        }
        try {
            poller = scheduler.scheduleAtFixedRate(
                this::poll, pollInterval.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Scheduler rejected change stream polling", e);
        }
        logger.info("Change stream started, polling every {}ms", pollInterval.toMillis());
    }

    /**
     * Fetches once and emits the changes. Skipped while a previous poll is still running.
     *
     * @return a future completing when the poll is done; it never fails
     */
    public CompletableFuture<Void> poll() {
        if (!polling.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        return Futures.invoke(fetchChanges).handle((found, error) -> {
            try {
                if (error != null) {
                    logger.error("Change stream error: {}", Futures.unwrap(error).toString());
                } else if (found != null) {
                    found.forEach(changes::emit);
                }
            } finally {
                polling.set(false);
            }
            return null;
        });
    }

    public synchronized boolean isRunning() {
        return poller != null;
    }

    public synchronized void stop() {
        if (poller != null) {
            poller.cancel(false);
            poller = null;
            logger.info("Change stream stopped");
        }
    }

    public void destroy() {
        stop();
        changes.complete();
    }

    @Override
    public void close() {
        destroy();
    }
}
