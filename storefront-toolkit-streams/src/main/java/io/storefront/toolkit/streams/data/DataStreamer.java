package io.storefront.toolkit.streams.data;

import io.storefront.toolkit.core.async.Futures;
import io.storefront.toolkit.streams.channel.SnapshotChannel;
import io.storefront.toolkit.streams.channel.StreamChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Keeps a keyed snapshot of a polled data source and republishes it after every change.
 * <p>
 * Each refresh merges the fetched items into the snapshot by key, last write wins. Items are
 * never dropped because a later fetch omits them; only {@link #removeItem} removes. The
 * snapshot preserves first-insertion order of keys.
 * <p>
 * A failed refresh is logged and leaves the snapshot untouched. A refresh that is due while
 * the previous one is still running is skipped.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * DataStreamer<Product> products = new DataStreamer<>(
 *     catalog::loadAll, Duration.ofSeconds(30), Product::id, scheduler);
 * products.stream().subscribe(snapshot -> render(snapshot));
 * products.start();
 * }</pre>
 *
 * @param <T> item type
 */
public class DataStreamer<T> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DataStreamer.class);

    private final Supplier<CompletableFuture<List<T>>> fetch;
    private final Duration pollInterval;
    private final Function<? super T, String> keyExtractor;
    private final ScheduledExecutorService scheduler;

    private final SnapshotChannel<List<T>> channel = new SnapshotChannel<>("data", Collections.emptyList());
    private final AtomicBoolean refreshing = new AtomicBoolean(false);

    // Guarded by cache
    private final Map<String, T> cache = new LinkedHashMap<>();
    private ScheduledFuture<?> poller;
    private boolean destroyed;

    public DataStreamer(
        Supplier<CompletableFuture<List<T>>> fetch,
        Duration pollInterval,
        Function<? super T, String> keyExtractor,
        ScheduledExecutorService scheduler
    ) {
        this.fetch = Objects.requireNonNull(fetch, "fetch cannot be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        this.keyExtractor = Objects.requireNonNull(keyExtractor, "keyExtractor cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
        }
    }

    /**
     * Snapshot channel; new subscribers immediately receive the current snapshot.
     */
    public StreamChannel<List<T>> stream() {
        return channel;
    }

    /**
     * Starts periodic refreshes, the first one after one poll interval. Idempotent.
     */
    public void start() {
        synchronized (cache) {
            if (destroyed || poller != null) {
                return;
            }
            try {
                poller = scheduler.scheduleAtFixedRate(
                    this::refresh, pollInterval.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                throw new IllegalStateException("Scheduler rejected data streamer polling", e);
            }
        }
        logger.info("Data streamer started, polling every {}ms", pollInterval.toMillis());
    }

    /**
     * Fetches, merges and publishes once.
     *
     * @return a future completing when this refresh has been applied, skipped or logged as failed;
     * it never fails
     */
    public CompletableFuture<Void> refresh() {
        if (isDestroyed()) {
            return CompletableFuture.completedFuture(null);
        }
        if (!refreshing.compareAndSet(false, true)) {
            logger.debug("Refresh already in progress, skipping");
            return CompletableFuture.completedFuture(null);
        }

        return Futures.invoke(fetch).handle((items, error) -> {
            try {
                if (error != null) {
                    logger.warn("Failed to refresh data: {}", Futures.unwrap(error).toString());
                } else {
                    merge(items != null ? items : Collections.emptyList());
                }
            } catch (RuntimeException e) {
                logger.warn("Failed to merge refreshed data: {}", e.toString(), e);
            } finally {
                refreshing.set(false);
            }
            return null;
        });
    }

    private void merge(List<T> items) {
        synchronized (cache) {
            if (destroyed) {
                return;
            }
            for (T item : items) {
                cache.put(keyExtractor.apply(item), item);
            }
            publish();
        }
        logger.trace("Merged {} items, snapshot size {}", items.size(), getCacheSize());
    }

    public void addItem(T item) {
        Objects.requireNonNull(item, "item cannot be null");
        synchronized (cache) {
            cache.put(keyExtractor.apply(item), item);
            publish();
        }
    }

    /**
     * Replaces the item stored under {@code key} with {@code updater}'s result. Does nothing,
     * and publishes nothing, when the key is absent.
     */
    public void updateItem(String key, UnaryOperator<T> updater) {
        Objects.requireNonNull(updater, "updater cannot be null");
        synchronized (cache) {
            T existing = cache.get(key);
            if (existing == null) {
                return;
            }
            cache.put(key, updater.apply(existing));
            publish();
        }
    }

    public void removeItem(String key) {
        synchronized (cache) {
            cache.remove(key);
            publish();
        }
    }

    // Caller holds the cache monitor
    private void publish() {
        if (!destroyed) {
            channel.emit(Collections.unmodifiableList(new ArrayList<>(cache.values())));
        }
    }

    /**
     * @return the most recently published snapshot
     */
    public List<T> currentData() {
        return channel.current();
    }

    /**
     * @return the current key to item mapping, in insertion order
     */
    public Map<String, T> snapshot() {
        synchronized (cache) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(cache));
        }
    }

    public int getCacheSize() {
        synchronized (cache) {
            return cache.size();
        }
    }

    public boolean isRunning() {
        synchronized (cache) {
            return poller != null;
        }
    }

    /**
     * Stops polling; the snapshot and its channel stay usable. {@link #start()} may be called again.
     */
    public void stop() {
        synchronized (cache) {
            if (poller != null) {
                poller.cancel(false);
                poller = null;
                logger.info("Data streamer stopped");
            }
        }
    }

    /**
     * Stops polling and completes the channel. Nothing is published afterwards.
     */
    public void destroy() {
        synchronized (cache) {
            stop();
            destroyed = true;
        }
        channel.complete();
    }

    private boolean isDestroyed() {
        synchronized (cache) {
            return destroyed;
        }
    }

    @Override
    public void close() {
        destroy();
    }
}
