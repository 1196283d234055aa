package io.storefront.toolkit.resilience.cache;

import io.storefront.toolkit.core.async.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-key memoization of asynchronous results with a time-to-live measured from write time.
 * <p>
 * Reads never return an expired value; expired entries are dropped lazily when read, or
 * eagerly by {@link #cleanup()}. Concurrent misses for the same key share one factory call.
 * A failed factory call caches nothing, so the next read tries again. A {@link #set},
 * {@link #delete} or {@link #clear} made while a load is in flight detaches that load: its
 * callers still receive its result, but the result is not stored.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * TtlCache<Product> products = new TtlCache<>(Duration.ofMinutes(5), clock);
 * products.get(CacheKeys.of("product", id), () -> catalog.load(id));
 * }</pre>
 *
 * @param <V> cached value type
 */
public class TtlCache<V> {
    private static final Logger logger = LoggerFactory.getLogger(TtlCache.class);

    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    private record Entry<V>(V value, long expiresAt) {
        boolean isExpired(long now) {
            return now > expiresAt;
        }
    }

    public TtlCache(Duration ttl, Clock clock) {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl cannot be negative, got: " + ttl);
        }
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Returns the cached value for {@code key}, or invokes {@code factory} and caches its result.
     *
     * @param key     cache key
     * @param factory produces the value on a miss
     * @return the cached or freshly produced value
     */
    public CompletableFuture<V> get(String key, Supplier<? extends CompletableFuture<V>> factory) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");

        Optional<V> cached = getIfPresent(key);
        if (cached.isPresent()) {
            logger.trace("Cache hit: {}", key);
            return CompletableFuture.completedFuture(cached.get());
        }

        CompletableFuture<V> created = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            logger.trace("Cache miss joined in-flight load: {}", key);
            return existing;
        }

        logger.trace("Cache miss: {}", key);
        Futures.invoke(factory).whenComplete((value, error) -> {
            inFlight.computeIfPresent(key, (k, current) -> {
                if (current != created) {
                    return current;
                }
                if (error == null) {
                    store(key, value);
                }
                return null;
            });
            if (error != null) {
                created.completeExceptionally(Futures.unwrap(error));
            } else {
                created.complete(value);
            }
        });
        return created;
    }

    /**
     * @return the live value for {@code key}; an expired entry is removed and reported absent
     */
    public Optional<V> getIfPresent(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.value());
    }

    public void set(String key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        // Under the key's in-flight slot: a load completing later is detached and not stored
        inFlight.compute(key, (k, load) -> {
            store(key, value);
            return null;
        });
    }

    /**
     * @return true if an entry was removed
     */
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        boolean[] removed = new boolean[1];
        inFlight.compute(key, (k, load) -> {
            removed[0] = entries.remove(key) != null;
            return null;
        });
        return removed[0];
    }

    public void clear() {
        inFlight.clear();
        entries.clear();
    }

    private void store(String key, V value) {
        entries.put(key, new Entry<>(value, clock.millis() + ttl.toMillis()));
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Map.Entry<String, Entry<V>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Cache cleanup removed {} expired entries", removed);
        }
        return removed;
    }

    /**
     * @return number of stored entries, which may include expired ones not yet cleaned up
     */
    public int size() {
        return entries.size();
    }

    public Duration getTtl() {
        return ttl;
    }
}
