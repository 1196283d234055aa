package io.storefront.toolkit.streams.search;

import io.storefront.toolkit.core.async.Futures;
import io.storefront.toolkit.streams.channel.SnapshotChannel;
import io.storefront.toolkit.streams.channel.StreamChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Debounced search-as-you-type pipeline.
 * <p>
 * Queries pass through these stages in order:
 * <ol>
 *   <li>debounce: a query is only considered once no newer query arrived for {@code debounce}</li>
 *   <li>distinct: a debounced query equal to the previous debounced query is ignored</li>
 *   <li>length filter: queries shorter than {@code minQueryLength} are dropped</li>
 *   <li>dispatch: loading becomes true and the search function is called</li>
 * </ol>
 * A newer dispatch supersedes every older one still in flight: their results are discarded and
 * never reach {@link #results()}. A failed search is logged and publishes an empty list.
 * Loading returns to false once the latest dispatched search settles.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * SearchStream<Product> search = new SearchStream<>(catalog::search, Duration.ofMillis(300), 2, scheduler);
 * search.results().subscribe(this::showResults);
 * search.loading().subscribe(this::showSpinner);
 * search.search("lap");
 * }</pre>
 *
 * @param <T> result item type
 */
public class SearchStream<T> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SearchStream.class);

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(300);
    public static final int DEFAULT_MIN_QUERY_LENGTH = 2;

    private final Function<String, CompletableFuture<List<T>>> searchFunction;
    private final Duration debounce;
    private final int minQueryLength;
    private final ScheduledExecutorService scheduler;

    private final SnapshotChannel<List<T>> results = new SnapshotChannel<>("search-results", Collections.emptyList());
    private final SnapshotChannel<Boolean> loading = new SnapshotChannel<>("search-loading", Boolean.FALSE);

    // Guarded by this
    private ScheduledFuture<?> pending;
    private String lastDebounced;
    private long generation;
    private boolean closed;

    public SearchStream(Function<String, CompletableFuture<List<T>>> searchFunction, ScheduledExecutorService scheduler) {
        this(searchFunction, DEFAULT_DEBOUNCE, DEFAULT_MIN_QUERY_LENGTH, scheduler);
    }

    public SearchStream(
        Function<String, CompletableFuture<List<T>>> searchFunction,
        Duration debounce,
        int minQueryLength,
        ScheduledExecutorService scheduler
    ) {
        this.searchFunction = Objects.requireNonNull(searchFunction, "searchFunction cannot be null");
        this.debounce = Objects.requireNonNull(debounce, "debounce cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("debounce cannot be negative, got: " + debounce);
        }
        if (minQueryLength < 0) {
            throw new IllegalArgumentException("minQueryLength cannot be negative, got: " + minQueryLength);
        }
        this.minQueryLength = minQueryLength;
    }

    /**
     * Submits a query. Restarts the debounce timer; the query is only considered if no newer one
     * arrives before it fires.
     */
    public synchronized void search(String query) {
        Objects.requireNonNull(query, "query cannot be null");
        if (closed) {
            return;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        try {
            pending = scheduler.schedule(() -> onDebounced(query), debounce.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("Scheduler rejected search for '{}'", query, e);
            pending = null;
        }
    }

    private void onDebounced(String query) {
        long dispatched;
        synchronized (this) {
            if (closed || query.equals(lastDebounced)) {
                return;
            }
            lastDebounced = query;
            if (query.length() < minQueryLength) {
                logger.trace("Ignoring short query '{}'", query);
                return;
            }
            dispatched = ++generation;
            loading.emit(Boolean.TRUE);
        }

        logger.debug("Dispatching search #{} for '{}'", dispatched, query);
        Futures.invoke(() -> searchFunction.apply(query)).whenComplete((found, error) -> {
            synchronized (this) {
                if (closed || dispatched != generation) {
                    logger.trace("Discarding superseded search #{} for '{}'", dispatched, query);
                    return;
                }
                if (error != null) {
                    logger.error("Search error for '{}': {}", query, Futures.unwrap(error).toString());
                    results.emit(Collections.emptyList());
                } else {
                    results.emit(found != null ? found : Collections.emptyList());
                }
                loading.emit(Boolean.FALSE);
            }
        });
    }

    /**
     * Latest results; new subscribers receive the current list first (initially empty).
     */
    public StreamChannel<List<T>> results() {
        return results;
    }

    /**
     * Loading flag; new subscribers receive the current flag first (initially false).
     */
    public StreamChannel<Boolean> loading() {
        return loading;
    }

    public List<T> currentResults() {
        return results.current();
    }

    public boolean isLoading() {
        return Boolean.TRUE.equals(loading.current());
    }

    /**
     * Cancels any pending query, discards in-flight results and completes both channels.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        results.complete();
        loading.complete();
    }
}
