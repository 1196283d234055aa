package io.storefront.toolkit.resilience.batch;

import io.storefront.toolkit.core.async.Futures;
import io.storefront.toolkit.resilience.pool.ConcurrencyPool;
import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Collection-level helpers over asynchronous processors.
 *
 * <pre>{@code
 * // 10 at a time, batch after batch
 * Batches.batchProcess(orderIds, orders::load, 10);
 *
 * // one after another
 * Batches.sequential(steps, (step, index) -> step.apply());
 * }</pre>
 */
@UtilityClass
public class Batches {

    public static final int DEFAULT_BATCH_SIZE = 10;

    /**
     * Processes items in consecutive batches: every item of a batch starts together, and the next
     * batch starts once the whole batch has succeeded. The first failure stops processing.
     *
     * @return results in input order
     */
    public static <I, R> CompletableFuture<List<R>> batchProcess(
        List<I> items,
        Function<? super I, ? extends CompletableFuture<R>> processor,
        int batchSize
    ) {
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(processor, "processor cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
        }

        CompletableFuture<List<R>> chain = CompletableFuture.completedFuture(new ArrayList<>(items.size()));
        for (List<I> batch : chunk(items, batchSize)) {
            chain = chain.thenCompose(results -> {
                List<CompletableFuture<R>> started = new ArrayList<>(batch.size());
                for (I item : batch) {
                    started.add(Futures.invoke(() -> processor.apply(item)));
                }
                return CompletableFuture.allOf(started.toArray(new CompletableFuture<?>[0]))
                    .thenApply(ignored -> {
                        started.forEach(future -> results.add(future.join()));
                        return results;
                    });
            });
        }
        return unwrapped(chain);
    }

    /**
     * Processes items strictly one at a time, in order. The first failure stops processing.
     *
     * @param processor receives each item and its index
     * @return results in input order
     */
    public static <I, R> CompletableFuture<List<R>> sequential(
        List<I> items,
        BiFunction<? super I, Integer, ? extends CompletableFuture<R>> processor
    ) {
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(processor, "processor cannot be null");

        CompletableFuture<List<R>> chain = CompletableFuture.completedFuture(new ArrayList<>(items.size()));
        for (int i = 0; i < items.size(); i++) {
            I item = items.get(i);
            int index = i;
            chain = chain.thenCompose(results ->
                Futures.invoke(() -> processor.apply(item, index)).thenApply(result -> {
                    results.add(result);
                    return results;
                }));
        }
        return unwrapped(chain);
    }

    /**
     * Splits a list into consecutive sublists of {@code size} (the last may be shorter).
     */
    public static <T> List<List<T>> chunk(List<T> list, int size) {
        Objects.requireNonNull(list, "list cannot be null");
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1, got: " + size);
        }
        List<List<T>> chunks = new ArrayList<>((list.size() + size - 1) / size);
        for (int i = 0; i < list.size(); i += size) {
            chunks.add(List.copyOf(list.subList(i, Math.min(i + size, list.size()))));
        }
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Keeps the first element for every distinct key, preserving order.
     */
    public static <T, K> List<T> uniqueBy(List<T> list, Function<? super T, ? extends K> keyFn) {
        Objects.requireNonNull(list, "list cannot be null");
        Objects.requireNonNull(keyFn, "keyFn cannot be null");
        Set<K> seen = new HashSet<>();
        List<T> unique = new ArrayList<>();
        for (T element : list) {
            if (seen.add(keyFn.apply(element))) {
                unique.add(element);
            }
        }
        return unique;
    }

    /**
     * Wraps {@code fn} so that at most {@code limit} calls are in flight; extra calls queue in
     * arrival order.
     */
    public static <I, R> Function<I, CompletableFuture<R>> throttle(
        Function<? super I, ? extends CompletableFuture<R>> fn,
        int limit
    ) {
        Objects.requireNonNull(fn, "fn cannot be null");
        ConcurrencyPool pool = new ConcurrencyPool(limit);
        return input -> pool.run(() -> fn.apply(input));
    }

    /**
     * Wraps {@code fn} so that a burst of calls closer together than {@code delay} results in one
     * invocation, with the last call's input, once the burst has been quiet for {@code delay}.
     * Every call of the burst completes with that invocation's outcome.
     */
    public static <I, R> Function<I, CompletableFuture<R>> debounce(
        Function<? super I, ? extends CompletableFuture<R>> fn,
        Duration delay,
        ScheduledExecutorService scheduler
    ) {
        Objects.requireNonNull(fn, "fn cannot be null");
        Objects.requireNonNull(delay, "delay cannot be null");
        Objects.requireNonNull(scheduler, "scheduler cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be negative, got: " + delay);
        }
        Debouncer<I, R> debouncer = new Debouncer<>(fn, delay, scheduler);
        return debouncer::call;
    }

    private static <T> CompletableFuture<T> unwrapped(CompletableFuture<T> future) {
        CompletableFuture<T> result = new CompletableFuture<>();
        future.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(Futures.unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    private static final class Debouncer<I, R> {
        private final Function<? super I, ? extends CompletableFuture<R>> fn;
        private final Duration delay;
        private final ScheduledExecutorService scheduler;

        // Guarded by this
        private ScheduledFuture<?> timer;
        private I latest;
        private List<CompletableFuture<R>> burst = new ArrayList<>();

        Debouncer(Function<? super I, ? extends CompletableFuture<R>> fn, Duration delay, ScheduledExecutorService scheduler) {
            this.fn = fn;
            this.delay = delay;
            this.scheduler = scheduler;
        }

        synchronized CompletableFuture<R> call(I input) {
            CompletableFuture<R> result = new CompletableFuture<>();
            if (timer != null) {
                timer.cancel(false);
            }
            latest = input;
            burst.add(result);
            try {
                timer = scheduler.schedule(this::fire, delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                List<CompletableFuture<R>> stranded = burst;
                burst = new ArrayList<>();
                timer = null;
                stranded.forEach(waiter -> waiter.completeExceptionally(e));
            }
            return result;
        }

        private void fire() {
            I input;
            List<CompletableFuture<R>> waiters;
            synchronized (this) {
                input = latest;
                waiters = burst;
                latest = null;
                burst = new ArrayList<>();
                timer = null;
            }
            // A timer cancelled too late finds the burst already taken
            if (waiters.isEmpty()) {
                return;
            }
            Futures.invoke(() -> fn.apply(input)).whenComplete((value, error) -> {
                for (CompletableFuture<R> waiter : waiters) {
                    if (error != null) {
                        waiter.completeExceptionally(Futures.unwrap(error));
                    } else {
                        waiter.complete(value);
                    }
                }
            });
        }
    }
}
