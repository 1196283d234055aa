package io.storefront.toolkit.resilience.pool;

import io.storefront.toolkit.core.async.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Bounds the number of asynchronous operations in flight at once.
 * <p>
 * A non-blocking counting semaphore: {@link #acquire()} completes immediately while slots are
 * free, otherwise the acquirer joins a FIFO queue and is handed a slot by the next release.
 * Nothing ever blocks a thread waiting for a slot.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * ConcurrencyPool pool = new ConcurrencyPool(5);
 *
 * CompletableFuture<Product> one = pool.run(() -> catalog.load(id));
 * CompletableFuture<List<Product>> many = pool.runAll(List.of(
 *     () -> catalog.load("a"),
 *     () -> catalog.load("b")
 * ));
 * }</pre>
 * <p>
 * There is no timeout: an operation that never settles keeps its slot.
 */
public class ConcurrencyPool {
    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyPool.class);

    // Hand-offs queued by releases made while this thread is already handing a slot over
    private static final ThreadLocal<Queue<Runnable>> HANDOFFS = new ThreadLocal<>();

    private final int concurrency;
    private final Object lock = new Object();
    private final Queue<CompletableFuture<PoolSlot>> waiters = new ArrayDeque<>();
    private int running;

    /**
     * @param concurrency maximum operations in flight, at least 1
     */
    public ConcurrencyPool(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
        }
        this.concurrency = concurrency;
    }

    /**
     * Waits for a free slot.
     *
     * @return a future completing with a slot the caller must release
     */
    public CompletableFuture<PoolSlot> acquire() {
        synchronized (lock) {
            if (running < concurrency) {
                running++;
                return CompletableFuture.completedFuture(new PoolSlot(this));
            }
            CompletableFuture<PoolSlot> waiter = new CompletableFuture<>();
            waiters.add(waiter);
            logger.trace("Pool saturated ({}/{}), {} waiting", running, concurrency, waiters.size());
            return waiter;
        }
    }

    void releaseSlot() {
        CompletableFuture<PoolSlot> next;
        synchronized (lock) {
            next = waiters.poll();
            if (next == null) {
                running--;
                return;
            }
        }
        // Slot passes straight to the next waiter; running count is unchanged.
        handOff(() -> next.complete(new PoolSlot(this)));
    }

    /**
     * Completing a waiter runs its task on this stack, and that task may release in turn. Nested
     * hand-offs are queued and run by the outermost one, so the stack stays flat however long
     * the queue of synchronously completing tasks.
     */
    private static void handOff(Runnable completion) {
        Queue<Runnable> queued = HANDOFFS.get();
        if (queued != null) {
            queued.add(completion);
            return;
        }
        queued = new ArrayDeque<>();
        HANDOFFS.set(queued);
        try {
            Runnable next = completion;
            while (next != null) {
                next.run();
                next = queued.poll();
            }
        } finally {
            HANDOFFS.remove();
        }
    }

    /**
     * Runs one operation inside a slot. The slot is released however the operation settles,
     * including a synchronous throw or a null future from the factory.
     *
     * @param factory the operation
     * @param <T>     result type
     * @return the operation's outcome
     */
    public <T> CompletableFuture<T> run(Supplier<? extends CompletableFuture<T>> factory) {
        Objects.requireNonNull(factory, "factory cannot be null");
        return acquire().thenCompose(slot -> {
            CompletableFuture<T> result = new CompletableFuture<>();
            Futures.invoke(factory).whenComplete((value, error) -> {
                slot.release();
                if (error != null) {
                    result.completeExceptionally(Futures.unwrap(error));
                } else {
                    result.complete(value);
                }
            });
            return result;
        });
    }

    /**
     * Runs every operation through the pool.
     * <p>
     * Results are collected by input position, not completion order. The returned future fails
     * with the first failure as soon as it happens; the remaining operations keep running and
     * release their slots normally.
     *
     * @param factories the operations
     * @param <T>       result type
     * @return results in input order
     */
    public <T> CompletableFuture<List<T>> runAll(List<? extends Supplier<? extends CompletableFuture<T>>> factories) {
        Objects.requireNonNull(factories, "factories cannot be null");
        if (factories.isEmpty()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }

        int size = factories.size();
        List<T> results = new ArrayList<>(Collections.nCopies(size, null));
        AtomicInteger remaining = new AtomicInteger(size);
        CompletableFuture<List<T>> all = new CompletableFuture<>();

        for (int i = 0; i < size; i++) {
            int index = i;
            run(factories.get(i)).whenComplete((value, error) -> {
                if (error != null) {
                    all.completeExceptionally(Futures.unwrap(error));
                    return;
                }
                synchronized (results) {
                    results.set(index, value);
                }
                if (remaining.decrementAndGet() == 0) {
                    synchronized (results) {
                        all.complete(new ArrayList<>(results));
                    }
                }
            });
        }
        return all;
    }

    /**
     * Applies {@code fn} to every item with at most {@link #getConcurrency()} calls in flight.
     *
     * @param items inputs
     * @param fn    asynchronous transformation
     * @param <I>   input type
     * @param <T>   result type
     * @return results in input order
     */
    public <I, T> CompletableFuture<List<T>> map(List<I> items, Function<? super I, ? extends CompletableFuture<T>> fn) {
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(fn, "fn cannot be null");
        List<Supplier<CompletableFuture<T>>> factories = new ArrayList<>(items.size());
        for (I item : items) {
            factories.add(() -> fn.apply(item));
        }
        return runAll(factories);
    }

    public int getRunningCount() {
        synchronized (lock) {
            return running;
        }
    }

    public int getWaitingCount() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    public int getConcurrency() {
        return concurrency;
    }

    public PoolStats getStats() {
        synchronized (lock) {
            return new PoolStats(running, waiters.size(), concurrency);
        }
    }
}
