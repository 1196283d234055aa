package io.storefront.toolkit.resilience.pool;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyPoolTest {

    // =========================================================================
    // Construction and slots
    // =========================================================================

    @Test
    void shouldRejectConcurrencyBelowOne() {
        assertThatThrownBy(() -> new ConcurrencyPool(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldQueueAcquirersBeyondConcurrency() {
        ConcurrencyPool pool = new ConcurrencyPool(2);

        CompletableFuture<PoolSlot> first = pool.acquire();
        CompletableFuture<PoolSlot> second = pool.acquire();
        CompletableFuture<PoolSlot> third = pool.acquire();

        assertThat(first).isCompleted();
        assertThat(second).isCompleted();
        assertThat(third).isNotDone();
        assertThat(pool.getStats()).isEqualTo(new PoolStats(2, 1, 2));

        first.join().release();

        assertThat(third).isCompleted();
        assertThat(pool.getRunningCount()).isEqualTo(2);
        assertThat(pool.getWaitingCount()).isZero();
    }

    @Test
    void shouldServeWaitersInArrivalOrder() {
        ConcurrencyPool pool = new ConcurrencyPool(1);
        PoolSlot held = pool.acquire().join();
        List<String> served = new ArrayList<>();

        pool.acquire().thenAccept(slot -> served.add("a"));
        pool.acquire().thenAccept(slot -> served.add("b"));
        held.release();

        assertThat(served).containsExactly("a");
    }

    @Test
    void releaseShouldBeIdempotent() {
        ConcurrencyPool pool = new ConcurrencyPool(1);
        PoolSlot slot = pool.acquire().join();

        slot.release();
        slot.close();

        assertThat(slot.isReleased()).isTrue();
        assertThat(pool.getRunningCount()).isZero();
    }

    // =========================================================================
    // run / runAll / map
    // =========================================================================

    @Test
    void shouldNeverExceedConcurrencyAndPreserveOrder() {
        ConcurrencyPool pool = new ConcurrencyPool(2);
        List<CompletableFuture<Integer>> pending = new ArrayList<>();
        AtomicInteger started = new AtomicInteger();
        List<Supplier<CompletableFuture<Integer>>> factories = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            factories.add(() -> {
                started.incrementAndGet();
                CompletableFuture<Integer> future = new CompletableFuture<>();
                pending.add(future);
                return future;
            });
        }

        CompletableFuture<List<Integer>> all = pool.runAll(factories);
        assertThat(started).hasValue(2);

        // Complete out of order: later tasks first once they start.
        pending.get(1).complete(20);
        assertThat(started).hasValue(3);
        assertThat(pool.getRunningCount()).isLessThanOrEqualTo(2);
        pending.get(2).complete(30);
        pending.get(0).complete(10);
        assertThat(started).hasValue(5);
        pending.get(4).complete(50);
        pending.get(3).complete(40);

        assertThat(all.join()).containsExactly(10, 20, 30, 40, 50);
        assertThat(pool.getRunningCount()).isZero();
    }

    @Test
    void shouldReleaseSlotWhenFactoryThrowsSynchronously() {
        ConcurrencyPool pool = new ConcurrencyPool(1);

        CompletableFuture<String> failed = pool.run(() -> {
            throw new IllegalStateException("sync failure");
        });

        assertThatThrownBy(failed::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(pool.getRunningCount()).isZero();
        assertThat(pool.run(() -> CompletableFuture.completedFuture("next")).join()).isEqualTo("next");
    }

    @Test
    void runAllShouldFailFastWithFirstFailure() {
        ConcurrencyPool pool = new ConcurrencyPool(3);
        CompletableFuture<String> slow = new CompletableFuture<>();

        CompletableFuture<List<String>> all = pool.runAll(List.of(
            () -> slow,
            () -> CompletableFuture.failedFuture(new IllegalArgumentException("bad")),
            () -> CompletableFuture.completedFuture("ok")
        ));

        assertThatThrownBy(all::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(pool.getRunningCount()).isEqualTo(1);

        slow.complete("late");
        assertThat(pool.getRunningCount()).isZero();
    }

    @Test
    void runAllOfNothingIsEmpty() {
        assertThat(new ConcurrencyPool(1).<String>runAll(List.of()).join()).isEmpty();
    }

    @Test
    void mapShouldApplyFunctionInInputOrder() {
        ConcurrencyPool pool = new ConcurrencyPool(2);

        List<Integer> lengths = pool.map(List.of("a", "bb", "ccc"),
            s -> CompletableFuture.completedFuture(s.length())).join();

        assertThat(lengths).containsExactly(1, 2, 3);
    }

    @Test
    void deepQueueOfSynchronousTasksShouldDrainAfterGateReleases() throws Exception {
        ConcurrencyPool pool = new ConcurrencyPool(1);
        CompletableFuture<Integer> gate = new CompletableFuture<>();
        List<Supplier<CompletableFuture<Integer>>> factories = new ArrayList<>();
        factories.add(() -> gate);
        for (int i = 1; i < 50_000; i++) {
            int value = i;
            factories.add(() -> CompletableFuture.completedFuture(value));
        }

        CompletableFuture<List<Integer>> all = pool.runAll(factories);
        assertThat(pool.getWaitingCount()).isEqualTo(49_999);

        gate.complete(0);

        List<Integer> results = all.get(5, TimeUnit.SECONDS);
        assertThat(results).hasSize(50_000);
        assertThat(results.get(49_999)).isEqualTo(49_999);
        assertThat(pool.getStats()).isEqualTo(new PoolStats(0, 0, 1));
    }
}
