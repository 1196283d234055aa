package io.storefront.toolkit.resilience.retry;

import io.storefront.toolkit.core.time.Schedulers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryExecutorTest {

    @Mock
    private Supplier<CompletableFuture<String>> factory;

    private ScheduledExecutorService scheduler;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newScheduler("retry-test", 1);
        executor = new RetryExecutor(scheduler);
    }

    @AfterEach
    void tearDown() {
        Schedulers.shutdown(scheduler, 1000);
    }

    private static RetryPolicy fastPolicy(int attempts) {
        return RetryPolicy.builder()
            .maxAttempts(attempts)
            .baseDelay(Duration.ofMillis(10))
            .maxDelay(Duration.ofMillis(50))
            .build();
    }

    @Test
    void shouldReturnFirstSuccessWithoutRetrying() {
        when(factory.get()).thenReturn(CompletableFuture.completedFuture("ok"));

        assertThat(executor.retry(factory, fastPolicy(3)).join()).isEqualTo("ok");
        verify(factory, times(1)).get();
    }

    @Test
    void shouldRetryUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.retry(() -> attempts.incrementAndGet() < 3
            ? CompletableFuture.<String>failedFuture(new IllegalStateException("flaky"))
            : CompletableFuture.completedFuture("third time"), fastPolicy(3)).join();

        assertThat(result).isEqualTo("third time");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void shouldPropagateLastErrorWhenAttemptsExhausted() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = executor.retry(() -> CompletableFuture.failedFuture(
            new IllegalStateException("attempt " + attempts.incrementAndGet())), fastPolicy(3));

        assertThatThrownBy(result::join)
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("attempt 3");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void shouldStopWhenConditionRejectsFailure() {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = fastPolicy(5).toBuilder()
            .retryCondition(error -> !(error instanceof IllegalArgumentException))
            .build();

        CompletableFuture<String> result = executor.retry(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalArgumentException("not retryable"));
        }, policy);

        assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void shouldRetrySynchronousThrows() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.retry(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("sync");
            }
            return CompletableFuture.completedFuture("ok");
        }, fastPolicy(2)).join();

        assertThat(result).isEqualTo("ok");
    }

    @Test
    void shouldWaitWithExponentialBackoff() {
        List<Long> starts = new CopyOnWriteArrayList<>();
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(3)
            .baseDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(1))
            .build();

        executor.retry(() -> {
            starts.add(System.nanoTime());
            return CompletableFuture.<String>failedFuture(new IllegalStateException("down"));
        }, policy).exceptionally(e -> null).join();

        assertThat(starts).hasSize(3);
        long firstGap = TimeUnit.NANOSECONDS.toMillis(starts.get(1) - starts.get(0));
        long secondGap = TimeUnit.NANOSECONDS.toMillis(starts.get(2) - starts.get(1));
        assertThat(firstGap).isGreaterThanOrEqualTo(95);
        assertThat(secondGap).isGreaterThanOrEqualTo(195);
    }

    @Test
    void policyDelayShouldBeCappedAtMaxDelay() {
        RetryPolicy policy = RetryPolicy.builder()
            .baseDelay(Duration.ofMillis(1000))
            .maxDelay(Duration.ofMillis(3000))
            .build();

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(3000));
        assertThat(policy.delayAfter(10)).isEqualTo(Duration.ofMillis(3000));
    }

    @Test
    void defaultsShouldMatchDocumentedValues() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.getMaxAttempts()).isEqualTo(3);
        assertThat(policy.getBaseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.getMaxDelay()).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.getBackoffFactor()).isEqualTo(2.0);
        assertThat(policy.getRetryCondition().test(new RuntimeException())).isTrue();
    }
}
