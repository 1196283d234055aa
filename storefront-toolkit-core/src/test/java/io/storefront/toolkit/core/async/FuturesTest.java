package io.storefront.toolkit.core.async;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FuturesTest {

    @Test
    void invokeShouldConvertSynchronousThrowIntoFailedFuture() {
        CompletableFuture<String> future = Futures.invoke(() -> {
            throw new IllegalArgumentException("bad input");
        });

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invokeShouldRejectNullFuture() {
        CompletableFuture<String> future = Futures.invoke(() -> null);

        assertThatThrownBy(future::join).hasCauseInstanceOf(NullPointerException.class);
    }

    @Test
    void unwrapShouldStripNestedWrappers() {
        IllegalStateException root = new IllegalStateException("root");
        Throwable wrapped = new CompletionException(new ExecutionException(root));

        assertThat(Futures.unwrap(wrapped)).isSameAs(root);
        assertThat(Futures.unwrap(root)).isSameAs(root);
    }

    @Test
    void allSettledShouldReportEveryOutcomeInOrder() {
        CompletableFuture<Integer> ok = CompletableFuture.completedFuture(1);
        CompletableFuture<Integer> failed = CompletableFuture.failedFuture(new IllegalStateException("nope"));
        CompletableFuture<Integer> late = new CompletableFuture<>();

        CompletableFuture<List<Settled<Integer>>> settled = Futures.allSettled(List.of(ok, failed, late));
        assertThat(settled).isNotDone();
        late.complete(3);

        List<Settled<Integer>> outcomes = settled.join();
        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).value()).isEqualTo(1);
        assertThat(outcomes.get(1).isRejected()).isTrue();
        assertThat(outcomes.get(1).error()).isInstanceOf(IllegalStateException.class);
        assertThat(outcomes.get(2).isFulfilled()).isTrue();
        assertThat(outcomes.get(2).value()).isEqualTo(3);
    }
}
