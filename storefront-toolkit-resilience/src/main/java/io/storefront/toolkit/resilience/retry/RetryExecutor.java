package io.storefront.toolkit.resilience.retry;

import io.storefront.toolkit.core.async.Futures;
import io.storefront.toolkit.core.time.Timeouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Re-invokes a failing operation with exponential backoff.
 * <p>
 * Waits between attempts are timer continuations on the shared scheduler; no thread sleeps.
 * When attempts run out, or the policy's retry condition rejects a failure, that failure
 * propagates unchanged: there is no dedicated "retries exhausted" type.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * RetryExecutor retries = new RetryExecutor(scheduler);
 * retries.retry(() -> payments.capture(order), RetryPolicy.builder().maxAttempts(5).build());
 * }</pre>
 */
public class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final ScheduledExecutorService scheduler;
    private final RetryPolicy defaultPolicy;

    public RetryExecutor(ScheduledExecutorService scheduler) {
        this(scheduler, RetryPolicy.defaults());
    }

    public RetryExecutor(ScheduledExecutorService scheduler, RetryPolicy defaultPolicy) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy cannot be null");
    }

    public <T> CompletableFuture<T> retry(Supplier<? extends CompletableFuture<T>> factory) {
        return retry(factory, defaultPolicy);
    }

    /**
     * @param factory operation to attempt; invoked afresh for every attempt
     * @param policy  attempts, delays and retry condition
     * @param <T>     result type
     * @return the first successful result, or the last failure
     */
    public <T> CompletableFuture<T> retry(Supplier<? extends CompletableFuture<T>> factory, RetryPolicy policy) {
        Objects.requireNonNull(factory, "factory cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");
        if (policy.getMaxAttempts() < 1) {
            return CompletableFuture.failedFuture(
                new IllegalArgumentException("maxAttempts must be >= 1, got: " + policy.getMaxAttempts()));
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(factory, policy, 1, result);
        return result;
    }

    private <T> void attempt(
        Supplier<? extends CompletableFuture<T>> factory,
        RetryPolicy policy,
        int attempt,
        CompletableFuture<T> result
    ) {
        Futures.invoke(factory).whenComplete((value, error) -> {
            if (error == null) {
                if (attempt > 1) {
                    logger.debug("Succeeded on attempt {}/{}", attempt, policy.getMaxAttempts());
                }
                result.complete(value);
                return;
            }

            Throwable cause = Futures.unwrap(error);
            if (attempt >= policy.getMaxAttempts()) {
                logger.debug("Giving up after {} attempt(s): {}", attempt, cause.toString());
                result.completeExceptionally(cause);
                return;
            }
            if (!shouldRetry(policy, cause)) {
                logger.debug("Failure not retryable on attempt {}: {}", attempt, cause.toString());
                result.completeExceptionally(cause);
                return;
            }

            Duration delay = policy.delayAfter(attempt);
            logger.debug("Attempt {}/{} failed ({}), retrying in {}ms",
                attempt, policy.getMaxAttempts(), cause.getMessage(), delay.toMillis());

            Timeouts.delay(delay, scheduler).whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    // Scheduler gone; report the operation's failure, not the scheduler's
                    cause.addSuppressed(delayError);
                    result.completeExceptionally(cause);
                } else {
                    attempt(factory, policy, attempt + 1, result);
                }
            });
        });
    }

    private static boolean shouldRetry(RetryPolicy policy, Throwable cause) {
        try {
            return policy.getRetryCondition().test(cause);
        } catch (RuntimeException e) {
            logger.warn("Retry condition threw, treating failure as not retryable", e);
            return false;
        }
    }
}
