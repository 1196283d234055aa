package io.storefront.toolkit.core.time;

import io.storefront.toolkit.core.async.Futures;
import io.storefront.toolkit.core.error.OperationTimeoutException;
import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Timer-based primitives: racing a future against a deadline and non-blocking delays.
 * <p>
 * Both run on a caller-supplied scheduler. Neither blocks a thread while waiting, and neither
 * interrupts the raced operation: a timed-out operation keeps running, its late result is ignored.
 */
@UtilityClass
public class Timeouts {

  public static final String DEFAULT_TIMEOUT_MESSAGE = "Operation timed out";

  /**
   * Races {@code future} against a timer.
   *
   * @param future    the operation's future
   * @param timeout   deadline measured from this call
   * @param scheduler timer source
   * @param <T>       result type
   * @return a future settling with the operation's outcome, or failing with
   * {@link OperationTimeoutException} once the deadline passes
   */
  public static <T> CompletableFuture<T> withTimeout(
    CompletableFuture<T> future,
    Duration timeout,
    ScheduledExecutorService scheduler
  ) {
    return withTimeout(future, timeout, scheduler, DEFAULT_TIMEOUT_MESSAGE);
  }

  public static <T> CompletableFuture<T> withTimeout(
    CompletableFuture<T> future,
    Duration timeout,
    ScheduledExecutorService scheduler,
    String message
  ) {
    Objects.requireNonNull(future, "future cannot be null");
    Objects.requireNonNull(timeout, "timeout cannot be null");
    Objects.requireNonNull(scheduler, "scheduler cannot be null");

    if (future.isDone()) {
      return relay(future, new CompletableFuture<>());
    }

    CompletableFuture<T> result = new CompletableFuture<>();
    ScheduledFuture<?> timer;
    try {
      timer = scheduler.schedule(
        () -> result.completeExceptionally(new OperationTimeoutException(message, timeout)),
        timeout.toMillis(),
        TimeUnit.MILLISECONDS
      );
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }

    future.whenComplete((value, error) -> timer.cancel(false));
    return relay(future, result);
  }

  /**
   * Completes after {@code delay} without occupying a thread.
   *
   * @param delay     how long to wait; zero or negative completes immediately
   * @param scheduler timer source
   * @return a future completing after the delay
   */
  public static CompletableFuture<Void> delay(Duration delay, ScheduledExecutorService scheduler) {
    Objects.requireNonNull(delay, "delay cannot be null");
    Objects.requireNonNull(scheduler, "scheduler cannot be null");

    if (delay.isZero() || delay.isNegative()) {
      return CompletableFuture.completedFuture(null);
    }

    CompletableFuture<Void> elapsed = new CompletableFuture<>();
    try {
      scheduler.schedule(() -> elapsed.complete(null), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      elapsed.completeExceptionally(e);
    }
    return elapsed;
  }

  private static <T> CompletableFuture<T> relay(CompletableFuture<T> source, CompletableFuture<T> target) {
    source.whenComplete((value, error) -> {
      if (error != null) {
        target.completeExceptionally(Futures.unwrap(error));
      } else {
        target.complete(value);
      }
    });
    return target;
  }
}
