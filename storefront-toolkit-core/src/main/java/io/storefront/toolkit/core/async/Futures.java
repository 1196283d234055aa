package io.storefront.toolkit.core.async;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helpers for working with {@link CompletableFuture}-returning task factories.
 * <p>
 * Every component of the toolkit accepts a zero-argument factory
 * {@code Supplier<CompletableFuture<T>>} for the operation it wraps. {@link #invoke(Supplier)}
 * normalises the ways such a factory can misbehave so that callers only ever see a future.
 *
 * <h3>Example Usage:</h3>
 * <pre>{@code
 * CompletableFuture<Product> product = Futures.invoke(() -> catalog.load(id));
 *
 * List<Settled<Product>> outcomes = Futures.allSettled(List.of(a, b, c)).join();
 * }</pre>
 */
@UtilityClass
public class Futures {

  /**
   * Invokes a task factory, converting a synchronous throw or a null future into a failed future.
   *
   * @param factory the task factory
   * @param <T>     result type
   * @return the factory's future, or a failed future
   */
  public static <T> CompletableFuture<T> invoke(Supplier<? extends CompletableFuture<T>> factory) {
    Objects.requireNonNull(factory, "factory cannot be null");
    try {
      CompletableFuture<T> future = factory.get();
      if (future == null) {
        return CompletableFuture.failedFuture(new NullPointerException("Task factory returned null future"));
      }
      return future;
    } catch (Throwable t) {
      return CompletableFuture.failedFuture(t);
    }
  }

  /**
   * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
   *
   * @param error a failure as observed on a future
   * @return the underlying failure
   */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
      && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Waits for every future to settle and reports each outcome in input order.
   * The returned future never fails.
   *
   * @param futures the futures to observe
   * @param <T>     result type
   * @return outcomes in input order
   */
  public static <T> CompletableFuture<List<Settled<T>>> allSettled(List<? extends CompletableFuture<T>> futures) {
    Objects.requireNonNull(futures, "futures cannot be null");
    List<CompletableFuture<Settled<T>>> outcomes = new ArrayList<>(futures.size());
    for (CompletableFuture<T> future : futures) {
      outcomes.add(future.handle((value, error) ->
        error == null ? Settled.fulfilled(value) : Settled.<T>rejected(unwrap(error))
      ));
    }
    return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture<?>[0]))
      .thenApply(ignored -> {
        List<Settled<T>> results = new ArrayList<>(outcomes.size());
        for (CompletableFuture<Settled<T>> outcome : outcomes) {
          results.add(outcome.join());
        }
        return results;
      });
  }
}
