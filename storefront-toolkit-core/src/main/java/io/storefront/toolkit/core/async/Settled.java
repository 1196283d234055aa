package io.storefront.toolkit.core.async;

/**
 * Outcome of one future observed by {@link Futures#allSettled}.
 *
 * @param value result when fulfilled, otherwise null
 * @param error failure when rejected, otherwise null
 * @param <T>   result type
 */
public record Settled<T>(T value, Throwable error) {

  public static <T> Settled<T> fulfilled(T value) {
    return new Settled<>(value, null);
  }

  public static <T> Settled<T> rejected(Throwable error) {
    return new Settled<>(null, error);
  }

  public boolean isFulfilled() {
    return error == null;
  }

  public boolean isRejected() {
    return error != null;
  }
}
