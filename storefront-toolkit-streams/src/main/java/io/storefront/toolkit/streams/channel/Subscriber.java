package io.storefront.toolkit.streams.channel;

/**
 * Receives values from a {@link StreamChannel}.
 * <p>
 * {@link #onError(Throwable)} and {@link #onComplete()} are terminal: at most one of them is
 * called, and no values follow it.
 *
 * @param <T> value type
 */
@FunctionalInterface
public interface Subscriber<T> {

    void onNext(T value);

    default void onError(Throwable error) {
    }

    default void onComplete() {
    }
}
