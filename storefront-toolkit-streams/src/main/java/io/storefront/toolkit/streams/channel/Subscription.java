package io.storefront.toolkit.streams.channel;

/**
 * Handle returned by {@link StreamChannel#subscribe}; closing it detaches the subscriber.
 */
public interface Subscription extends AutoCloseable {

    String id();

    boolean isClosed();

    /**
     * Detaches the subscriber. Idempotent.
     */
    @Override
    void close();
}
