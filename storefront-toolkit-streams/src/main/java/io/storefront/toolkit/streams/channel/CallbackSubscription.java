package io.storefront.toolkit.streams.channel;

import io.storefront.toolkit.core.id.EventIds;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Subscription that runs a close handler exactly once.
 */
public class CallbackSubscription implements Subscription {

    private final String id;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param onClose runnable to execute when close() is first called
     * @throws NullPointerException if onClose is null
     */
    public CallbackSubscription(Runnable onClose) {
        this.onClose = Objects.requireNonNull(onClose, "onClose cannot be null");
        this.id = EventIds.next();
    }

    /**
     * @return a subscription that is already closed
     */
    static CallbackSubscription closed() {
        CallbackSubscription subscription = new CallbackSubscription(() -> { });
        subscription.closed.set(true);
        return subscription;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.run();
        }
    }
}
