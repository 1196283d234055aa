package io.storefront.toolkit.streams.channel;

/**
 * A {@link StreamChannel} that remembers its latest value and hands it to every new subscriber
 * before any later value.
 *
 * @param <T> value type
 */
public class SnapshotChannel<T> extends StreamChannel<T> {

    private volatile T current;

    public SnapshotChannel(String name, T initial) {
        super(name);
        this.current = initial;
    }

    /**
     * @return the most recently emitted value, or the initial value
     */
    public T current() {
        return current;
    }

    @Override
    protected void onSubscribe(Subscriber<? super T> subscriber) {
        sendTo(subscriber, current);
    }

    @Override
    protected void beforeEmit(T value) {
        current = value;
    }
}
