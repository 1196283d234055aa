package io.storefront.toolkit.streams.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Named multi-subscriber broadcast channel.
 * <p>
 * Every value emitted while a subscriber is attached is delivered to it exactly once, in emit
 * order. Values emitted before a subscriber attached are not replayed. A subscriber that throws
 * is logged and does not stop delivery to the others.
 * <p>
 * {@link #complete()} and {@link #error(Throwable)} terminate the channel: subscribers are
 * notified and detached, later emits are dropped, and late subscribers are told immediately.
 * <p>
 * Subscribers are never called while the channel's lock is held. Signals are queued in emit order
 * and drained by whichever thread finds the queue idle, so an emit from inside a subscriber, or
 * from another thread while a drain is running, is delivered after the values already queued.
 * Each value goes to the subscribers attached when it was emitted.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * StreamChannel<Order> orders = new StreamChannel<>("orders");
 * Subscription subscription = orders.subscribe(order -> audit.record(order));
 * orders.emit(order);
 * subscription.close();
 * }</pre>
 *
 * @param <T> value type
 */
public class StreamChannel<T> {
    private static final Logger logger = LoggerFactory.getLogger(StreamChannel.class);

    private final String name;
    private final List<Subscriber<? super T>> subscribers = new CopyOnWriteArrayList<>();

    /**
     * Orders emission; never held while a subscriber runs.
     */
    protected final Object lock = new Object();

    // Guarded by lock
    private final Queue<Signal<T>> pending = new ArrayDeque<>();
    private boolean draining;
    private boolean terminated;
    private Throwable failure;

    public StreamChannel(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public String name() {
        return name;
    }

    /**
     * Attaches a subscriber; a lambda receives values only.
     *
     * @return handle that detaches the subscriber when closed
     */
    public Subscription subscribe(Subscriber<? super T> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber cannot be null");
        boolean lateSubscriber;
        synchronized (lock) {
            lateSubscriber = terminated;
            if (lateSubscriber) {
                if (failure != null) {
                    pending.add(Signal.error(only(subscriber), failure));
                } else {
                    pending.add(Signal.complete(only(subscriber)));
                }
            } else {
                subscribers.add(subscriber);
                onSubscribe(subscriber);
            }
        }
        drain();
        if (lateSubscriber) {
            return CallbackSubscription.closed();
        }
        logger.trace("Subscriber attached to '{}' ({} total)", name, subscribers.size());
        return new CallbackSubscription(() -> subscribers.remove(subscriber));
    }

    /**
     * Called under the lock right after a subscriber is attached; may {@link #sendTo} it a value
     * that it will see before anything emitted later.
     */
    protected void onSubscribe(Subscriber<? super T> subscriber) {
    }

    /**
     * Called under the lock before a value is queued.
     */
    protected void beforeEmit(T value) {
    }

    /**
     * Queues a value for one subscriber. Caller holds the lock.
     */
    protected final void sendTo(Subscriber<? super T> subscriber, T value) {
        pending.add(Signal.next(only(subscriber), value));
    }

    /**
     * Delivers a value to every attached subscriber. Dropped if the channel has terminated.
     *
     * @return true if the value was accepted (the channel was still open)
     */
    public boolean emit(T value) {
        synchronized (lock) {
            if (terminated) {
                logger.trace("Dropping value emitted on terminated channel '{}'", name);
                return false;
            }
            beforeEmit(value);
            pending.add(Signal.next(new ArrayList<>(subscribers), value));
        }
        drain();
        return true;
    }

    /**
     * Terminates the channel with an error.
     */
    public void error(Throwable error) {
        Objects.requireNonNull(error, "error cannot be null");
        if (terminate(error)) {
            logger.debug("Channel '{}' terminated with error: {}", name, error.toString());
        }
    }

    /**
     * Terminates the channel normally. Idempotent.
     */
    public void complete() {
        if (terminate(null)) {
            logger.debug("Channel '{}' completed", name);
        }
    }

    private boolean terminate(Throwable error) {
        synchronized (lock) {
            if (terminated) {
                return false;
            }
            terminated = true;
            failure = error;
            List<Subscriber<? super T>> targets = new ArrayList<>(subscribers);
            subscribers.clear();
            if (error != null) {
                pending.add(Signal.error(targets, error));
            } else {
                pending.add(Signal.complete(targets));
            }
        }
        drain();
        return true;
    }

    private void drain() {
        synchronized (lock) {
            if (draining) {
                return;
            }
            draining = true;
        }
        boolean idle = false;
        try {
            while (!idle) {
                Signal<T> signal;
                synchronized (lock) {
                    signal = pending.poll();
                    if (signal == null) {
                        draining = false;
                        idle = true;
                        continue;
                    }
                }
                dispatch(signal);
            }
        } finally {
            if (!idle) {
                synchronized (lock) {
                    draining = false;
                }
            }
        }
    }

    private List<Subscriber<? super T>> only(Subscriber<? super T> subscriber) {
        List<Subscriber<? super T>> targets = new ArrayList<>(1);
        targets.add(subscriber);
        return targets;
    }

    private void dispatch(Signal<T> signal) {
        for (Subscriber<? super T> subscriber : signal.targets) {
            try {
                if (signal.error != null) {
                    subscriber.onError(signal.error);
                } else if (signal.terminal) {
                    subscriber.onComplete();
                } else {
                    subscriber.onNext(signal.value);
                }
            } catch (RuntimeException e) {
                logger.warn("Subscriber of '{}' failed: {}", name, e.getMessage(), e);
            }
        }
    }

    /**
     * @return true once the channel has completed or failed
     */
    public boolean isCompleted() {
        synchronized (lock) {
            return terminated;
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @Override
    public String toString() {
        return "StreamChannel[" + name + "]";
    }

    private static final class Signal<T> {
        private final List<Subscriber<? super T>> targets;
        private final T value;
        private final Throwable error;
        private final boolean terminal;

        private Signal(List<Subscriber<? super T>> targets, T value, Throwable error, boolean terminal) {
            this.targets = targets;
            this.value = value;
            this.error = error;
            this.terminal = terminal;
        }

        static <T> Signal<T> next(List<Subscriber<? super T>> targets, T value) {
            return new Signal<>(targets, value, null, false);
        }

        static <T> Signal<T> error(List<Subscriber<? super T>> targets, Throwable error) {
            return new Signal<>(targets, null, error, true);
        }

        static <T> Signal<T> complete(List<Subscriber<? super T>> targets) {
            return new Signal<>(targets, null, null, true);
        }
    }
}
