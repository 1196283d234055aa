package io.storefront.toolkit.streams.hub;

import io.storefront.toolkit.core.id.EventIds;
import io.storefront.toolkit.streams.channel.StreamChannel;
import io.storefront.toolkit.streams.channel.Subscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named channels plus one global channel carrying every value as a tagged
 * {@link StreamEvent}.
 * <p>
 * Values emitted on a channel created here are mirrored to {@link #global()} with the channel
 * name as type. A channel failure is mirrored as an {@code "error"} event whose payload is a
 * {@link StreamError}. Named events ({@link #emitEvent}) reach their {@link #onEvent} listeners
 * and the global channel.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * StreamHub hub = new StreamHub(Clock.systemUTC());
 * StreamChannel<Order> orders = hub.createChannel("orders");
 * hub.global().subscribe(event -> log.info("{} {}", event.type(), event.id()));
 * hub.emit("orders", order);
 * }</pre>
 */
public class StreamHub implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StreamHub.class);

    static final String GLOBAL_CHANNEL = "global";

    private final Clock clock;
    private final StreamChannel<StreamEvent> global = new StreamChannel<>(GLOBAL_CHANNEL);
    private final Map<String, StreamChannel<?>> channels = new ConcurrentHashMap<>();
    private final Map<String, StreamChannel<Object>> events = new ConcurrentHashMap<>();

    public StreamHub(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Returns the channel registered under {@code name}, creating it on first use.
     * <p>
     * The value type is not checked: callers sharing a name must agree on it.
     */
    @SuppressWarnings("unchecked")
    public <T> StreamChannel<T> createChannel(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return (StreamChannel<T>) channels.computeIfAbsent(name, this::newForwardedChannel);
    }

    private StreamChannel<Object> newForwardedChannel(String name) {
        StreamChannel<Object> channel = new StreamChannel<>(name);
        channel.subscribe(new Subscriber<>() {
            @Override
            public void onNext(Object value) {
                global.emit(envelope(name, value, StreamEvent.SOURCE_STREAM));
            }

            @Override
            public void onError(Throwable error) {
                StreamError payload = new StreamError(name, error, clock.instant(), EventIds.next());
                global.emit(envelope(StreamEvent.ERROR_TYPE, payload, StreamEvent.SOURCE_STREAM));
            }
        });
        logger.debug("Created stream '{}'", name);
        return channel;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<StreamChannel<T>> channel(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return Optional.ofNullable((StreamChannel<T>) channels.get(name));
    }

    /**
     * Emits on an existing channel.
     *
     * @return false if no channel has that name
     */
    @SuppressWarnings("unchecked")
    public <T> boolean emit(String name, T value) {
        StreamChannel<T> channel = (StreamChannel<T>) channels.get(name);
        if (channel == null) {
            logger.trace("No stream '{}', dropping value", name);
            return false;
        }
        return channel.emit(value);
    }

    /**
     * Completes and unregisters a channel. A later {@link #createChannel} with the same name
     * yields a fresh channel.
     */
    public void complete(String name) {
        StreamChannel<?> channel = channels.remove(name);
        if (channel != null) {
            channel.complete();
            logger.debug("Completed stream '{}'", name);
        }
    }

    /**
     * Fails a channel; the failure is mirrored to the global channel and the channel is unregistered.
     */
    public void fail(String name, Throwable error) {
        StreamChannel<?> channel = channels.remove(name);
        if (channel != null) {
            channel.error(error);
            logger.warn("Stream '{}' failed: {}", name, error.toString());
        }
    }

    public StreamChannel<StreamEvent> global() {
        return global;
    }

    /**
     * Publishes a named event to its listeners and to the global channel.
     */
    public void emitEvent(String eventName, Object data) {
        Objects.requireNonNull(eventName, "eventName cannot be null");
        StreamChannel<Object> listeners = events.get(eventName);
        if (listeners != null) {
            listeners.emit(data);
        }
        global.emit(envelope(eventName, data, StreamEvent.SOURCE_EVENT));
    }

    /**
     * @return channel receiving the data of every {@link #emitEvent} with this name
     */
    public StreamChannel<Object> onEvent(String eventName) {
        Objects.requireNonNull(eventName, "eventName cannot be null");
        return events.computeIfAbsent(eventName, name -> new StreamChannel<>("event:" + name));
    }

    public int channelCount() {
        return channels.size();
    }

    public List<String> channelNames() {
        return new ArrayList<>(channels.keySet());
    }

    private StreamEvent envelope(String type, Object payload, String source) {
        return new StreamEvent(type, payload, clock.instant(), EventIds.next(), source);
    }

    /**
     * Completes every channel, every event channel and the global channel.
     */
    @Override
    public void close() {
        for (String name : channelNames()) {
            complete(name);
        }
        events.values().forEach(StreamChannel::complete);
        events.clear();
        global.complete();
        logger.info("Stream hub closed");
    }
}
