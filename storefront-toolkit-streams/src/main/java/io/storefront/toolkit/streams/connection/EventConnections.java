package io.storefront.toolkit.streams.connection;

import io.storefront.toolkit.streams.channel.StreamChannel;
import io.storefront.toolkit.streams.channel.Subscriber;
import io.storefront.toolkit.streams.channel.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client event channels fed by a shared broadcast, as used for server-sent events.
 * <p>
 * Each connection receives every {@link #broadcast} plus whatever is sent to it directly.
 * Completing a connection's channel, by {@link #closeConnection} or directly, detaches it from
 * the broadcast and unregisters it.
 */
public class EventConnections implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventConnections.class);

    private final StreamChannel<Object> broadcast = new StreamChannel<>("broadcast");
    private final Map<String, StreamChannel<Object>> connections = new ConcurrentHashMap<>();

    /**
     * Opens a connection. An id that is already open returns the existing channel.
     */
    public StreamChannel<Object> createConnection(String connectionId) {
        Objects.requireNonNull(connectionId, "connectionId cannot be null");
        return connections.computeIfAbsent(connectionId, this::open);
    }

    private StreamChannel<Object> open(String connectionId) {
        StreamChannel<Object> channel = new StreamChannel<>("connection:" + connectionId);
        Subscription feed = broadcast.subscribe(channel::emit);
        channel.subscribe(new Subscriber<>() {
            @Override
            public void onNext(Object value) {
            }

            @Override
            public void onComplete() {
                feed.close();
                connections.remove(connectionId, channel);
                logger.debug("Connection '{}' closed ({} open)", connectionId, connections.size());
            }
        });
        logger.debug("Connection '{}' opened", connectionId);
        return channel;
    }

    public void broadcast(Object data) {
        broadcast.emit(data);
    }

    /**
     * @return false if no such connection is open
     */
    public boolean sendToConnection(String connectionId, Object data) {
        StreamChannel<Object> channel = connections.get(connectionId);
        return channel != null && channel.emit(data);
    }

    public void closeConnection(String connectionId) {
        StreamChannel<Object> channel = connections.get(connectionId);
        if (channel != null) {
            channel.complete();
        }
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public List<String> getConnectionIds() {
        return new ArrayList<>(connections.keySet());
    }

    @Override
    public void close() {
        getConnectionIds().forEach(this::closeConnection);
        broadcast.complete();
    }
}
