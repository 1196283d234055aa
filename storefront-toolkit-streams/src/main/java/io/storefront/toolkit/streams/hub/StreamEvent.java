package io.storefront.toolkit.streams.hub;

import java.time.Instant;

/**
 * Envelope published on the hub's global channel.
 *
 * @param type      channel or event name; {@code "error"} for stream failures
 * @param payload   the emitted value, or a {@link StreamError}
 * @param timestamp when the envelope was created
 * @param id        unique envelope id
 * @param source    {@code "stream"} for channel traffic, {@code "event"} for named events
 */
public record StreamEvent(String type, Object payload, Instant timestamp, String id, String source) {

    public static final String ERROR_TYPE = "error";
    public static final String SOURCE_STREAM = "stream";
    public static final String SOURCE_EVENT = "event";

    public boolean isError() {
        return ERROR_TYPE.equals(type) && payload instanceof StreamError;
    }
}
