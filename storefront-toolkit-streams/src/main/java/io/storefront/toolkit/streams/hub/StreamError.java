package io.storefront.toolkit.streams.hub;

import java.time.Instant;

/**
 * Payload of an {@code "error"} {@link StreamEvent}.
 *
 * @param stream    name of the channel that failed
 * @param error     the failure
 * @param timestamp when it was observed
 * @param id        unique id
 */
public record StreamError(String stream, Throwable error, Instant timestamp, String id) {
}
