package io.storefront.toolkit.streams.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.storefront.toolkit.core.error.ToolkitException;
import io.storefront.toolkit.streams.hub.StreamEvent;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders values as server-sent event frames with a JSON data line.
 *
 * <pre>
 * id: 3f2c...
 * event: orders
 * data: {"id":"o-1","total":400}
 *
 * </pre>
 */
@UtilityClass
public class SseFrames {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    /**
     * @param data value serialized as the {@code data} line
     * @return a frame with only a data line
     */
    public static String data(Object data) {
        return "data: " + toJson(data) + "\n\n";
    }

    /**
     * @return a frame carrying the envelope's id, type as event name, and payload as data
     */
    public static String event(StreamEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("payload", event.payload());
        body.put("timestamp", event.timestamp().toEpochMilli());
        body.put("source", event.source());
        return "id: " + event.id() + "\n"
            + "event: " + event.type() + "\n"
            + "data: " + toJson(body) + "\n\n";
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ToolkitException("Cannot serialize SSE payload of type "
                + (value == null ? "null" : value.getClass().getName()), e);
        }
    }
}
