package in.flowmind.feedrelay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Builds the downstream frame {"channel": ..., "timestamp": ..., "data": ...}.
 */
public final class ChannelFrameMapper {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ChannelFrameMapper() {}

    public static String toJson(String channel, JsonNode payload, Instant timestamp) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("channel", channel);
        o.put("timestamp", timestamp.toString());
        o.set("data", payload);
        try {
            return MAPPER.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            // A tree built from parsed JSON always serializes.
            throw new IllegalStateException("Failed to serialize frame for " + channel, e);
        }
    }
}
