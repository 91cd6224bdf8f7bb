package in.flowmind.infrastructure.upstream;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Callback registered per channel; invoked on the receive loop thread for every inbound frame.
 */
@FunctionalInterface
public interface ChannelHandler {
    void onMessage(String channel, JsonNode payload);
}
