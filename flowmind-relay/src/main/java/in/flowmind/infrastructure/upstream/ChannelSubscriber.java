package in.flowmind.infrastructure.upstream;

/**
 * The subscription side of the provider connection, as seen by the channel registry.
 */
public interface ChannelSubscriber {

    /**
     * Mark the channel as desired and join it now if connected, otherwise on the next connect.
     * Re-subscribing replaces the handler without another join.
     */
    void subscribe(String channel, ChannelHandler handler);

    /**
     * Drop the channel from the desired set and leave it if connected. No-op when not subscribed.
     */
    void unsubscribe(String channel);
}
