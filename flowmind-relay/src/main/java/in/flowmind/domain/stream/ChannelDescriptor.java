package in.flowmind.domain.stream;

/**
 * One entry of the channel catalogue served by GET /api/stream/channels.
 *
 * @param path        downstream WebSocket path, possibly templated ({ticker}, {name})
 * @param channel     upstream channel name or name pattern
 * @param subscribers downstream connections currently attached (summed over a template)
 */
public record ChannelDescriptor(String path, String channel, String description, int subscribers) {

    public ChannelDescriptor withSubscribers(int count) {
        return new ChannelDescriptor(path, channel, description, count);
    }
}
