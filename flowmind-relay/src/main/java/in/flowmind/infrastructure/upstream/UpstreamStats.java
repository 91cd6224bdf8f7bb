package in.flowmind.infrastructure.upstream;

import java.util.List;

/**
 * Point-in-time view of the provider connection for the status surface.
 *
 * @param lastMessageSecondsAgo null until the first frame arrives
 * @param terminalReason        set only after the client gave up
 */
public record UpstreamStats(
    boolean connected,
    boolean running,
    String state,
    int reconnectAttempts,
    int maxReconnectAttempts,
    List<String> subscribedChannels,
    int channelCount,
    Double lastMessageSecondsAgo,
    long framesReceived,
    String connectionUri,
    String terminalReason
) {
}
