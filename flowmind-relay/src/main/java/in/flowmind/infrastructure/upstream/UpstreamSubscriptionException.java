package in.flowmind.infrastructure.upstream;

/**
 * Exception thrown when a join or leave frame cannot be delivered to the provider.
 */
public class UpstreamSubscriptionException extends RuntimeException {

    private final String provider;
    private final String channel;
    private final String action;

    public UpstreamSubscriptionException(String provider, String channel, String action,
                                         String message, Throwable cause) {
        super(String.format("[%s] %s failed for channel %s: %s", provider, action, channel, message), cause);
        this.provider = provider;
        this.channel = channel;
        this.action = action;
    }

    public String getProvider() {
        return provider;
    }

    public String getChannel() {
        return channel;
    }

    public String getAction() {
        return action;
    }
}
