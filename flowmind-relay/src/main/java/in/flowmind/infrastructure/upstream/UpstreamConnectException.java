package in.flowmind.infrastructure.upstream;

/**
 * Exception thrown when the provider connection cannot be opened or is lost during the handshake.
 */
public class UpstreamConnectException extends RuntimeException {

    private final String provider;

    public UpstreamConnectException(String provider, String message) {
        super(String.format("[%s] %s", provider, message));
        this.provider = provider;
    }

    public UpstreamConnectException(String provider, String message, Throwable cause) {
        super(String.format("[%s] %s", provider, message), cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
