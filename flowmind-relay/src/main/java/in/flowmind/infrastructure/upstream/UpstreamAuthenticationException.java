package in.flowmind.infrastructure.upstream;

/**
 * Exception thrown when the provider rejects the embedded credential.
 * Not retried: the client goes straight to terminal DISCONNECTED.
 */
public class UpstreamAuthenticationException extends UpstreamConnectException {

    private final int statusCode;

    public UpstreamAuthenticationException(String provider, int statusCode, String message) {
        super(provider, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
