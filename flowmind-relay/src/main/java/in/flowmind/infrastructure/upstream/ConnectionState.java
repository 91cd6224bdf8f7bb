package in.flowmind.infrastructure.upstream;

/**
 * Lifecycle of the single provider connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING;

    public String label() {
        return name().toLowerCase();
    }
}
