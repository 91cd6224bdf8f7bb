package in.flowmind.feedrelay;

/**
 * One external client session, bound to a single channel.
 *
 * Owned by the gateway; the registry only holds references.
 */
public interface DownstreamConnection {

    String id();

    /**
     * Queue a frame for delivery without blocking.
     *
     * @return false if the connection is closed or its outbound buffer is full
     */
    boolean offer(String frame);

    /**
     * Close the session. Safe to call more than once.
     */
    void close(String reason);

    boolean isOpen();
}
