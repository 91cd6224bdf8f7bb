package in.flowmind.infrastructure.upstream.transport;

import java.io.IOException;

/**
 * One open provider connection. Sends are serialized by the implementation.
 */
public interface UpstreamSession {

    void sendText(String text) throws IOException;

    /**
     * Transport-level ping; the acknowledgment arrives as {@link UpstreamListener#onPong()}.
     */
    void sendPing() throws IOException;

    /**
     * Graceful close. Never throws.
     */
    void close();

    /**
     * Tear the connection down without a closing handshake. Never throws.
     */
    void abort();

    boolean isOpen();
}
