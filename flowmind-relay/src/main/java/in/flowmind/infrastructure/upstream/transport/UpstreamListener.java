package in.flowmind.infrastructure.upstream.transport;

/**
 * Inbound events of a single session. Called on transport threads.
 */
public interface UpstreamListener {

    void onText(String text);

    void onPong();

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
}
