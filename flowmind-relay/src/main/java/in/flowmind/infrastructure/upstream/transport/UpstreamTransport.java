package in.flowmind.infrastructure.upstream.transport;

import in.flowmind.infrastructure.upstream.UpstreamConnectException;

import java.net.URI;

/**
 * Opens sessions to the provider. One implementation talks WebSocket; tests substitute an in-memory one.
 */
public interface UpstreamTransport {

    /**
     * Open a session and block until the handshake completes.
     *
     * @param target connection target, credential included
     * @param listener receives inbound events for this session only
     * @throws UpstreamConnectException on network or handshake failure
     *         ({@link in.flowmind.infrastructure.upstream.UpstreamAuthenticationException} when the credential is rejected)
     */
    UpstreamSession open(URI target, UpstreamListener listener);
}
