package in.flowmind.infrastructure.upstream.transport;

import in.flowmind.config.RelayConfig;
import in.flowmind.infrastructure.upstream.UpstreamAuthenticationException;
import in.flowmind.infrastructure.upstream.UpstreamConnectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Provider transport over the JDK {@link java.net.http.WebSocket} client.
 *
 * Text frames split across several callbacks are reassembled before they
 * reach the listener. Demand is requested one message at a time and only
 * after the listener returns, so the listener sees frames strictly in
 * arrival order and a listener that blocks stops further reads.
 */
public final class JdkWebSocketTransport implements UpstreamTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private static final byte[] PING_PAYLOAD = "keepalive".getBytes(StandardCharsets.US_ASCII);

    private final String provider;
    private final HttpClient httpClient;
    private final Duration connectTimeout;
    private final Duration sendTimeout;

    public JdkWebSocketTransport(String provider, Duration connectTimeout, Duration sendTimeout) {
        this.provider = provider;
        this.connectTimeout = connectTimeout;
        this.sendTimeout = sendTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public UpstreamSession open(URI target, UpstreamListener listener) {
        log.info("[UPSTREAM] Opening WebSocket to {}", RelayConfig.maskUrl(target.toString()));

        CompletableFuture<WebSocket> future = httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(target, new FrameAssembler(listener));

        try {
            WebSocket ws = future.get(connectTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
            return new JdkSession(ws);
        } catch (ExecutionException e) {
            throw translate(e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new UpstreamConnectException(provider, "Timed out after " + connectTimeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamConnectException(provider, "Interrupted while connecting", e);
        }
    }

    private UpstreamConnectException translate(Throwable cause) {
        if (cause instanceof WebSocketHandshakeException) {
            int status = ((WebSocketHandshakeException) cause).getResponse().statusCode();
            if (status == 401) {
                return new UpstreamAuthenticationException(provider, status, "Invalid API token (401 Unauthorized)");
            }
            if (status == 403) {
                return new UpstreamAuthenticationException(provider, status,
                    "Access forbidden (403) - streaming not available on this plan");
            }
            return new UpstreamConnectException(provider, "Handshake rejected with status " + status, cause);
        }
        String detail = cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new UpstreamConnectException(provider, "Failed to connect: " + detail, cause);
    }

    private final class JdkSession implements UpstreamSession {
        private final WebSocket ws;

        private JdkSession(WebSocket ws) {
            this.ws = ws;
        }

        // JDK WebSocket allows one outstanding send; synchronized + blocking wait keeps it that way.
        @Override
        public synchronized void sendText(String text) throws IOException {
            await(ws.sendText(text, true), "send");
        }

        @Override
        public synchronized void sendPing() throws IOException {
            await(ws.sendPing(ByteBuffer.wrap(PING_PAYLOAD)), "ping");
        }

        @Override
        public synchronized void close() {
            if (ws.isOutputClosed()) {
                ws.abort();
                return;
            }
            try {
                await(ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye"), "close");
            } catch (IOException e) {
                log.debug("[UPSTREAM] Close handshake failed, aborting: {}", e.getMessage());
                ws.abort();
            }
        }

        @Override
        public void abort() {
            ws.abort();
        }

        @Override
        public boolean isOpen() {
            return !ws.isInputClosed() && !ws.isOutputClosed();
        }

        private void await(CompletableFuture<WebSocket> op, String what) throws IOException {
            try {
                op.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new IOException(what + " failed: " + e.getCause(), e.getCause());
            } catch (TimeoutException e) {
                throw new IOException(what + " timed out after " + sendTimeout.toMillis() + "ms", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException(what + " interrupted", e);
            }
        }
    }

    private static final class FrameAssembler implements WebSocket.Listener {
        private final UpstreamListener listener;
        private final StringBuilder buf = new StringBuilder();

        private FrameAssembler(UpstreamListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String msg = buf.toString();
                buf.setLength(0);
                listener.onText(msg);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            listener.onPong();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }
}
