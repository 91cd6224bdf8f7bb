package in.flowmind.feedrelay;

import in.flowmind.domain.stream.RegistryStats;
import in.flowmind.domain.stream.RelayStatus;
import in.flowmind.infrastructure.upstream.UpstreamFeedClient;
import in.flowmind.infrastructure.upstream.UpstreamStats;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Downstream WebSocket endpoint of the relay.
 *
 * Each accepted socket is bound to the channel named by its path (see
 * {@link StreamRoutes}) and attached to the {@link ChannelRegistry}. The
 * close listener is installed before the attach and releases the
 * connection exactly once, whichever way the socket ends.
 *
 * Without an upstream client (no credential configured) sockets on valid
 * paths are accepted and closed right away with 1011.
 */
public final class RelayGateway {
    private static final Logger log = LoggerFactory.getLogger(RelayGateway.class);

    static final String STREAMING_UNAVAILABLE = "WebSocket streaming not available";

    private static final AttachmentKey<String> CHANNEL = AttachmentKey.create(String.class);

    private final UpstreamFeedClient upstream;   // null = streaming disabled
    private final ChannelRegistry registry;
    private final int bufferSize;

    private final AtomicLong connectionIds = new AtomicLong();
    private volatile boolean accepting = false;
    private Undertow server;

    public RelayGateway(UpstreamFeedClient upstream, ChannelRegistry registry, int bufferSize) {
        this.upstream = upstream;
        this.registry = registry;
        this.bufferSize = bufferSize;
    }

    public boolean streamingEnabled() {
        return upstream != null;
    }

    /**
     * Start the HTTP listener. Stream sockets live under {@link StreamRoutes#PREFIX};
     * every other request goes to {@code apiRoutes}.
     */
    public synchronized void start(String host, int port, HttpHandler apiRoutes) {
        HttpHandler root = Handlers.path(apiRoutes)
            .addPrefixPath(StreamRoutes.PREFIX, handshakeHandler());

        server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(root)
            .build();
        server.start();
        accepting = true;

        log.info("[GATEWAY] Listening on {}:{} (streaming {})", host, boundPort(),
            streamingEnabled() ? "ENABLED" : "DISABLED");
    }

    /**
     * Actual listener port, useful when started on port 0.
     */
    public synchronized int boundPort() {
        if (server == null) {
            throw new IllegalStateException("Gateway not started");
        }
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    /**
     * Shutdown order: stop accepting, stop the upstream loop, close every downstream
     * connection, stop the HTTP listener.
     */
    public synchronized void stop() {
        if (!accepting && server == null) {
            return;
        }
        log.info("[GATEWAY] Stopping...");
        accepting = false;

        if (upstream != null) {
            upstream.shutdown();
        }
        if (registry != null) {
            registry.closeAll("Server shutting down");
        }
        if (server != null) {
            server.stop();
            server = null;
        }
        log.info("[GATEWAY] Stopped");
    }

    HttpHandler handshakeHandler() {
        WebSocketProtocolHandshakeHandler websocket = new WebSocketProtocolHandshakeHandler(new Acceptor());
        return exchange -> {
            Optional<String> channel = StreamRoutes.resolve(exchange.getRelativePath());
            if (channel.isEmpty()) {
                log.debug("[GATEWAY] Unknown stream path: {}", exchange.getRequestPath());
                reject(exchange, StatusCodes.NOT_FOUND, "Unknown stream: " + exchange.getRequestPath());
                return;
            }
            if (!accepting) {
                reject(exchange, StatusCodes.SERVICE_UNAVAILABLE, "Relay shutting down");
                return;
            }
            exchange.putAttachment(CHANNEL, channel.get());
            websocket.handleRequest(exchange);
        };
    }

    private static void reject(HttpServerExchange exchange, int status, String message) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message);
    }

    private final class Acceptor implements WebSocketConnectionCallback {

        @Override
        public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
            String name = exchange.getAttachment(CHANNEL);

            if (upstream == null || registry == null) {
                log.warn("[GATEWAY] Rejecting {} client: streaming disabled", name);
                WebSockets.sendClose(CloseMessage.UNEXPECTED_ERROR, STREAMING_UNAVAILABLE, channel, null);
                return;
            }

            String id = "ws-" + connectionIds.incrementAndGet();
            UndertowDownstreamConnection conn = new UndertowDownstreamConnection(id, channel, bufferSize);
            AtomicBoolean released = new AtomicBoolean(false);

            channel.getCloseSetter().set(c -> release(conn, name, released));
            channel.getReceiveSetter().set(new AbstractReceiveListener() {
                @Override
                protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                    log.debug("[GATEWAY] Ignoring client frame from {}", id);
                }
            });
            channel.resumeReceives();

            // attach may send a join upstream; keep that off the I/O thread.
            try {
                channel.getWorker().execute(() -> attach(channel, conn, name, released));
            } catch (RejectedExecutionException e) {
                log.warn("[GATEWAY] Worker rejected attach of {} to {}: {}", id, name, e.getMessage());
                conn.close("Server shutting down");
            }
        }
    }

    private void attach(WebSocketChannel channel, UndertowDownstreamConnection conn, String name,
                        AtomicBoolean released) {
        if (!accepting) {
            conn.close("Server shutting down");
            return;
        }
        try {
            registry.attach(conn, name);
        } catch (RuntimeException e) {
            log.error("[GATEWAY] Attach of {} to {} failed: {}", conn.id(), name, e.getMessage(), e);
            release(conn, name, released);
            conn.close("Internal error");
            return;
        }

        // Closed while attaching: the close listener may have run before the attach.
        if (!channel.isOpen()) {
            registry.detach(conn, name);
            return;
        }
        log.info("[GATEWAY] Client {} connected to {}", conn.id(), name);
    }

    private void release(DownstreamConnection conn, String channel, AtomicBoolean released) {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        registry.detach(conn, channel);
        log.info("[GATEWAY] Client {} disconnected from {}", conn.id(), channel);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // STATUS
    // ═══════════════════════════════════════════════════════════════════════

    public RelayStatus status() {
        if (upstream == null || registry == null) {
            return new RelayStatus(RelayStatus.DISABLED, false, null, null, 0);
        }
        UpstreamStats up = upstream.stats();
        RegistryStats clients = registry.stats();
        return new RelayStatus(
            up.connected() ? RelayStatus.CONNECTED : RelayStatus.DISCONNECTED,
            true,
            up,
            clients,
            clients.totalConnections()
        );
    }

    public Map<String, Integer> channelCounts() {
        return registry == null ? Map.of() : registry.channelCounts();
    }

    public UpstreamFeedClient upstream() {
        return upstream;
    }
}
