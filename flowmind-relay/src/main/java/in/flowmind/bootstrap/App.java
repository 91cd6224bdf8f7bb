package in.flowmind.bootstrap;

import in.flowmind.config.RelayConfig;
import in.flowmind.feedrelay.ChannelRegistry;
import in.flowmind.feedrelay.RelayGateway;
import in.flowmind.infrastructure.metrics.PrometheusMetricsHandler;
import in.flowmind.infrastructure.metrics.PrometheusRelayMetrics;
import in.flowmind.infrastructure.upstream.UpstreamFeedClient;
import in.flowmind.infrastructure.upstream.common.ReconnectionPolicy;
import in.flowmind.infrastructure.upstream.transport.JdkWebSocketTransport;
import in.flowmind.transport.http.StreamStatusHandler;
import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FlowMind stream relay - Main entry point.
 *
 * Wires together:
 * - Prometheus metrics
 * - Upstream feed client (single provider WebSocket)
 * - Channel registry and downstream gateway
 * - Operator HTTP endpoints
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final String PROVIDER = "UNUSUAL_WHALES";

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== FlowMind Stream Relay Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        RelayConfig config = RelayConfig.fromEnv();
        try {
            config.validate();
        } catch (IllegalStateException e) {
            log.error("❌ {}", e.getMessage());
            System.exit(1);
            return;
        }
        log.info("✓ {}", config);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusRelayMetrics metrics = new PrometheusRelayMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Upstream feed client + channel registry
        // ═══════════════════════════════════════════════════════════════
        UpstreamFeedClient upstream = null;
        ChannelRegistry registry = null;
        if (config.streamingEnabled()) {
            ReconnectionPolicy policy = ReconnectionPolicy.builder()
                .baseDelay(config.reconnectBaseDelay())
                .maxDelay(config.reconnectMaxDelay())
                .maxAttempts(config.reconnectMaxAttempts())
                .build();
            JdkWebSocketTransport transport =
                new JdkWebSocketTransport(PROVIDER, config.connectTimeout(), config.sendTimeout());
            upstream = new UpstreamFeedClient(PROVIDER, config.upstreamTarget(), transport, policy,
                config.idleTimeout(), config.pongTimeout(), metrics);
            registry = new ChannelRegistry(upstream, metrics);
            log.info("✓ Upstream feed client configured");
        } else {
            log.warn("⚠️ No API token configured (UW_API_TOKEN) - streaming DISABLED");
        }

        // ═══════════════════════════════════════════════════════════════
        // Gateway + HTTP routes
        // ═══════════════════════════════════════════════════════════════
        RelayGateway gateway = new RelayGateway(upstream, registry, config.downstreamBufferSize());
        StreamStatusHandler statusHandler = new StreamStatusHandler(gateway);

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/api/stream/status", statusHandler::getStatus)
            .get("/api/stream/channels", statusHandler::getChannels)
            .get("/api/stream/health", statusHandler::getHealth)
            .post("/api/stream/reconnect", statusHandler::postReconnect)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.NOT_FOUND);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "FlowMind Stream Relay\n\n" +
                    "API: GET /api/stream/status, /api/stream/channels, /api/stream/health\n" +
                    "     POST /api/stream/reconnect\n" +
                    "WS:  ws://localhost:" + config.port() + "/api/stream/ws/flow\n"
                );
            });

        gateway.start(config.host(), config.port(), routes);
        log.info("✓ HTTP server started on port {}", config.port());

        // ═══════════════════════════════════════════════════════════════
        // Shutdown hook
        // ═══════════════════════════════════════════════════════════════
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[SHUTDOWN] Stopping relay...");
            gateway.stop();
            log.info("[SHUTDOWN] Relay stopped");
        }, "relay-shutdown"));

        // ═══════════════════════════════════════════════════════════════
        // Upstream control loop
        // ═══════════════════════════════════════════════════════════════
        if (upstream != null) {
            upstream.start();
            log.info("✓ Upstream control loop started");
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== FlowMind Stream Relay Ready on http://{}:{}/ ===", config.host(), config.port());
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private App() {}
}
