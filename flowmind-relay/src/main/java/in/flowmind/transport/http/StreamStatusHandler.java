package in.flowmind.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.flowmind.domain.stream.ChannelDescriptor;
import in.flowmind.domain.stream.RelayStatus;
import in.flowmind.feedrelay.RelayGateway;
import in.flowmind.feedrelay.StreamRoutes;
import in.flowmind.infrastructure.upstream.UpstreamFeedClient;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP handler for the stream relay's operator endpoints.
 *
 * - GET  /api/stream/status    - Upstream state and downstream client counts
 * - GET  /api/stream/channels  - Route catalogue with active subscriber counts
 * - GET  /api/stream/health    - 200 when the upstream is connected, 503 otherwise
 * - POST /api/stream/reconnect - Force the upstream through the reconnect procedure
 */
public final class StreamStatusHandler {
    private static final Logger log = LoggerFactory.getLogger(StreamStatusHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RelayGateway gateway;

    public StreamStatusHandler(RelayGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * GET /api/stream/status
     */
    public void getStatus(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, gateway.status());
        } catch (Exception e) {
            log.error("Failed to get stream status: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get stream status: " + e.getMessage());
        }
    }

    /**
     * GET /api/stream/channels
     */
    public void getChannels(HttpServerExchange exchange) {
        try {
            List<ChannelDescriptor> channels = StreamRoutes.catalogue(gateway.channelCounts());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("enabled", gateway.streamingEnabled());
            body.put("channels", channels);
            sendJson(exchange, StatusCodes.OK, body);
        } catch (Exception e) {
            log.error("Failed to list channels: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to list channels: " + e.getMessage());
        }
    }

    /**
     * GET /api/stream/health
     *
     * 503 while streaming is disabled or the upstream is not connected.
     */
    public void getHealth(HttpServerExchange exchange) {
        try {
            RelayStatus status = gateway.status();
            Map<String, Object> body = new LinkedHashMap<>();
            if (RelayStatus.CONNECTED.equals(status.status())) {
                body.put("status", "healthy");
                body.put("upstream", status.upstream().state());
                body.put("clients", status.totalClients());
                sendJson(exchange, StatusCodes.OK, body);
                return;
            }
            body.put("status", "unhealthy");
            body.put("reason", unhealthyReason(status));
            sendJson(exchange, StatusCodes.SERVICE_UNAVAILABLE, body);
        } catch (Exception e) {
            log.error("Health check failed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Health check failed: " + e.getMessage());
        }
    }

    private static String unhealthyReason(RelayStatus status) {
        if (!status.enabled()) {
            return "streaming disabled (no API token configured)";
        }
        String terminal = status.upstream().terminalReason();
        return terminal != null ? terminal : "upstream " + status.upstream().state();
    }

    /**
     * POST /api/stream/reconnect
     */
    public void postReconnect(HttpServerExchange exchange) {
        try {
            UpstreamFeedClient upstream = gateway.upstream();
            if (upstream == null) {
                sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, "Streaming not available");
                return;
            }
            boolean triggered = upstream.forceReconnect();
            log.info("[GATEWAY] Reconnect requested by operator (triggered={})", triggered);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("triggered", triggered);
            body.put("state", upstream.connectionState().label());
            body.put("message", triggered ? "Reconnect initiated" : "Reconnect already in progress");
            sendJson(exchange, StatusCodes.ACCEPTED, body);
        } catch (Exception e) {
            log.error("Failed to trigger reconnect: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to trigger reconnect: " + e.getMessage());
        }
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
