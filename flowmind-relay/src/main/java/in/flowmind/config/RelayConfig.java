package in.flowmind.config;

import in.flowmind.util.Env;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Startup configuration for the stream relay.
 *
 * Read once from the environment by {@link #fromEnv()}; every field is
 * immutable afterwards.
 */
public record RelayConfig(
    String host,
    int port,
    String apiToken,                 // null = streaming disabled
    String socketUrl,
    Duration connectTimeout,
    Duration idleTimeout,            // receive wait before a keepalive probe
    Duration pongTimeout,
    Duration sendTimeout,
    Duration reconnectBaseDelay,
    Duration reconnectMaxDelay,
    int reconnectMaxAttempts,
    int downstreamBufferSize
) {
    public static final String DEFAULT_SOCKET_URL = "wss://api.unusualwhales.com/socket";

    public static RelayConfig fromEnv() {
        return new RelayConfig(
            Env.get("HOST", "0.0.0.0"),
            Env.getInt("PORT", 8001),
            Env.firstOf("UW_API_TOKEN", "UW_KEY", "UNUSUAL_WHALES_API_KEY"),
            Env.get("UW_SOCKET_URL", DEFAULT_SOCKET_URL),
            Env.getSeconds("UPSTREAM_CONNECT_TIMEOUT_SECONDS", 10),
            Env.getSeconds("UPSTREAM_IDLE_TIMEOUT_SECONDS", 30),
            Env.getSeconds("UPSTREAM_PONG_TIMEOUT_SECONDS", 10),
            Env.getSeconds("UPSTREAM_SEND_TIMEOUT_SECONDS", 5),
            Env.getSeconds("RECONNECT_BASE_DELAY_SECONDS", 5),
            Env.getSeconds("RECONNECT_MAX_DELAY_SECONDS", 60),
            Env.getInt("RECONNECT_MAX_ATTEMPTS", 5),
            Env.getInt("DOWNSTREAM_BUFFER_SIZE", 256)
        );
    }

    public boolean streamingEnabled() {
        return apiToken != null && !apiToken.isBlank();
    }

    /**
     * Provider connection target with the credential embedded as a query parameter.
     */
    public URI upstreamTarget() {
        if (!streamingEnabled()) {
            throw new IllegalStateException("No provider credential configured");
        }
        String separator = socketUrl.contains("?") ? "&" : "?";
        return URI.create(socketUrl + separator + "token="
            + URLEncoder.encode(apiToken, StandardCharsets.UTF_8));
    }

    /**
     * Throws IllegalStateException naming the first invalid value.
     */
    public void validate() {
        if (port <= 0 || port > 65535) {
            throw new IllegalStateException("INVALID CONFIG: PORT out of range: " + port);
        }
        requirePositive("UPSTREAM_CONNECT_TIMEOUT_SECONDS", connectTimeout);
        requirePositive("UPSTREAM_IDLE_TIMEOUT_SECONDS", idleTimeout);
        requirePositive("UPSTREAM_PONG_TIMEOUT_SECONDS", pongTimeout);
        requirePositive("UPSTREAM_SEND_TIMEOUT_SECONDS", sendTimeout);
        requirePositive("RECONNECT_BASE_DELAY_SECONDS", reconnectBaseDelay);
        requirePositive("RECONNECT_MAX_DELAY_SECONDS", reconnectMaxDelay);
        if (reconnectBaseDelay.compareTo(reconnectMaxDelay) > 0) {
            throw new IllegalStateException(
                "INVALID CONFIG: RECONNECT_BASE_DELAY_SECONDS exceeds RECONNECT_MAX_DELAY_SECONDS");
        }
        if (reconnectMaxAttempts <= 0) {
            throw new IllegalStateException(
                "INVALID CONFIG: RECONNECT_MAX_ATTEMPTS must be positive: " + reconnectMaxAttempts);
        }
        if (downstreamBufferSize <= 0) {
            throw new IllegalStateException(
                "INVALID CONFIG: DOWNSTREAM_BUFFER_SIZE must be positive: " + downstreamBufferSize);
        }
        if (!socketUrl.startsWith("ws://") && !socketUrl.startsWith("wss://")) {
            throw new IllegalStateException("INVALID CONFIG: UW_SOCKET_URL must be a ws:// or wss:// URL");
        }
    }

    private static void requirePositive(String key, Duration value) {
        if (value.isNegative() || value.isZero()) {
            throw new IllegalStateException("INVALID CONFIG: " + key + " must be positive");
        }
    }

    /**
     * Mask token in URL for logging.
     */
    public static String maskUrl(String url) {
        if (url == null) return "null";
        int tokenIdx = url.indexOf("token=");
        if (tokenIdx < 0) return url;
        int endIdx = url.indexOf("&", tokenIdx);
        if (endIdx < 0) endIdx = url.length();
        return url.substring(0, tokenIdx + 6) + "***" + url.substring(endIdx);
    }

    @Override
    public String toString() {
        return "RelayConfig[host=" + host + ", port=" + port
            + ", streaming=" + (streamingEnabled() ? "ENABLED" : "DISABLED")
            + ", socketUrl=" + socketUrl
            + ", idleTimeout=" + idleTimeout.toSeconds() + "s"
            + ", backoff=" + reconnectBaseDelay.toSeconds() + "s.." + reconnectMaxDelay.toSeconds() + "s"
            + " x" + reconnectMaxAttempts
            + ", downstreamBuffer=" + downstreamBufferSize + "]";
    }
}
