package in.flowmind.feedrelay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.flowmind.infrastructure.metrics.RelayMetrics;
import in.flowmind.infrastructure.upstream.ChannelHandler;
import in.flowmind.infrastructure.upstream.ChannelSubscriber;
import in.flowmind.infrastructure.upstream.UpstreamFeedClient;
import in.flowmind.infrastructure.upstream.common.ReconnectionPolicy;
import in.flowmind.infrastructure.upstream.transport.JdkWebSocketTransport;
import in.flowmind.transport.http.StreamStatusHandler;
import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end: fake provider ⇄ UpstreamFeedClient ⇄ ChannelRegistry ⇄ RelayGateway ⇄ WebSocket client.
 */
class RelayGatewayTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long WAIT_MS = 10_000;

    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    private FakeProvider provider;
    private UpstreamFeedClient upstream;
    private ChannelRegistry registry;
    private RelayGateway gateway;
    private final List<String> subscribeThreads = new CopyOnWriteArrayList<>();
    private int port;

    @AfterEach
    void tearDown() {
        if (gateway != null) {
            gateway.stop();
        }
        if (provider != null) {
            provider.stop();
        }
    }

    private void startRelay(boolean streamingEnabled) {
        startRelay(streamingEnabled, 64);
    }

    private void startRelay(boolean streamingEnabled, int bufferSize) {
        if (streamingEnabled) {
            provider = new FakeProvider();
            int providerPort = provider.start();
            ReconnectionPolicy policy = ReconnectionPolicy.builder()
                .baseDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(1))
                .build();
            upstream = new UpstreamFeedClient("TEST",
                URI.create("ws://localhost:" + providerPort + "/socket?token=test-token"),
                new JdkWebSocketTransport("TEST", Duration.ofSeconds(5), Duration.ofSeconds(5)),
                policy, Duration.ofSeconds(30), Duration.ofSeconds(10), RelayMetrics.NOOP);
            UpstreamFeedClient feed = upstream;
            registry = new ChannelRegistry(new ChannelSubscriber() {
                @Override
                public void subscribe(String channel, ChannelHandler handler) {
                    subscribeThreads.add(Thread.currentThread().getName());
                    feed.subscribe(channel, handler);
                }

                @Override
                public void unsubscribe(String channel) {
                    feed.unsubscribe(channel);
                }
            }, RelayMetrics.NOOP);
        }

        gateway = new RelayGateway(upstream, registry, bufferSize);
        StreamStatusHandler status = new StreamStatusHandler(gateway);
        RoutingHandler routes = Handlers.routing()
            .get("/api/stream/status", status::getStatus)
            .get("/api/stream/channels", status::getChannels)
            .get("/api/stream/health", status::getHealth)
            .post("/api/stream/reconnect", status::postReconnect);
        gateway.start("localhost", 0, routes);
        port = gateway.boundPort();

        if (upstream != null) {
            upstream.start();
            awaitTrue(upstream::isConnected, "relay connected to provider");
        }
    }

    private static void awaitTrue(BooleanSupplier condition, String message) {
        long deadline = System.currentTimeMillis() + WAIT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting: " + message);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted");
            }
        }
    }

    private Client connect(String path) throws Exception {
        return connect(path, new Client());
    }

    private Client connect(String path, Client client) throws Exception {
        client.ws = http.newWebSocketBuilder()
            .buildAsync(URI.create("ws://localhost:" + port + path), client)
            .get(5, TimeUnit.SECONDS);
        return client;
    }

    private HttpResponse<String> request(String method, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + port + path))
            .method(method, HttpRequest.BodyPublishers.noBody())
            .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testEndToEndChannelLifecycle() throws Exception {
        startRelay(true);
        assertEquals("token=test-token", provider.queryStrings().get(0), "Credential embedded in target");

        Client client = connect("/api/stream/ws/channel/X");
        awaitTrue(() -> provider.count("join", "X") == 1, "join for X");
        assertEquals(1, registry.connectionCount("X"));

        provider.push("X", "{\"v\": 1}");
        String frame = client.messages.poll(5, TimeUnit.SECONDS);
        assertNotNull(frame, "Client should receive the frame");
        JsonNode json = MAPPER.readTree(frame);
        assertEquals("X", json.path("channel").asText());
        assertEquals(1, json.path("data").path("v").asInt());
        assertTrue(json.hasNonNull("timestamp"));

        client.ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
        awaitTrue(() -> registry.connectionCount("X") == 0, "registry count drops to 0");
        awaitTrue(() -> provider.count("leave", "X") == 1, "leave for X");

        provider.push("X", "{\"v\": 2}");
        Thread.sleep(200);
        assertTrue(upstream.isConnected(), "Unrouted frame must not disturb the connection");
        assertEquals(1, provider.count("join", "X"));
    }

    @Test
    void testSharedChannelJoinsOnce() throws Exception {
        startRelay(true);

        Client first = connect("/api/stream/ws/gex/spy");
        Client second = connect("/api/stream/ws/gex/SPY");
        awaitTrue(() -> registry.connectionCount("gex:SPY") == 2, "both attached");

        provider.push("gex:SPY", "{\"gamma\": 42}");
        assertNotNull(first.messages.poll(5, TimeUnit.SECONDS));
        assertNotNull(second.messages.poll(5, TimeUnit.SECONDS));
        assertEquals(1, provider.count("join", "gex:SPY"), "Exactly one upstream join");

        first.ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
        awaitTrue(() -> registry.connectionCount("gex:SPY") == 1, "first detached");
        assertEquals(0, provider.count("leave", "gex:SPY"), "Still one subscriber");
    }

    @Test
    void testUpstreamJoinSentOffIoThread() throws Exception {
        startRelay(true);

        connect("/api/stream/ws/market-movers");
        awaitTrue(() -> provider.count("join", "market_movers") == 1, "join sent");

        assertEquals(1, subscribeThreads.size());
        assertFalse(subscribeThreads.get(0).contains("I/O"),
            "Join must not run on an Undertow I/O thread: " + subscribeThreads.get(0));
    }

    @Test
    void testSlowClientDroppedWithoutStallingOthers() throws Exception {
        startRelay(true, 16);
        Client slow = connect("/api/stream/ws/channel/X", Client.stalled());
        Client fast = connect("/api/stream/ws/channel/X");
        awaitTrue(() -> registry.connectionCount("X") == 2, "both attached");

        String pad = "x".repeat(32 * 1024);
        int pushed = 0;
        while (registry.connectionCount("X") == 2 && pushed < 4_000) {
            provider.push("X", "{\"seq\": " + pushed + ", \"pad\": \"" + pad + "\"}");
            pushed++;
            Thread.sleep(1);
        }
        awaitTrue(() -> registry.connectionCount("X") == 1, "slow client dropped");
        assertTrue(upstream.isConnected(), "Upstream unaffected by a slow client");

        int total = pushed + 5;
        for (int seq = pushed; seq < total; seq++) {
            provider.push("X", "{\"seq\": " + seq + ", \"pad\": \"\"}");
        }
        for (int expected = 0; expected < total; expected++) {
            String frame = fast.messages.poll(10, TimeUnit.SECONDS);
            assertNotNull(frame, "Fast client missing frame " + expected);
            assertEquals(expected, MAPPER.readTree(frame).path("data").path("seq").asInt(),
                "Frames arrive complete and in order");
        }

        slow.resume();
        Integer code = slow.closeCode.get(10, TimeUnit.SECONDS);
        assertEquals(1001, code);
        assertEquals("Slow consumer", slow.closeReason);
    }

    @Test
    void testUnknownPathRejectedBeforeHandshake() throws Exception {
        startRelay(true);

        HttpResponse<String> response = request("GET", "/api/stream/ws/not-a-stream");

        assertEquals(404, response.statusCode());
        assertTrue(response.body().contains("Unknown stream"));
    }

    @Test
    void testDisabledStreamingClosesWith1011() throws Exception {
        startRelay(false);

        Client client = connect("/api/stream/ws/flow");

        Integer code = client.closeCode.get(5, TimeUnit.SECONDS);
        assertEquals(1011, code);
        assertEquals(RelayGateway.STREAMING_UNAVAILABLE, client.closeReason);
    }

    @Test
    void testStatusAndHealthWhenConnected() throws Exception {
        startRelay(true);
        Client client = connect("/api/stream/ws/flow");
        awaitTrue(() -> registry.connectionCount() == 1, "attached");

        HttpResponse<String> status = request("GET", "/api/stream/status");
        assertEquals(200, status.statusCode());
        JsonNode body = MAPPER.readTree(status.body());
        assertEquals("connected", body.path("status").asText());
        assertTrue(body.path("enabled").asBoolean());
        assertEquals(1, body.path("totalClients").asInt());
        assertEquals(1, body.path("clients").path("channels").path("flow-alerts").asInt());
        assertFalse(status.body().contains("test-token"), "Credential never exposed");

        HttpResponse<String> health = request("GET", "/api/stream/health");
        assertEquals(200, health.statusCode());
        assertEquals("healthy", MAPPER.readTree(health.body()).path("status").asText());

        HttpResponse<String> channels = request("GET", "/api/stream/channels");
        assertEquals(200, channels.statusCode());
        assertTrue(channels.body().contains("/api/stream/ws/flow"));

        client.ws.abort();
    }

    @Test
    void testStatusAndHealthWhenDisabled() throws Exception {
        startRelay(false);

        HttpResponse<String> status = request("GET", "/api/stream/status");
        assertEquals("disabled", MAPPER.readTree(status.body()).path("status").asText());

        assertEquals(503, request("GET", "/api/stream/health").statusCode());
        assertEquals(503, request("POST", "/api/stream/reconnect").statusCode());
    }

    @Test
    void testOperatorReconnectResubscribes() throws Exception {
        startRelay(true);
        connect("/api/stream/ws/dark-pool");
        awaitTrue(() -> provider.count("join", "dark_pool") == 1, "initial join");

        HttpResponse<String> response = request("POST", "/api/stream/reconnect");
        assertEquals(202, response.statusCode());

        awaitTrue(() -> provider.count("join", "dark_pool") == 2, "join resent after reconnect");
        awaitTrue(upstream::isConnected, "connected again");
    }

    @Test
    void testStopClosesDownstreamConnections() throws Exception {
        startRelay(true);
        Client client = connect("/api/stream/ws/congress");
        awaitTrue(() -> registry.connectionCount() == 1, "attached");

        gateway.stop();

        // The listener may go down before the close frame is flushed; either outcome ends the session.
        Integer code = client.closeCode.exceptionally(e -> -1).get(5, TimeUnit.SECONDS);
        assertTrue(code == 1001 || code == -1, "Unexpected close code " + code);
        assertEquals(0, registry.connectionCount());
        assertFalse(upstream.isRunning());
        gateway = null;
    }

    private static final class Client implements WebSocket.Listener {
        final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        final CompletableFuture<Integer> closeCode = new CompletableFuture<>();
        private final StringBuilder buf = new StringBuilder();
        volatile String closeReason;
        volatile boolean paused;
        WebSocket ws;

        /** Stop requesting frames after the first one, leaving data unread in the socket. */
        static Client stalled() {
            Client client = new Client();
            client.paused = true;
            return client;
        }

        void resume() {
            paused = false;
            ws.request(Long.MAX_VALUE);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                messages.add(buf.toString());
                buf.setLength(0);
            }
            if (!paused) {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closeReason = reason;
            closeCode.complete(statusCode);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            closeCode.completeExceptionally(error);
        }
    }
}
