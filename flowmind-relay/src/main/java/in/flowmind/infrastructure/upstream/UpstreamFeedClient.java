package in.flowmind.infrastructure.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.flowmind.config.RelayConfig;
import in.flowmind.infrastructure.metrics.RelayMetrics;
import in.flowmind.infrastructure.metrics.RelayMetrics.ConnectionEvent;
import in.flowmind.infrastructure.metrics.RelayMetrics.FrameOutcome;
import in.flowmind.infrastructure.upstream.common.ReconnectionPolicy;
import in.flowmind.infrastructure.upstream.transport.UpstreamListener;
import in.flowmind.infrastructure.upstream.transport.UpstreamSession;
import in.flowmind.infrastructure.upstream.transport.UpstreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single streaming connection to the provider.
 *
 * Architecture:
 *   provider → transport listener → inbound queue → control loop → channel handler
 *
 * A single control-loop thread drives the state machine
 * DISCONNECTED → CONNECTING → CONNECTED → RECONNECTING → ... Transport
 * callbacks never act on the connection themselves; they only enqueue
 * events tagged with the session generation they belong to, so events from
 * a dead session are ignored and only the loop thread ever reconnects.
 *
 * The desired subscription set ({@code channel → handler}) survives
 * reconnects. Every successful connect re-joins the whole set under the
 * subscription lock, so a concurrent {@link #subscribe} is either deferred
 * into that pass or sent after it, never both.
 *
 * Wire protocol:
 * <pre>
 *   → {"channel": "gex:SPY", "msg_type": "join"}
 *   → {"channel": "gex:SPY", "msg_type": "leave"}
 *   ← ["gex:SPY", {...payload...}]
 * </pre>
 */
public final class UpstreamFeedClient implements ChannelSubscriber {
    private static final Logger log = LoggerFactory.getLogger(UpstreamFeedClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Duration LOOP_JOIN_TIMEOUT = Duration.ofSeconds(5);
    private static final int LOGGED_FRAME_CHARS = 100;
    private static final int DEFAULT_INBOUND_CAPACITY = 1024;
    private static final long ENQUEUE_RETRY_MS = 100;

    private final String provider;
    private final URI target;
    private final UpstreamTransport transport;
    private final ReconnectionPolicy policy;
    private final Duration idleTimeout;
    private final Duration pongTimeout;
    private final RelayMetrics metrics;

    // Desired subscription set. Mutated only under subscriptionLock.
    private final ConcurrentMap<String, ChannelHandler> handlers = new ConcurrentHashMap<>();
    private final Object subscriptionLock = new Object();
    private final Object connectLock = new Object();

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    // Bounded: a full queue blocks the transport thread, which withholds read demand from the provider.
    private final BlockingQueue<InboundEvent> inbound;
    private final AtomicLong generations = new AtomicLong();
    private final AtomicLong framesReceived = new AtomicLong();

    private volatile UpstreamSession session;
    private volatile long currentGeneration = -1;
    private volatile boolean running = false;
    private volatile boolean shutdown = false;
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile Thread loopThread;
    private volatile Instant lastMessageAt;
    private volatile String terminalReason;

    public UpstreamFeedClient(String provider, URI target, UpstreamTransport transport,
                              ReconnectionPolicy policy, Duration idleTimeout, Duration pongTimeout,
                              RelayMetrics metrics) {
        this(provider, target, transport, policy, idleTimeout, pongTimeout, metrics, DEFAULT_INBOUND_CAPACITY);
    }

    UpstreamFeedClient(String provider, URI target, UpstreamTransport transport,
                       ReconnectionPolicy policy, Duration idleTimeout, Duration pongTimeout,
                       RelayMetrics metrics, int inboundCapacity) {
        if (inboundCapacity < 1) {
            throw new IllegalArgumentException("inboundCapacity must be >= 1");
        }
        this.inbound = new LinkedBlockingQueue<>(inboundCapacity);
        this.provider = provider;
        this.target = target;
        this.transport = transport;
        this.policy = policy;
        this.idleTimeout = idleTimeout;
        this.pongTimeout = pongTimeout;
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Start the control loop on its own thread. The loop makes the first connect.
     */
    public synchronized void start() {
        if (shutdown) {
            throw new IllegalStateException("Client has been shut down");
        }
        if (running) {
            log.warn("[UPSTREAM] Control loop already running");
            return;
        }
        running = true;
        terminalReason = null;
        stopSignal = new CountDownLatch(1);

        Thread t = new Thread(this::runControlLoop, "upstream-feed-" + provider.toLowerCase());
        t.setDaemon(true);
        loopThread = t;
        t.start();
    }

    /**
     * Open the transport and transition to CONNECTED, joining every desired channel.
     *
     * @throws UpstreamAuthenticationException if the provider rejects the credential
     * @throws UpstreamConnectException on any other connection failure, or when called while the
     *         control loop is running (the loop owns the connection; use {@link #forceReconnect()})
     * @throws IllegalStateException if already connected or connecting
     */
    public void connect() {
        if (running && Thread.currentThread() != loopThread) {
            throw new UpstreamConnectException(provider,
                "Control loop owns the connection (state=" + state.get() + "), use forceReconnect()");
        }
        synchronized (connectLock) {
            if (Thread.currentThread() == loopThread && state.get() == ConnectionState.CONNECTED) {
                log.info("[UPSTREAM] Adopting session opened before the control loop started");
                return;
            }
            openSession();
        }
    }

    private void openSession() {
        ConnectionState from = state.get();
        if (from == ConnectionState.CONNECTED || from == ConnectionState.CONNECTING) {
            throw new IllegalStateException("connect() while " + from);
        }
        if (shutdown) {
            throw new UpstreamConnectException(provider, "Client has been shut down");
        }
        if (!state.compareAndSet(from, ConnectionState.CONNECTING)) {
            throw new IllegalStateException("Concurrent state change during connect()");
        }
        metrics.recordConnectionEvent(ConnectionEvent.CONNECTING);
        log.info("[UPSTREAM] Connecting to {}...", provider);

        long generation = generations.incrementAndGet();
        UpstreamSession opened;
        try {
            opened = transport.open(target, new SessionListener(generation));
        } catch (UpstreamAuthenticationException e) {
            state.set(from);
            metrics.recordConnectionEvent(ConnectionEvent.AUTH_REJECTED);
            log.error("[UPSTREAM] Credential rejected by {}: {}", provider, e.getMessage());
            throw e;
        } catch (UpstreamConnectException e) {
            state.set(from);
            metrics.recordConnectionEvent(ConnectionEvent.CONNECT_FAILED);
            log.warn("[UPSTREAM] Connect failed: {}", e.getMessage());
            throw e;
        }

        synchronized (subscriptionLock) {
            if (shutdown) {
                opened.abort();
                state.set(ConnectionState.DISCONNECTED);
                throw new UpstreamConnectException(provider, "Client shut down while connecting");
            }
            currentGeneration = generation;
            session = opened;
            lastMessageAt = Instant.now();
            policy.recordSuccess();
            terminalReason = null;
            state.set(ConnectionState.CONNECTED);
            metrics.recordConnectionEvent(ConnectionEvent.CONNECTED);
            log.info("[UPSTREAM] ✅ Connected to {}", provider);

            if (!handlers.isEmpty()) {
                log.info("[UPSTREAM] Resubscribing to {} channels...", handlers.size());
                for (String channel : handlers.keySet()) {
                    try {
                        sendControl(opened, channel, "join");
                        log.info("[UPSTREAM] Resubscribed to: {}", channel);
                    } catch (UpstreamSubscriptionException e) {
                        log.error("[UPSTREAM] Failed to resubscribe to {}: {}", channel, e.getMessage());
                    }
                }
            }
        }
    }

    /**
     * Stop the control loop, leave every desired channel (best-effort) and close the connection.
     * Returns promptly even while a backoff delay is pending. Final: the client cannot be restarted.
     */
    public void shutdown() {
        Thread loop;
        synchronized (this) {
            if (shutdown) {
                return;
            }
            log.info("[UPSTREAM] Shutting down...");
            shutdown = true;
            running = false;
            stopSignal.countDown();
            inbound.offer(InboundEvent.wake());
            loop = loopThread;
        }

        if (loop != null && loop != Thread.currentThread()) {
            try {
                loop.join(LOOP_JOIN_TIMEOUT.toMillis());
                if (loop.isAlive()) {
                    log.warn("[UPSTREAM] Control loop did not stop within {}s", LOOP_JOIN_TIMEOUT.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        UpstreamSession current;
        synchronized (subscriptionLock) {
            current = session;
            if (current != null && state.get() == ConnectionState.CONNECTED) {
                int left = 0;
                for (String channel : handlers.keySet()) {
                    try {
                        sendControl(current, channel, "leave");
                        left++;
                    } catch (UpstreamSubscriptionException e) {
                        log.warn("[UPSTREAM] Skipping remaining leave frames: {}", e.getMessage());
                        break;
                    }
                }
                log.info("[UPSTREAM] Sent leave for {}/{} channels", left, handlers.size());
            }
            handlers.clear();
            session = null;
            currentGeneration = -1;
            state.set(ConnectionState.DISCONNECTED);
        }

        if (current != null) {
            current.close();
        }
        metrics.recordConnectionEvent(ConnectionEvent.DISCONNECTED);
        log.info("[UPSTREAM] Disconnected");
    }

    /**
     * Drop the current session and go through the reconnect procedure.
     * After terminal failure this resets the attempt counter and restarts the control loop.
     *
     * @return false if a reconnect is already in progress or the client is shut down
     */
    public synchronized boolean forceReconnect() {
        if (shutdown) {
            return false;
        }
        if (!running) {
            log.info("[UPSTREAM] Restarting control loop after terminal failure");
            Thread previous = loopThread;
            if (previous != null && previous.isAlive()) {
                try {
                    previous.join(LOOP_JOIN_TIMEOUT.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
                if (previous.isAlive()) {
                    return false;
                }
            }
            policy.reset();
            start();
            return true;
        }
        if (state.get() == ConnectionState.CONNECTED) {
            if (!inbound.offer(new InboundEvent(currentGeneration, Kind.FORCE, null, 0, null))) {
                log.warn("[UPSTREAM] Inbound queue full, forced reconnect not queued");
                return false;
            }
            log.info("[UPSTREAM] Forcing reconnection...");
            return true;
        }
        log.info("[UPSTREAM] Reconnect already in progress (state={})", state.get());
        return false;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SUBSCRIPTION MANAGEMENT
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void subscribe(String channel, ChannelHandler handler) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(handler, "handler");

        synchronized (subscriptionLock) {
            ChannelHandler previous = handlers.put(channel, handler);
            if (previous != null) {
                log.debug("[UPSTREAM] Handler replaced for {}", channel);
                return;
            }
            UpstreamSession current = session;
            if (state.get() == ConnectionState.CONNECTED && current != null) {
                try {
                    sendControl(current, channel, "join");
                    log.info("[UPSTREAM] 📡 Subscribed to channel: {}", channel);
                } catch (UpstreamSubscriptionException e) {
                    log.warn("[UPSTREAM] Join for {} not sent, will retry on reconnect: {}", channel, e.getMessage());
                }
            } else {
                log.info("[UPSTREAM] Subscription to {} deferred until connected (state={})", channel, state.get());
            }
        }
    }

    @Override
    public void unsubscribe(String channel) {
        synchronized (subscriptionLock) {
            if (handlers.remove(channel) == null) {
                return;
            }
            UpstreamSession current = session;
            if (state.get() == ConnectionState.CONNECTED && current != null) {
                try {
                    sendControl(current, channel, "leave");
                } catch (UpstreamSubscriptionException e) {
                    log.warn("[UPSTREAM] Failed to send unsubscribe for {}: {}", channel, e.getMessage());
                }
            }
            log.info("[UPSTREAM] 📡 Unsubscribed from channel: {}", channel);
        }
    }

    private void sendControl(UpstreamSession target, String channel, String action) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("channel", channel);
        frame.put("msg_type", action);
        try {
            target.sendText(MAPPER.writeValueAsString(frame));
        } catch (IOException e) {
            throw new UpstreamSubscriptionException(provider, channel, action, e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONTROL LOOP
    // ═══════════════════════════════════════════════════════════════════════

    private void runControlLoop() {
        log.info("[UPSTREAM] Control loop started");
        try {
            if (state.get() != ConnectionState.CONNECTED && !firstConnect()) {
                return;
            }
            while (running) {
                listen();
                if (!running) {
                    break;
                }
                if (!reconnect()) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            log.error("[UPSTREAM] Control loop crashed", e);
            giveUp("Control loop crashed: " + e.getMessage());
        } finally {
            log.info("[UPSTREAM] Control loop stopped (state={})", state.get());
        }
    }

    private boolean firstConnect() {
        try {
            connect();
            return true;
        } catch (UpstreamAuthenticationException e) {
            giveUp(e.getMessage());
            return false;
        } catch (UpstreamConnectException e) {
            return running && reconnect();
        }
    }

    /**
     * Receive loop for the current session. Returns when the client is stopping or the session is lost;
     * in the latter case the state is RECONNECTING on return.
     */
    public void listen() {
        UpstreamSession current = session;
        long generation = currentGeneration;
        if (current == null) {
            return;
        }

        while (running) {
            InboundEvent event;
            try {
                event = inbound.poll(idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running = false;
                return;
            }

            if (event == null) {
                log.debug("[UPSTREAM] No messages for {}s, checking connection...", idleTimeout.toSeconds());
                if (!probe(current, generation)) {
                    metrics.recordConnectionEvent(ConnectionEvent.HEARTBEAT_TIMEOUT);
                    connectionLost(current, "keepalive not acknowledged within " + pongTimeout.toSeconds() + "s");
                    return;
                }
                continue;
            }
            if (event.kind() == Kind.WAKE || event.generation() != generation) {
                continue;
            }

            switch (event.kind()) {
                case TEXT -> handleFrame(event.text());
                case PONG -> log.trace("[UPSTREAM] Unsolicited pong");
                case CLOSED -> {
                    connectionLost(current, "closed by provider (" + event.statusCode() + " " + event.text() + ")");
                    return;
                }
                case ERROR -> {
                    connectionLost(current, "transport error: " + describe(event.error()));
                    return;
                }
                case FORCE -> {
                    connectionLost(current, "forced reconnect");
                    return;
                }
                default -> log.trace("[UPSTREAM] Ignoring {}", event.kind());
            }
        }
    }

    /**
     * Send a keepalive ping and wait for its acknowledgment. Any frame of the session counts as proof of life.
     */
    private boolean probe(UpstreamSession current, long generation) {
        try {
            current.sendPing();
        } catch (IOException e) {
            log.warn("[UPSTREAM] Keepalive ping failed: {}", e.getMessage());
            return false;
        }

        long deadline = System.nanoTime() + pongTimeout.toNanos();
        while (running) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            InboundEvent event;
            try {
                event = inbound.poll(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running = false;
                return true;
            }
            if (event == null) {
                return false;
            }
            if (event.kind() == Kind.WAKE || event.generation() != generation) {
                continue;
            }
            switch (event.kind()) {
                case PONG -> {
                    log.debug("[UPSTREAM] Connection alive (pong received)");
                    return true;
                }
                case TEXT -> {
                    handleFrame(event.text());
                    return true;
                }
                default -> {
                    return false;
                }
            }
        }
        return true;
    }

    private void connectionLost(UpstreamSession current, String reason) {
        if (!state.compareAndSet(ConnectionState.CONNECTED, ConnectionState.RECONNECTING)) {
            log.debug("[UPSTREAM] Connection loss ignored in state {}", state.get());
            return;
        }
        synchronized (subscriptionLock) {
            if (session == current) {
                session = null;
                currentGeneration = -1;
            }
        }
        current.abort();
        metrics.recordConnectionEvent(ConnectionEvent.DISCONNECTED);
        log.warn("[UPSTREAM] WebSocket connection lost: {}", reason);
    }

    /**
     * Exponential backoff reconnect. Returns true once connected, false on terminal failure or stop.
     */
    private boolean reconnect() {
        while (running) {
            int attempt = policy.recordFailure();
            if (policy.isExhausted()) {
                giveUp("Max reconnection attempts (" + policy.getMaxAttempts() + ") reached");
                return false;
            }

            Duration delay = policy.delayFor(attempt);
            state.set(ConnectionState.RECONNECTING);
            metrics.recordConnectionEvent(ConnectionEvent.RECONNECTING);
            metrics.recordReconnectAttempt(attempt);
            log.info("[UPSTREAM] Reconnecting in {}s (attempt {}/{})",
                String.format("%.1f", delay.toMillis() / 1000.0), attempt, policy.getMaxAttempts());

            if (awaitStop(delay)) {
                return false;
            }
            if (state.get() == ConnectionState.CONNECTED) {
                log.info("[UPSTREAM] Already connected, skipping reconnect attempt {}", attempt);
                return true;
            }

            try {
                connect();
                return true;
            } catch (UpstreamAuthenticationException e) {
                giveUp(e.getMessage());
                return false;
            } catch (UpstreamConnectException e) {
                log.warn("[UPSTREAM] Reconnect attempt {} failed: {}", attempt, e.getMessage());
            }
        }
        return false;
    }

    /**
     * @return true if shutdown was requested before the delay elapsed
     */
    private boolean awaitStop(Duration delay) {
        try {
            return stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            return true;
        }
    }

    private void giveUp(String reason) {
        state.set(ConnectionState.DISCONNECTED);
        terminalReason = reason;
        metrics.recordConnectionEvent(ConnectionEvent.GAVE_UP);
        log.error("[UPSTREAM] ❌ Giving up on {}: {}", provider, reason);
        running = false;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INBOUND FRAMES
    // ═══════════════════════════════════════════════════════════════════════

    private void handleFrame(String text) {
        lastMessageAt = Instant.now();
        framesReceived.incrementAndGet();

        JsonNode data;
        try {
            data = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            metrics.recordInboundFrame(FrameOutcome.MALFORMED);
            log.warn("[UPSTREAM] Dropping unparseable frame: {}", e.getOriginalMessage());
            return;
        }

        if (data == null || !data.isArray() || data.size() < 2 || !data.get(0).isTextual()) {
            metrics.recordInboundFrame(FrameOutcome.MALFORMED);
            log.warn("[UPSTREAM] Unexpected message format: {}", abbreviate(text));
            return;
        }

        String channel = data.get(0).asText();
        JsonNode payload = data.get(1);

        ChannelHandler handler = handlers.get(channel);
        if (handler == null) {
            metrics.recordInboundFrame(FrameOutcome.UNROUTED);
            log.debug("[UPSTREAM] No handler registered for channel: {}", channel);
            return;
        }

        if (log.isTraceEnabled()) {
            log.trace("[UPSTREAM] 📬 Received on {}: {}", channel, abbreviate(payload.toString()));
        }

        try {
            handler.onMessage(channel, payload);
            metrics.recordInboundFrame(FrameOutcome.DISPATCHED);
        } catch (RuntimeException e) {
            metrics.recordInboundFrame(FrameOutcome.HANDLER_ERROR);
            log.error("[UPSTREAM] Error in handler for {}: {}", channel, e.getMessage(), e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= LOGGED_FRAME_CHARS ? text : text.substring(0, LOGGED_FRAME_CHARS) + "...";
    }

    private static String describe(Throwable error) {
        return error == null ? "unknown" : error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // STATUS
    // ═══════════════════════════════════════════════════════════════════════

    public ConnectionState connectionState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == ConnectionState.CONNECTED;
    }

    public boolean isRunning() {
        return running;
    }

    public int reconnectAttempts() {
        return policy.getAttemptCount();
    }

    /**
     * Reason for terminal DISCONNECTED, or null when not in terminal failure.
     */
    public String terminalReason() {
        return terminalReason;
    }

    public Set<String> desiredChannels() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }

    public UpstreamStats stats() {
        Instant last = lastMessageAt;
        Double secondsAgo = last == null
            ? null
            : Math.round(Duration.between(last, Instant.now()).toMillis() / 100.0) / 10.0;
        List<String> channels = new ArrayList<>(desiredChannels());
        ConnectionState current = state.get();
        return new UpstreamStats(
            current == ConnectionState.CONNECTED,
            running,
            current.label(),
            policy.getAttemptCount(),
            policy.getMaxAttempts(),
            channels,
            channels.size(),
            secondsAgo,
            framesReceived.get(),
            RelayConfig.maskUrl(target.toString()),
            terminalReason
        );
    }

    // ═══════════════════════════════════════════════════════════════════════
    // TRANSPORT EVENTS
    // ═══════════════════════════════════════════════════════════════════════

    private enum Kind { TEXT, PONG, CLOSED, ERROR, FORCE, WAKE }

    private record InboundEvent(long generation, Kind kind, String text, int statusCode, Throwable error) {
        static InboundEvent wake() {
            return new InboundEvent(-1, Kind.WAKE, null, 0, null);
        }
    }

    private final class SessionListener implements UpstreamListener {
        private final long generation;

        private SessionListener(long generation) {
            this.generation = generation;
        }

        @Override
        public void onText(String text) {
            enqueue(new InboundEvent(generation, Kind.TEXT, text, 0, null));
        }

        @Override
        public void onPong() {
            enqueue(new InboundEvent(generation, Kind.PONG, null, 0, null));
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            enqueue(new InboundEvent(generation, Kind.CLOSED, reason, statusCode, null));
        }

        @Override
        public void onError(Throwable error) {
            enqueue(new InboundEvent(generation, Kind.ERROR, null, 0, error));
        }

        /**
         * Blocks while the queue is full. Gives up once nobody will drain it for this session.
         */
        private void enqueue(InboundEvent event) {
            try {
                while (!inbound.offer(event, ENQUEUE_RETRY_MS, TimeUnit.MILLISECONDS)) {
                    if (!running || currentGeneration != generation) {
                        log.debug("[UPSTREAM] Dropping {} for inactive session {}", event.kind(), generation);
                        return;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("[UPSTREAM] Interrupted while queueing {}", event.kind());
            }
        }
    }
}
