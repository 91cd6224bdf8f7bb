package in.flowmind.infrastructure.metrics;

/**
 * Relay metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Upstream connection state and connection events
 * - Reconnect attempts
 * - Inbound frames by outcome
 * - Downstream connections per channel
 * - Delivered frames and delivery failures
 */
public interface RelayMetrics {

    /**
     * Record a provider connection event.
     *
     * @param event Connection event type
     */
    void recordConnectionEvent(ConnectionEvent event);

    /**
     * Record a reconnect attempt about to be made.
     *
     * @param attemptNumber Attempt number since the last successful connect (1, 2, 3...)
     */
    void recordReconnectAttempt(int attemptNumber);

    /**
     * Record an inbound provider frame.
     *
     * @param outcome What happened to the frame
     */
    void recordInboundFrame(FrameOutcome outcome);

    /**
     * Record the current number of downstream connections on a channel.
     */
    void recordChannelConnections(String channel, int count);

    /**
     * Record frames handed to downstream connections.
     */
    void recordDelivered(String channel, int count);

    /**
     * Record a downstream delivery failure.
     *
     * @param reason CLOSED, OVERFLOW or ERROR
     */
    void recordDeliveryFailure(String channel, String reason);

    // ════════════════════════════════════════════════════════════════════════
    // ENUMS
    // ════════════════════════════════════════════════════════════════════════

    enum ConnectionEvent {
        CONNECTING,
        CONNECTED,
        CONNECT_FAILED,
        DISCONNECTED,
        RECONNECTING,
        HEARTBEAT_TIMEOUT,
        AUTH_REJECTED,
        GAVE_UP
    }

    enum FrameOutcome {
        DISPATCHED,
        UNROUTED,
        MALFORMED,
        HANDLER_ERROR
    }

    RelayMetrics NOOP = new RelayMetrics() {
        @Override
        public void recordConnectionEvent(ConnectionEvent event) {}

        @Override
        public void recordReconnectAttempt(int attemptNumber) {}

        @Override
        public void recordInboundFrame(FrameOutcome outcome) {}

        @Override
        public void recordChannelConnections(String channel, int count) {}

        @Override
        public void recordDelivered(String channel, int count) {}

        @Override
        public void recordDeliveryFailure(String channel, String reason) {}
    };
}
