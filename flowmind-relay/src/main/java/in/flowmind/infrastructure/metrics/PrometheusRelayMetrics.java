package in.flowmind.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus implementation of RelayMetrics.
 *
 * Exposed at /metrics by {@link PrometheusMetricsHandler}.
 *
 * Key Metrics:
 * - relay_upstream_connected - 1 while the provider connection is up
 * - relay_upstream_connection_events_total{event}
 * - relay_upstream_reconnect_attempts_total
 * - relay_upstream_reconnect_attempt - distribution of attempt numbers
 * - relay_upstream_frames_total{outcome}
 * - relay_downstream_connections{channel}
 * - relay_downstream_frames_total{channel}
 * - relay_downstream_failures_total{channel, reason}
 */
public class PrometheusRelayMetrics implements RelayMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusRelayMetrics.class);

    private final CollectorRegistry registry;

    private final Gauge upstreamConnected;
    private final Counter connectionEventCounter;
    private final Counter reconnectCounter;
    private final Histogram reconnectAttempt;
    private final Counter frameCounter;

    private final Gauge channelConnections;
    private final Counter deliveredCounter;
    private final Counter deliveryFailureCounter;

    public PrometheusRelayMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusRelayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.upstreamConnected = Gauge.build()
            .name("relay_upstream_connected")
            .help("Provider connection status (1=connected, 0=not connected)")
            .register(registry);

        this.connectionEventCounter = Counter.build()
            .name("relay_upstream_connection_events_total")
            .help("Total number of provider connection events")
            .labelNames("event")
            .register(registry);

        this.reconnectCounter = Counter.build()
            .name("relay_upstream_reconnect_attempts_total")
            .help("Total number of reconnect attempts")
            .register(registry);

        this.reconnectAttempt = Histogram.build()
            .name("relay_upstream_reconnect_attempt")
            .help("Attempt number of each reconnect since the last successful connect")
            .buckets(1, 2, 3, 5, 10)
            .register(registry);

        this.frameCounter = Counter.build()
            .name("relay_upstream_frames_total")
            .help("Total number of inbound provider frames by outcome")
            .labelNames("outcome")
            .register(registry);

        this.channelConnections = Gauge.build()
            .name("relay_downstream_connections")
            .help("Current downstream connections per channel")
            .labelNames("channel")
            .register(registry);

        this.deliveredCounter = Counter.build()
            .name("relay_downstream_frames_total")
            .help("Total number of frames handed to downstream connections")
            .labelNames("channel")
            .register(registry);

        this.deliveryFailureCounter = Counter.build()
            .name("relay_downstream_failures_total")
            .help("Total number of downstream delivery failures")
            .labelNames("channel", "reason")
            .register(registry);

        log.info("[PrometheusRelayMetrics] Initialized");
    }

    @Override
    public void recordConnectionEvent(ConnectionEvent event) {
        connectionEventCounter.labels(event.name()).inc();

        if (event == ConnectionEvent.CONNECTED) {
            upstreamConnected.set(1);
        } else if (event != ConnectionEvent.CONNECTING) {
            upstreamConnected.set(0);
        }
    }

    @Override
    public void recordReconnectAttempt(int attemptNumber) {
        reconnectCounter.inc();
        reconnectAttempt.observe(attemptNumber);
    }

    @Override
    public void recordInboundFrame(FrameOutcome outcome) {
        frameCounter.labels(outcome.name().toLowerCase()).inc();
    }

    @Override
    public void recordChannelConnections(String channel, int count) {
        if (count == 0) {
            channelConnections.remove(channel);
        } else {
            channelConnections.labels(channel).set(count);
        }
    }

    @Override
    public void recordDelivered(String channel, int count) {
        deliveredCounter.labels(channel).inc(count);
    }

    @Override
    public void recordDeliveryFailure(String channel, String reason) {
        deliveryFailureCounter.labels(channel, reason).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
