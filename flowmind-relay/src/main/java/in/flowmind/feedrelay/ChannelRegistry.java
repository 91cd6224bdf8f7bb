package in.flowmind.feedrelay;

import com.fasterxml.jackson.databind.JsonNode;
import in.flowmind.domain.stream.RegistryStats;
import in.flowmind.infrastructure.metrics.RelayMetrics;
import in.flowmind.infrastructure.upstream.ChannelSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Channel → downstream connections, ref-counted against the upstream subscription.
 *
 * The first attach to a channel subscribes upstream and the last detach
 * unsubscribes, both inside the same critical section that changes the
 * member set. A channel is therefore upstream-subscribed exactly while it
 * has members, whatever the interleaving of attach and detach calls.
 *
 * Broadcast iterates a snapshot taken under the lock and delivers outside
 * it. A connection that refuses a frame (closed, or its buffer is full) is
 * detached and closed on the spot; the others still receive the frame.
 */
public final class ChannelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    public static final String FAILURE_CLOSED = "CLOSED";
    public static final String FAILURE_OVERFLOW = "OVERFLOW";
    public static final String FAILURE_ERROR = "ERROR";

    private final ChannelSubscriber upstream;
    private final RelayMetrics metrics;

    private final Object lock = new Object();
    private final Map<String, Set<DownstreamConnection>> channels = new HashMap<>();

    private final AtomicLong totalConnects = new AtomicLong();
    private final AtomicLong totalDisconnects = new AtomicLong();
    private final AtomicLong totalMessagesSent = new AtomicLong();
    private final Instant startedAt = Instant.now();

    public ChannelRegistry(ChannelSubscriber upstream, RelayMetrics metrics) {
        this.upstream = upstream;
        this.metrics = metrics;
    }

    /**
     * Attach a connection to a channel, subscribing upstream if it is the channel's first member.
     * Attaching the same connection twice is a no-op.
     */
    public void attach(DownstreamConnection conn, String channel) {
        synchronized (lock) {
            Set<DownstreamConnection> members = channels.get(channel);
            boolean first = members == null;
            if (first) {
                members = new LinkedHashSet<>();
                channels.put(channel, members);
            }
            if (!members.add(conn)) {
                return;
            }

            if (first) {
                try {
                    upstream.subscribe(channel, this::dispatch);
                } catch (RuntimeException e) {
                    channels.remove(channel);
                    log.error("[REGISTRY] Upstream subscribe failed for {}: {}", channel, e.getMessage());
                    throw e;
                }
                log.info("[REGISTRY] Channel {} activated", channel);
            }

            totalConnects.incrementAndGet();
            metrics.recordChannelConnections(channel, members.size());
            log.info("[REGISTRY] {} attached to {} (channel: {}, total: {})",
                conn.id(), channel, members.size(), countLocked());
        }
    }

    /**
     * Detach a connection, unsubscribing upstream if the channel becomes empty.
     *
     * @return false if the connection was not attached to the channel
     */
    public boolean detach(DownstreamConnection conn, String channel) {
        synchronized (lock) {
            Set<DownstreamConnection> members = channels.get(channel);
            if (members == null || !members.remove(conn)) {
                return false;
            }

            totalDisconnects.incrementAndGet();
            metrics.recordChannelConnections(channel, members.size());
            log.info("[REGISTRY] {} detached from {} (channel: {}, total: {})",
                conn.id(), channel, members.size(), countLocked());

            if (members.isEmpty()) {
                channels.remove(channel);
                try {
                    upstream.unsubscribe(channel);
                } catch (RuntimeException e) {
                    log.warn("[REGISTRY] Upstream unsubscribe failed for {}: {}", channel, e.getMessage());
                }
                log.info("[REGISTRY] Channel {} deactivated", channel);
            }
            return true;
        }
    }

    /**
     * Deliver a frame to every connection on the channel.
     *
     * @return number of connections that accepted the frame
     */
    public int broadcast(String channel, String message) {
        List<DownstreamConnection> snapshot;
        synchronized (lock) {
            Set<DownstreamConnection> members = channels.get(channel);
            if (members == null || members.isEmpty()) {
                return 0;
            }
            snapshot = new ArrayList<>(members);
        }

        int delivered = 0;
        for (DownstreamConnection conn : snapshot) {
            String failure = deliver(conn, message);
            if (failure == null) {
                delivered++;
                continue;
            }
            log.warn("[REGISTRY] Dropping {} from {}: {}", conn.id(), channel, failure);
            metrics.recordDeliveryFailure(channel, failure);
            detach(conn, channel);
            conn.close(FAILURE_OVERFLOW.equals(failure) ? "Slow consumer" : "Delivery failed");
        }

        if (delivered > 0) {
            totalMessagesSent.addAndGet(delivered);
            metrics.recordDelivered(channel, delivered);
        }
        return delivered;
    }

    private static String deliver(DownstreamConnection conn, String message) {
        try {
            if (conn.offer(message)) {
                return null;
            }
            return conn.isOpen() ? FAILURE_OVERFLOW : FAILURE_CLOSED;
        } catch (RuntimeException e) {
            log.debug("[REGISTRY] Send to {} threw: {}", conn.id(), e.getMessage());
            return FAILURE_ERROR;
        }
    }

    /**
     * Upstream handler for every active channel.
     */
    void dispatch(String channel, JsonNode payload) {
        String frame = ChannelFrameMapper.toJson(channel, payload, Instant.now());
        int delivered = broadcast(channel, frame);
        log.debug("[REGISTRY] {} → {} clients", channel, delivered);
    }

    /**
     * Detach and close every connection. Used on shutdown.
     */
    public void closeAll(String reason) {
        Map<String, List<DownstreamConnection>> snapshot = new HashMap<>();
        synchronized (lock) {
            channels.forEach((channel, members) -> snapshot.put(channel, new ArrayList<>(members)));
        }
        int closed = 0;
        for (Map.Entry<String, List<DownstreamConnection>> e : snapshot.entrySet()) {
            for (DownstreamConnection conn : e.getValue()) {
                detach(conn, e.getKey());
                conn.close(reason);
                closed++;
            }
        }
        log.info("[REGISTRY] Closed {} downstream connections", closed);
    }

    public int connectionCount() {
        synchronized (lock) {
            return countLocked();
        }
    }

    public int connectionCount(String channel) {
        synchronized (lock) {
            Set<DownstreamConnection> members = channels.get(channel);
            return members == null ? 0 : members.size();
        }
    }

    public boolean isActive(String channel) {
        synchronized (lock) {
            return channels.containsKey(channel);
        }
    }

    /**
     * Active channels with their connection counts, sorted by name.
     */
    public Map<String, Integer> channelCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        synchronized (lock) {
            channels.forEach((channel, members) -> counts.put(channel, members.size()));
        }
        return Collections.unmodifiableMap(counts);
    }

    public RegistryStats stats() {
        Map<String, Integer> counts = channelCounts();
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        long uptimeMillis = Duration.between(startedAt, Instant.now()).toMillis();
        long sent = totalMessagesSent.get();
        double perSecond = uptimeMillis > 0 ? Math.round(sent * 100_000.0 / uptimeMillis) / 100.0 : 0.0;
        return new RegistryStats(
            total,
            totalConnects.get(),
            totalDisconnects.get(),
            sent,
            counts,
            uptimeMillis / 1000,
            perSecond
        );
    }

    private int countLocked() {
        int n = 0;
        for (Set<DownstreamConnection> members : channels.values()) {
            n += members.size();
        }
        return n;
    }
}
