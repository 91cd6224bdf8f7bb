package in.flowmind.domain.stream;

import java.util.Map;

/**
 * Downstream side of the relay: who is attached where, and how much has been delivered.
 */
public record RegistryStats(
    int totalConnections,
    long totalConnects,
    long totalDisconnects,
    long totalMessagesSent,
    Map<String, Integer> channels,
    long uptimeSeconds,
    double messagesPerSecond
) {
}
