package in.flowmind.domain.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import in.flowmind.infrastructure.upstream.UpstreamStats;

/**
 * Payload of GET /api/stream/status.
 *
 * @param status   connected, disconnected or disabled
 * @param upstream null while streaming is disabled
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelayStatus(
    String status,
    boolean enabled,
    UpstreamStats upstream,
    RegistryStats clients,
    int totalClients
) {
    public static final String CONNECTED = "connected";
    public static final String DISCONNECTED = "disconnected";
    public static final String DISABLED = "disabled";
}
