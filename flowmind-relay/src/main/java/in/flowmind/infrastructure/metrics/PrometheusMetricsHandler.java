package in.flowmind.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * HTTP handler for the Prometheus /metrics endpoint.
 *
 * Honours the scraper's Accept header (text 0.0.4 or OpenMetrics) and the
 * standard {@code name[]} query filter.
 *
 * Example output:
 * <pre>
 * # HELP relay_upstream_frames_total Total number of inbound provider frames by outcome
 * # TYPE relay_upstream_frames_total counter
 * relay_upstream_frames_total{outcome="dispatched"} 1234.0
 * relay_upstream_frames_total{outcome="unrouted"} 3.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        try {
            StringWriter writer = new StringWriter();
            TextFormat.writeFormat(contentType, writer, registry.filteredMetricFamilySamples(names));
            String body = writer.toString();

            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
            exchange.getResponseSender().send(body, StandardCharsets.UTF_8);

            log.debug("[METRICS] Served {} bytes ({} filter names)", body.length(), names.size());
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Set<String> names = new HashSet<>();
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        if (values != null) {
            names.addAll(values);
        }
        return names;
    }
}
