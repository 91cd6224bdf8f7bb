package in.flowmind.feedrelay;

import in.flowmind.domain.stream.ChannelDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps downstream WebSocket paths to upstream channel names.
 *
 * <pre>
 *   /api/stream/ws/flow                  → flow-alerts
 *   /api/stream/ws/gex/{ticker}          → gex:{TICKER}
 *   /api/stream/ws/option-trades/{ticker} → option_trades:{TICKER}
 *   /api/stream/ws/market-movers         → market_movers
 *   /api/stream/ws/dark-pool             → dark_pool
 *   /api/stream/ws/congress              → congress_trades
 *   /api/stream/ws/channel/{name}        → {name}
 * </pre>
 */
public final class StreamRoutes {

    public static final String PREFIX = "/api/stream/ws";

    private static final Pattern TICKER = Pattern.compile("[A-Za-z0-9.\\-]{1,16}");
    private static final Pattern CHANNEL_NAME = Pattern.compile("[A-Za-z0-9_.:\\-]{1,64}");

    private static final List<Route> ROUTES = List.of(
        Route.fixed("flow", "flow-alerts", "Real-time options flow alerts"),
        Route.ticker("gex", "gex:", "Gamma exposure updates for a ticker"),
        Route.ticker("option-trades", "option_trades:", "Option trades for a ticker"),
        Route.fixed("market-movers", "market_movers", "Market movers"),
        Route.fixed("dark-pool", "dark_pool", "Dark pool prints"),
        Route.fixed("congress", "congress_trades", "Congressional trading disclosures")
    );

    private static final String GENERIC_SEGMENT = "channel";

    private StreamRoutes() {}

    /**
     * Resolve a path, with or without the {@link #PREFIX}, to its upstream channel.
     *
     * @return empty for unknown paths or malformed parameters
     */
    public static Optional<String> resolve(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String p = path;
        if (p.startsWith(PREFIX)) {
            p = p.substring(PREFIX.length());
        }
        if (p.startsWith("/")) {
            p = p.substring(1);
        }
        if (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        if (p.isEmpty()) {
            return Optional.empty();
        }

        String[] parts = p.split("/", -1);
        if (parts.length == 1) {
            for (Route r : ROUTES) {
                if (!r.parameterized() && r.segment().equals(parts[0])) {
                    return Optional.of(r.channel());
                }
            }
            return Optional.empty();
        }
        if (parts.length != 2) {
            return Optional.empty();
        }

        String segment = parts[0];
        String param = parts[1];
        if (GENERIC_SEGMENT.equals(segment)) {
            return CHANNEL_NAME.matcher(param).matches() ? Optional.of(param) : Optional.empty();
        }
        for (Route r : ROUTES) {
            if (r.parameterized() && r.segment().equals(segment)) {
                if (!TICKER.matcher(param).matches()) {
                    return Optional.empty();
                }
                return Optional.of(r.channel() + param.toUpperCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    /**
     * Route catalogue with live subscriber counts. Active channels no named route covers
     * are listed under the generic path.
     */
    public static List<ChannelDescriptor> catalogue(Map<String, Integer> activeCounts) {
        List<ChannelDescriptor> result = new ArrayList<>();
        for (Route r : ROUTES) {
            int subscribers = 0;
            for (Map.Entry<String, Integer> e : activeCounts.entrySet()) {
                if (r.covers(e.getKey())) {
                    subscribers += e.getValue();
                }
            }
            result.add(new ChannelDescriptor(r.path(), r.displayChannel(), r.description(), subscribers));
        }
        for (Map.Entry<String, Integer> e : activeCounts.entrySet()) {
            boolean covered = ROUTES.stream().anyMatch(r -> r.covers(e.getKey()));
            if (!covered) {
                result.add(new ChannelDescriptor(PREFIX + "/" + GENERIC_SEGMENT + "/" + e.getKey(),
                    e.getKey(), "Active channel", e.getValue()));
            }
        }
        return result;
    }

    private record Route(String segment, String channel, boolean parameterized, String description) {

        static Route fixed(String segment, String channel, String description) {
            return new Route(segment, channel, false, description);
        }

        static Route ticker(String segment, String channelPrefix, String description) {
            return new Route(segment, channelPrefix, true, description);
        }

        boolean covers(String activeChannel) {
            return parameterized ? activeChannel.startsWith(channel) : activeChannel.equals(channel);
        }

        String path() {
            return PREFIX + "/" + segment + (parameterized ? "/{ticker}" : "");
        }

        String displayChannel() {
            return parameterized ? channel + "{TICKER}" : channel;
        }
    }
}
