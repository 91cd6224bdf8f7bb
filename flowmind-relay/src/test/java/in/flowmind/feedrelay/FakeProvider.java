package in.flowmind.feedrelay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Provider stand-in: an Undertow WebSocket server that records join/leave frames
 * and pushes [channel, payload] frames to whoever is connected.
 */
final class FakeProvider {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> controlFrames = new CopyOnWriteArrayList<>();
    private final List<String> queryStrings = new CopyOnWriteArrayList<>();
    private volatile WebSocketChannel connection;
    private Undertow server;

    int start() {
        server = Undertow.builder()
            .addHttpListener(0, "localhost")
            .setHandler(Handlers.path().addExactPath("/socket", Handlers.websocket((exchange, channel) -> {
                queryStrings.add(exchange.getQueryString());
                connection = channel;
                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        controlFrames.add(message.getData());
                    }
                });
                channel.resumeReceives();
            })))
            .build();
        server.start();
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    void stop() {
        if (server != null) {
            server.stop();
        }
    }

    void push(String channel, String payloadJson) {
        WebSocketChannel ch = connection;
        if (ch == null) {
            throw new IllegalStateException("No relay connected to provider");
        }
        WebSockets.sendText("[\"" + channel + "\", " + payloadJson + "]", ch, null);
    }

    long count(String action, String channel) {
        return controlFrames.stream().filter(text -> {
            try {
                JsonNode node = MAPPER.readTree(text);
                return action.equals(node.path("msg_type").asText()) && channel.equals(node.path("channel").asText());
            } catch (IOException e) {
                return false;
            }
        }).count();
    }

    List<String> queryStrings() {
        return queryStrings;
    }
}
