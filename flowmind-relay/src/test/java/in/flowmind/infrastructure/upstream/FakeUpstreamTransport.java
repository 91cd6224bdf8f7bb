package in.flowmind.infrastructure.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.flowmind.infrastructure.upstream.transport.UpstreamListener;
import in.flowmind.infrastructure.upstream.transport.UpstreamSession;
import in.flowmind.infrastructure.upstream.transport.UpstreamTransport;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory provider transport. Failures can be scripted per open() call.
 */
final class FakeUpstreamTransport implements UpstreamTransport {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ConcurrentLinkedDeque<RuntimeException> scriptedFailures = new ConcurrentLinkedDeque<>();
    private final List<FakeSession> sessions = new CopyOnWriteArrayList<>();
    private final AtomicInteger openCalls = new AtomicInteger();
    private volatile RuntimeException permanentFailure;
    private volatile boolean autoPong = true;

    void failNext(RuntimeException failure) {
        scriptedFailures.add(failure);
    }

    void failAlways(RuntimeException failure) {
        this.permanentFailure = failure;
    }

    void autoPong(boolean autoPong) {
        this.autoPong = autoPong;
    }

    int openCalls() {
        return openCalls.get();
    }

    List<FakeSession> sessions() {
        return sessions;
    }

    FakeSession session(int index) {
        return sessions.get(index);
    }

    FakeSession latest() {
        return sessions.isEmpty() ? null : sessions.get(sessions.size() - 1);
    }

    @Override
    public UpstreamSession open(URI target, UpstreamListener listener) {
        openCalls.incrementAndGet();
        RuntimeException scripted = scriptedFailures.poll();
        if (scripted != null) {
            throw scripted;
        }
        if (permanentFailure != null) {
            throw permanentFailure;
        }
        FakeSession session = new FakeSession(listener);
        sessions.add(session);
        return session;
    }

    final class FakeSession implements UpstreamSession {
        private final UpstreamListener listener;
        private final List<String> sent = new CopyOnWriteArrayList<>();
        private final AtomicInteger pings = new AtomicInteger();
        private volatile boolean open = true;
        private volatile boolean closedGracefully = false;
        private volatile boolean failSends = false;

        private FakeSession(UpstreamListener listener) {
            this.listener = listener;
        }

        /** Provider pushes a text frame. */
        void emit(String frame) {
            listener.onText(frame);
        }

        /** Provider drops the connection. */
        void drop(int code, String reason) {
            open = false;
            listener.onClosed(code, reason);
        }

        void failSends(boolean failSends) {
            this.failSends = failSends;
        }

        List<String> joins() {
            return channels("join");
        }

        List<String> leaves() {
            return channels("leave");
        }

        private List<String> channels(String action) {
            List<String> result = new ArrayList<>();
            for (String text : sent) {
                try {
                    JsonNode node = MAPPER.readTree(text);
                    if (action.equals(node.path("msg_type").asText())) {
                        result.add(node.path("channel").asText());
                    }
                } catch (IOException e) {
                    throw new IllegalStateException("Client sent invalid JSON: " + text, e);
                }
            }
            return result;
        }

        int pings() {
            return pings.get();
        }

        boolean closedGracefully() {
            return closedGracefully;
        }

        @Override
        public void sendText(String text) throws IOException {
            if (failSends || !open) {
                throw new IOException("send failed");
            }
            sent.add(text);
        }

        @Override
        public void sendPing() throws IOException {
            if (!open) {
                throw new IOException("ping on closed session");
            }
            pings.incrementAndGet();
            if (autoPong) {
                listener.onPong();
            }
        }

        @Override
        public void close() {
            open = false;
            closedGracefully = true;
        }

        @Override
        public void abort() {
            open = false;
        }

        @Override
        public boolean isOpen() {
            return open;
        }
    }
}
