package in.flowmind.feedrelay;

import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Downstream session on an Undertow WebSocket channel.
 *
 * Frames go through a bounded queue and are written one at a time, each
 * write started from the completion of the previous one. {@link #offer}
 * never blocks: a full queue means the client is not keeping up.
 */
final class UndertowDownstreamConnection implements DownstreamConnection {
    private static final Logger log = LoggerFactory.getLogger(UndertowDownstreamConnection.class);

    private final String id;
    private final WebSocketChannel channel;
    private final BlockingQueue<String> outbound;
    private final AtomicBoolean writing = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean failed = false;

    UndertowDownstreamConnection(String id, WebSocketChannel channel, int bufferSize) {
        this.id = id;
        this.channel = channel;
        this.outbound = new ArrayBlockingQueue<>(bufferSize);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean offer(String frame) {
        if (!isOpen()) {
            return false;
        }
        if (!outbound.offer(frame)) {
            return false;
        }
        drain();
        return true;
    }

    private void drain() {
        while (!failed && writing.compareAndSet(false, true)) {
            String next = outbound.poll();
            if (next == null) {
                writing.set(false);
                // A frame queued between poll() and set(false) would otherwise wait for the next offer.
                if (outbound.isEmpty()) {
                    return;
                }
                continue;
            }
            WebSockets.sendText(next, channel, new WebSocketCallback<Void>() {
                @Override
                public void complete(WebSocketChannel ch, Void context) {
                    writing.set(false);
                    if (!outbound.isEmpty()) {
                        drain();
                    }
                }

                @Override
                public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                    failed = true;
                    writing.set(false);
                    outbound.clear();
                    log.debug("[GATEWAY] Write to {} failed: {}", id, throwable.getMessage());
                    IoUtils.safeClose(ch);
                }
            });
            return;
        }
    }

    @Override
    public void close(String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        outbound.clear();
        if (!channel.isOpen()) {
            return;
        }
        WebSockets.sendClose(CloseMessage.GOING_AWAY, reason, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                IoUtils.safeClose(ch);
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                log.debug("[GATEWAY] Close frame to {} failed: {}", id, throwable.getMessage());
                IoUtils.safeClose(ch);
            }
        });
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && !failed && channel.isOpen() && !channel.isCloseFrameReceived();
    }

    @Override
    public String toString() {
        return id;
    }
}
