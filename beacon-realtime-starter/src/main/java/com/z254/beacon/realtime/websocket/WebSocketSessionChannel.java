package com.z254.beacon.realtime.websocket;

import com.z254.beacon.realtime.connection.RealtimeChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.io.IOException;

/**
 * {@link RealtimeChannel} backed by a reactive WebSocket session.
 *
 * <p>Frames are queued on a bounded per-session buffer drained by {@code session.send}.
 * A full buffer is reported as a failed send, so a slow consumer is evicted instead of
 * growing memory without limit.
 */
@Slf4j
public class WebSocketSessionChannel implements RealtimeChannel {

    private final WebSocketSession session;
    private final Sinks.Many<String> outbound;
    private volatile boolean closed;

    public WebSocketSessionChannel(WebSocketSession session, int queueCapacity) {
        this.session = session;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(queueCapacity).get());
    }

    @Override
    public synchronized void send(String frame) throws IOException {
        if (!isOpen()) {
            throw new IOException("Session " + session.getId() + " is closed");
        }
        Sinks.EmitResult result = outbound.tryEmitNext(frame);
        if (result.isFailure()) {
            throw new IOException("Failed to queue frame for session " + session.getId() + ": " + result);
        }
    }

    @Override
    public boolean isOpen() {
        return !closed && session.isOpen();
    }

    @Override
    public void close(int code, String reason) {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            outbound.tryEmitComplete();
        }
        session.close(new CloseStatus(code, reason))
                .subscribe(
                        unused -> { },
                        e -> log.debug("Error closing session {}: {}", session.getId(), e.getMessage()));
    }

    /**
     * Frames to write to the socket, in send order.
     */
    public Flux<WebSocketMessage> outbound() {
        return outbound.asFlux().map(session::textMessage);
    }
}
