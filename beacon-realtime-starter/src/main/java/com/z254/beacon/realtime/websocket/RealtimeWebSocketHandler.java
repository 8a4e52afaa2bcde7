package com.z254.beacon.realtime.websocket;

import com.z254.beacon.realtime.connection.Connection;
import com.z254.beacon.realtime.connection.ConnectionListener;
import com.z254.beacon.realtime.connection.ConnectionRegistry;
import com.z254.beacon.realtime.observability.RealtimeMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * WebSocket entry point: one {@link Connection} per session.
 *
 * <p>Inbound frames are processed concurrently up to {@code maxInFlight} per connection, so
 * a slow handler does not hold up later requests on the same socket.
 */
@Slf4j
public class RealtimeWebSocketHandler implements WebSocketHandler {

    private final ConnectionRegistry registry;
    private final InboundMessageProcessor processor;
    private final RealtimeMetrics metrics;
    private final List<ConnectionListener> listeners;
    private final int sendQueueCapacity;
    private final int maxInFlight;

    public RealtimeWebSocketHandler(ConnectionRegistry registry, InboundMessageProcessor processor,
                                    RealtimeMetrics metrics, List<ConnectionListener> listeners,
                                    int sendQueueCapacity, int maxInFlight) {
        this.registry = registry;
        this.processor = processor;
        this.metrics = metrics;
        this.listeners = List.copyOf(listeners);
        this.sendQueueCapacity = sendQueueCapacity;
        this.maxInFlight = maxInFlight;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        WebSocketSessionChannel channel = new WebSocketSessionChannel(session, sendQueueCapacity);
        Connection connection = new Connection(session.getId(), channel, attributesOf(session));
        connection.markOpen();
        registry.register(connection);
        metrics.connectionOpened();
        log.info("WebSocket connection opened: {}", connection.getId());
        notifyListeners(connection, true);

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .flatMap(frame -> processor.process(connection, frame), maxInFlight)
                .then()
                .doFinally(signal -> connection.close(Connection.CLOSE_NORMAL, "Session ended"));

        return session.send(channel.outbound())
                .and(input)
                .doOnError(e -> log.warn("WebSocket connection {} failed: {}", connection.getId(), e.getMessage()))
                .doFinally(signal -> terminate(connection, signal));
    }

    private void terminate(Connection connection, SignalType signal) {
        connection.close(Connection.CLOSE_NORMAL, "Session ended");
        registry.remove(connection.getId());
        registry.pruneClosed();
        connection.markClosed();
        metrics.connectionClosed();
        log.info("WebSocket connection closed: {} - {}", connection.getId(), signal);
        notifyListeners(connection, false);
    }

    private void notifyListeners(Connection connection, boolean opened) {
        for (ConnectionListener listener : listeners) {
            try {
                if (opened) {
                    listener.onOpen(connection);
                } else {
                    listener.onClose(connection);
                }
            } catch (RuntimeException e) {
                log.error("Connection listener {} failed for {}", listener.getClass().getSimpleName(),
                        connection.getId(), e);
            }
        }
    }

    private static Map<String, Object> attributesOf(WebSocketSession session) {
        Map<String, Object> attributes = new HashMap<>();
        if (session.getAttributes() != null) {
            attributes.putAll(session.getAttributes());
        }
        HandshakeInfo handshake = session.getHandshakeInfo();
        if (handshake != null) {
            if (handshake.getUri() != null) {
                attributes.put("uri", handshake.getUri().toString());
            }
            if (handshake.getRemoteAddress() != null) {
                attributes.put("remoteAddress", handshake.getRemoteAddress().toString());
            }
        }
        return attributes;
    }
}
