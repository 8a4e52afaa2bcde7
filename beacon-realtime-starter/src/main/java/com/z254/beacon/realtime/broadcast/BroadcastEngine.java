package com.z254.beacon.realtime.broadcast;

import com.z254.beacon.realtime.connection.Connection;
import com.z254.beacon.realtime.connection.ConnectionRegistry;
import com.z254.beacon.realtime.observability.RealtimeMetrics;
import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import com.z254.beacon.realtime.protocol.EnvelopeEncodingException;
import com.z254.beacon.realtime.protocol.EventEnvelope;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Delivers event envelopes to subscribers, tolerating individual send failures.
 *
 * <p>A failing connection never aborts the pass: it is marked, the loop continues, and
 * once every target has been tried the marked connections are removed from the registry
 * and their sockets closed. Subscriber failures are never raised to the caller.
 */
@Slf4j
public class BroadcastEngine {

    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;
    private final RealtimeMetrics metrics;

    public BroadcastEngine(ConnectionRegistry registry, EnvelopeCodec codec, RealtimeMetrics metrics) {
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * Publish a payload to every connection subscribed to {@code topic}.
     *
     * @throws IllegalArgumentException if the topic is blank
     */
    public BroadcastResult broadcast(String topic, Object payload) {
        requireTopic(topic);
        String frame = encode(topic, payload);
        if (frame == null) {
            return BroadcastResult.encodingFailure(topic);
        }
        return deliver(topic, frame, registry.connectionsFor(topic));
    }

    /**
     * Publish a single discrete event. Same delivery contract as {@link #broadcast}.
     */
    public BroadcastResult emitEvent(String topic, Object payload) {
        return broadcast(topic, payload);
    }

    /**
     * Publish to every registered connection, subscribed or not.
     */
    public BroadcastResult broadcastAll(String topic, Object payload) {
        requireTopic(topic);
        String frame = encode(topic, payload);
        if (frame == null) {
            return BroadcastResult.encodingFailure(topic);
        }
        return deliver(topic, frame, registry.connections());
    }

    private String encode(String topic, Object payload) {
        try {
            return codec.encode(new EventEnvelope(topic, codec.toTree(payload)));
        } catch (EnvelopeEncodingException e) {
            log.error("Dropping broadcast on {}: {}", topic, e.getMessage());
            metrics.encodingFailed();
            return null;
        }
    }

    private BroadcastResult deliver(String topic, String frame, List<Connection> targets) {
        List<Connection> dead = new ArrayList<>();
        int delivered = 0;

        for (Connection connection : targets) {
            if (!connection.isOpen()) {
                dead.add(connection);
                continue;
            }
            try {
                connection.send(frame);
                delivered++;
            } catch (Exception e) {
                log.debug("Failed to send {} to connection {}: {}", topic, connection.getId(), e.getMessage());
                dead.add(connection);
            }
        }

        List<String> evicted = new ArrayList<>(dead.size());
        for (Connection connection : dead) {
            registry.remove(connection.getId());
            connection.close(Connection.CLOSE_SERVER_ERROR, "Send failed");
            evicted.add(connection.getId());
        }
        if (!evicted.isEmpty()) {
            log.info("Evicted {} dead connection(s) while broadcasting {}", evicted.size(), topic);
        }

        metrics.broadcastCompleted(delivered, evicted.size());
        log.debug("Broadcast {} delivered to {}/{} connection(s)", topic, delivered, targets.size());
        return new BroadcastResult(topic, targets.size(), delivered, List.copyOf(evicted), false);
    }

    private static void requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic must not be blank");
        }
    }
}
