package com.z254.beacon.realtime.websocket;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.z254.beacon.realtime.broadcast.BroadcastEngine;
import com.z254.beacon.realtime.connection.Connection;
import com.z254.beacon.realtime.connection.ConnectionRegistry;
import com.z254.beacon.realtime.observability.RealtimeMetrics;
import com.z254.beacon.realtime.protocol.Envelope;
import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import com.z254.beacon.realtime.protocol.EnvelopeDecodingException;
import com.z254.beacon.realtime.protocol.EnvelopeEncodingException;
import com.z254.beacon.realtime.protocol.ErrorEnvelope;
import com.z254.beacon.realtime.protocol.ErrorKind;
import com.z254.beacon.realtime.protocol.RequestEnvelope;
import com.z254.beacon.realtime.protocol.ResponseEnvelope;
import com.z254.beacon.realtime.protocol.SubscriptionEnvelope;
import com.z254.beacon.realtime.routing.ConnectionContext;
import com.z254.beacon.realtime.routing.RealtimeRouter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.io.IOException;

/**
 * Handles one inbound text frame for a connection: decode, then route or (un)subscribe,
 * then write the reply if there is one. Never signals an error.
 */
@Slf4j
public class InboundMessageProcessor {

    private final EnvelopeCodec codec;
    private final RealtimeRouter router;
    private final ConnectionRegistry registry;
    private final BroadcastEngine broadcastEngine;
    private final RealtimeMetrics metrics;

    public InboundMessageProcessor(EnvelopeCodec codec, RealtimeRouter router, ConnectionRegistry registry,
                                   BroadcastEngine broadcastEngine, RealtimeMetrics metrics) {
        this.codec = codec;
        this.router = router;
        this.registry = registry;
        this.broadcastEngine = broadcastEngine;
        this.metrics = metrics;
    }

    public Mono<Void> process(Connection connection, String frame) {
        Envelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (EnvelopeDecodingException e) {
            log.warn("Rejected frame from connection {}: {}", connection.getId(), e.getMessage());
            metrics.protocolError(e.getKind());
            reply(connection, e.toErrorEnvelope());
            return Mono.empty();
        }

        return switch (envelope.getType()) {
            case REQUEST -> router.dispatch((RequestEnvelope) envelope,
                            new ConnectionContext(connection, registry, broadcastEngine))
                    .doOnNext(response -> reply(connection, response))
                    .then()
                    .onErrorResume(e -> {
                        log.error("Unexpected failure processing request from {}", connection.getId(), e);
                        return Mono.empty();
                    });
            case SUBSCRIBE, UNSUBSCRIBE -> {
                handleSubscription(connection, (SubscriptionEnvelope) envelope);
                yield Mono.empty();
            }
            default -> {
                String message = "Unexpected message type from client: " + envelope.getType().getWireName();
                log.warn("{} (connection {})", message, connection.getId());
                metrics.protocolError(ErrorKind.UNKNOWN_TYPE);
                reply(connection, new ErrorEnvelope(idOf(envelope), ErrorKind.UNKNOWN_TYPE, message));
                yield Mono.empty();
            }
        };
    }

    private void handleSubscription(Connection connection, SubscriptionEnvelope envelope) {
        boolean changed = envelope.isUnsubscribe()
                ? registry.unsubscribe(connection.getId(), envelope.getTopic())
                : registry.subscribe(connection.getId(), envelope.getTopic());
        log.debug("Connection {} {} {} (changed: {})", connection.getId(),
                envelope.getType().getWireName(), envelope.getTopic(), changed);

        if (envelope.getId() != null) {
            ObjectNode ack = codec.getObjectMapper().createObjectNode()
                    .put("topic", envelope.getTopic())
                    .put("subscribed", !envelope.isUnsubscribe())
                    .put("changed", changed);
            reply(connection, ResponseEnvelope.success(envelope.getId(), ack));
        }
    }

    private void reply(Connection connection, Envelope envelope) {
        String frame;
        try {
            frame = codec.encode(envelope);
        } catch (EnvelopeEncodingException e) {
            log.error("Failed to encode reply for connection {}: {}", connection.getId(), e.getMessage());
            metrics.encodingFailed();
            return;
        }
        try {
            connection.send(frame);
        } catch (IOException e) {
            log.debug("Dropping reply to connection {}: {}", connection.getId(), e.getMessage());
        }
    }

    private static String idOf(Envelope envelope) {
        if (envelope instanceof ResponseEnvelope response) {
            return response.getId();
        }
        if (envelope instanceof ErrorEnvelope error) {
            return error.getId();
        }
        return null;
    }
}
