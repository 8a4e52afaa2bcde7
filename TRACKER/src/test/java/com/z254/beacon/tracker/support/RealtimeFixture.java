package com.z254.beacon.tracker.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.beacon.realtime.broadcast.BroadcastEngine;
import com.z254.beacon.realtime.connection.Connection;
import com.z254.beacon.realtime.connection.ConnectionRegistry;
import com.z254.beacon.realtime.observability.RealtimeMetrics;
import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Broadcast plumbing wired without Spring, with helpers to attach recording connections.
 */
public class RealtimeFixture {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final EnvelopeCodec codec = new EnvelopeCodec(objectMapper);
    private final RealtimeMetrics metrics = new RealtimeMetrics(new SimpleMeterRegistry(), registry);
    private final BroadcastEngine broadcastEngine = new BroadcastEngine(registry, codec, metrics);

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    public RealtimeMetrics metrics() {
        return metrics;
    }

    public BroadcastEngine broadcastEngine() {
        return broadcastEngine;
    }

    public Connection connect(String id, RecordingChannel channel, String... topics) {
        Connection connection = new Connection(id, channel);
        connection.markOpen();
        registry.register(connection);
        for (String topic : topics) {
            registry.subscribe(id, topic);
        }
        return connection;
    }

    /**
     * Event payloads recorded on {@code channel}, oldest first.
     */
    public List<JsonNode> payloads(RecordingChannel channel) {
        List<JsonNode> payloads = new ArrayList<>();
        for (String frame : channel.frames()) {
            try {
                payloads.add(objectMapper.readTree(frame).get("payload"));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
        return payloads;
    }
}
