package com.z254.beacon.realtime.observability;

import com.z254.beacon.realtime.connection.ConnectionRegistry;
import com.z254.beacon.realtime.protocol.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer instrumentation for the realtime layer.
 */
public class RealtimeMetrics {

    private static final String PREFIX = "beacon.realtime.";

    private final MeterRegistry meterRegistry;
    private final Counter connectionsOpened;
    private final Counter connectionsClosed;
    private final Counter broadcasts;
    private final Counter deliveries;
    private final Counter evictions;
    private final Counter encodingFailures;
    private final Counter stateBroadcasts;

    public RealtimeMetrics(MeterRegistry meterRegistry, ConnectionRegistry connectionRegistry) {
        this.meterRegistry = meterRegistry;
        this.connectionsOpened = Counter.builder(PREFIX + "connections.opened").register(meterRegistry);
        this.connectionsClosed = Counter.builder(PREFIX + "connections.closed").register(meterRegistry);
        this.broadcasts = Counter.builder(PREFIX + "broadcasts").register(meterRegistry);
        this.deliveries = Counter.builder(PREFIX + "deliveries").register(meterRegistry);
        this.evictions = Counter.builder(PREFIX + "evictions").register(meterRegistry);
        this.encodingFailures = Counter.builder(PREFIX + "encoding.failures").register(meterRegistry);
        this.stateBroadcasts = Counter.builder(PREFIX + "state.broadcasts").register(meterRegistry);

        Gauge.builder(PREFIX + "connections.active", connectionRegistry, ConnectionRegistry::size)
                .description("Currently registered connections")
                .register(meterRegistry);
    }

    public void connectionOpened() {
        connectionsOpened.increment();
    }

    public void connectionClosed() {
        connectionsClosed.increment();
    }

    public void broadcastCompleted(int delivered, int evicted) {
        broadcasts.increment();
        deliveries.increment(delivered);
        evictions.increment(evicted);
    }

    public void encodingFailed() {
        encodingFailures.increment();
    }

    public void stateBroadcast() {
        stateBroadcasts.increment();
    }

    public void requestHandled(String outcome) {
        meterRegistry.counter(PREFIX + "requests", "outcome", outcome).increment();
    }

    public void protocolError(ErrorKind kind) {
        meterRegistry.counter(PREFIX + "protocol.errors", "kind", kind.getWireName()).increment();
    }
}
