package com.z254.beacon.realtime.state;

import com.z254.beacon.realtime.broadcast.BroadcastEngine;
import com.z254.beacon.realtime.observability.RealtimeMetrics;
import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Creates {@link WatchedState} containers bound to the application's broadcast engine.
 */
public class WatchedStateFactory {

    private final BroadcastEngine broadcastEngine;
    private final EnvelopeCodec codec;
    private final RealtimeMetrics metrics;
    private final Scheduler scheduler;

    public WatchedStateFactory(BroadcastEngine broadcastEngine, EnvelopeCodec codec,
                               RealtimeMetrics metrics, Scheduler scheduler) {
        this.broadcastEngine = broadcastEngine;
        this.codec = codec;
        this.metrics = metrics;
        this.scheduler = scheduler;
    }

    public <T> WatchedState<T> create(String topic, T initialValue, Duration throttle) {
        return new WatchedState<>(topic, initialValue, throttle, broadcastEngine, codec, metrics, scheduler);
    }
}
