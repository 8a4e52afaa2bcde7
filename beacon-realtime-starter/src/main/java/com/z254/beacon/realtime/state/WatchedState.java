package com.z254.beacon.realtime.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.beacon.realtime.broadcast.BroadcastEngine;
import com.z254.beacon.realtime.broadcast.BroadcastResult;
import com.z254.beacon.realtime.observability.RealtimeMetrics;
import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import com.z254.beacon.realtime.protocol.EnvelopeEncodingException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A value whose every effective change is published, in full, on a topic.
 *
 * <p>Broadcasts are throttled with a trailing window: the first change after a broadcast
 * opens a window of {@code throttle}; every change inside it is coalesced, and one
 * broadcast carrying the latest value fires when the window closes.
 *
 * <p>Callers must not mutate the value outside {@link #mutate(Consumer)}.
 *
 * @param <T> type of the wrapped value, serializable by the codec's {@code ObjectMapper}
 */
@Slf4j
public class WatchedState<T> {

    private final Object lock = new Object();
    private final String topic;
    private final Duration throttle;
    private final BroadcastEngine broadcastEngine;
    private final EnvelopeCodec codec;
    private final RealtimeMetrics metrics;
    private final Scheduler scheduler;

    private final T value;
    private Disposable pending;

    public WatchedState(String topic, T initialValue, Duration throttle, BroadcastEngine broadcastEngine,
                        EnvelopeCodec codec, RealtimeMetrics metrics, Scheduler scheduler) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic must not be blank");
        }
        if (throttle == null || throttle.isZero() || throttle.isNegative()) {
            throw new IllegalArgumentException("Throttle interval must be positive, got " + throttle);
        }
        this.topic = topic;
        this.value = Objects.requireNonNull(initialValue, "initialValue");
        this.throttle = throttle;
        this.broadcastEngine = broadcastEngine;
        this.codec = codec;
        this.metrics = metrics;
        this.scheduler = scheduler;
    }

    public String getTopic() {
        return topic;
    }

    public Duration getThrottle() {
        return throttle;
    }

    /**
     * Read from the value under the lock.
     */
    public <R> R read(Function<? super T, ? extends R> reader) {
        synchronized (lock) {
            return reader.apply(value);
        }
    }

    /**
     * Serialized copy of the current value.
     */
    public JsonNode snapshot() throws EnvelopeEncodingException {
        synchronized (lock) {
            return codec.toTree(value).deepCopy();
        }
    }

    /**
     * Apply a change. Schedules a broadcast unless the serialized value is unchanged.
     * A mutator that throws after a partial change still gets that change broadcast; the
     * exception is rethrown.
     *
     * @return true if the change was effective and a broadcast is pending
     */
    public boolean mutate(Consumer<? super T> mutator) {
        synchronized (lock) {
            JsonNode before = treeOrNull();
            boolean changed;
            try {
                mutator.accept(value);
            } finally {
                changed = scheduleIfChanged(before);
            }
            return changed;
        }
    }

    // Caller holds lock.
    private boolean scheduleIfChanged(JsonNode before) {
        JsonNode after = treeOrNull();
        if (before != null && before.equals(after)) {
            log.trace("Mutation on {} left state unchanged", topic);
            return false;
        }
        if (pending == null) {
            pending = scheduler.schedule(this::fire, throttle.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Scheduled state broadcast on {} in {}ms", topic, throttle.toMillis());
        }
        return true;
    }

    /**
     * Cancel the pending window, if any, and broadcast the current value now.
     */
    public Optional<BroadcastResult> flush() {
        synchronized (lock) {
            if (pending != null) {
                pending.dispose();
                pending = null;
            }
        }
        return Optional.ofNullable(fire());
    }

    public boolean hasPendingBroadcast() {
        synchronized (lock) {
            return pending != null;
        }
    }

    /**
     * Drop any pending broadcast without sending it.
     */
    public void cancel() {
        synchronized (lock) {
            if (pending != null) {
                pending.dispose();
                pending = null;
            }
        }
    }

    private BroadcastResult fire() {
        JsonNode tree;
        synchronized (lock) {
            pending = null;
            try {
                tree = codec.toTree(value).deepCopy();
            } catch (EnvelopeEncodingException e) {
                log.error("Skipping state broadcast on {}: {}", topic, e.getMessage());
                metrics.encodingFailed();
                return null;
            }
        }
        try {
            BroadcastResult result = broadcastEngine.broadcast(topic, tree);
            metrics.stateBroadcast();
            return result;
        } catch (RuntimeException e) {
            log.error("State broadcast on {} failed", topic, e);
            return null;
        }
    }

    // Caller holds lock.
    private JsonNode treeOrNull() {
        try {
            return codec.toTree(value).deepCopy();
        } catch (EnvelopeEncodingException e) {
            log.debug("Could not serialize state on {}: {}", topic, e.getMessage());
            return null;
        }
    }
}
