package com.z254.beacon.realtime.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.beacon.realtime.broadcast.BroadcastEngine;
import com.z254.beacon.realtime.broadcast.BroadcastResult;
import com.z254.beacon.realtime.connection.ConnectionRegistry;
import com.z254.beacon.realtime.observability.RealtimeMetrics;
import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import com.z254.beacon.realtime.support.RecordingChannel;
import com.z254.beacon.realtime.support.TestConnections;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WatchedState}.
 */
class WatchedStateTest {

    private static final String TOPIC = "/board";
    private static final Duration THROTTLE = Duration.ofSeconds(1);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private VirtualTimeScheduler scheduler;
    private SimpleMeterRegistry meterRegistry;
    private RecordingChannel subscriber;
    private WatchedStateFactory factory;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        meterRegistry = new SimpleMeterRegistry();
        ConnectionRegistry registry = new ConnectionRegistry();
        RealtimeMetrics metrics = new RealtimeMetrics(meterRegistry, registry);
        EnvelopeCodec codec = new EnvelopeCodec(objectMapper);
        BroadcastEngine engine = new BroadcastEngine(registry, codec, metrics);
        factory = new WatchedStateFactory(engine, codec, metrics, scheduler);

        subscriber = new RecordingChannel();
        TestConnections.open(registry, "watcher", subscriber);
        registry.subscribe("watcher", TOPIC);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private List<JsonNode> payloads() throws Exception {
        List<JsonNode> payloads = new ArrayList<>();
        for (String frame : subscriber.frames()) {
            payloads.add(objectMapper.readTree(frame).get("payload"));
        }
        return payloads;
    }

    @Nested
    @DisplayName("Throttling")
    class ThrottlingTests {

        @Test
        @DisplayName("should coalesce a burst into one broadcast of the final state")
        void coalesceBurst() throws Exception {
            WatchedState<Board> state = factory.create(TOPIC, new Board(), THROTTLE);

            state.mutate(board -> board.counts.put("a", 1));
            scheduler.advanceTimeBy(Duration.ofMillis(100));
            state.mutate(board -> board.counts.put("a", 2));
            scheduler.advanceTimeBy(Duration.ofMillis(100));
            state.mutate(board -> board.counts.put("b", 3));

            scheduler.advanceTimeBy(Duration.ofMillis(799));
            assertThat(subscriber.frames()).isEmpty();

            scheduler.advanceTimeBy(Duration.ofMillis(1));
            assertThat(payloads()).hasSize(1);
            JsonNode payload = payloads().get(0);
            assertThat(payload.get("counts").get("a").asInt()).isEqualTo(2);
            assertThat(payload.get("counts").get("b").asInt()).isEqualTo(3);

            scheduler.advanceTimeBy(Duration.ofSeconds(5));
            assertThat(subscriber.frames()).hasSize(1);
        }

        @Test
        @DisplayName("should broadcast at most once per interval and never drop the last state")
        void steadyMutations() throws Exception {
            WatchedState<Board> state = factory.create(TOPIC, new Board(), THROTTLE);

            for (int i = 0; i < 30; i++) {
                int value = i;
                state.mutate(board -> board.counts.put("n", value));
                scheduler.advanceTimeBy(Duration.ofMillis(100));
            }

            List<JsonNode> payloads = payloads();
            assertThat(payloads).hasSize(3);
            assertThat(payloads.get(2).get("counts").get("n").asInt()).isEqualTo(29);
            assertThat(meterRegistry.counter("beacon.realtime.state.broadcasts").count()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("should not schedule anything for a mutation that changes nothing")
        void noOpMutation() {
            WatchedState<Board> state = factory.create(TOPIC, new Board(), THROTTLE);

            assertThat(state.mutate(board -> board.counts.remove("missing"))).isFalse();
            assertThat(state.hasPendingBroadcast()).isFalse();

            scheduler.advanceTimeBy(Duration.ofSeconds(2));
            assertThat(subscriber.frames()).isEmpty();
        }

        @Test
        @DisplayName("should still broadcast a change made before the mutator threw")
        void partialChangeBeforeFailure() throws Exception {
            WatchedState<Board> state = factory.create(TOPIC, new Board(), THROTTLE);

            assertThatThrownBy(() -> state.mutate(board -> {
                board.counts.put("a", 1);
                throw new IllegalStateException("handler failed halfway");
            })).isInstanceOf(IllegalStateException.class).hasMessage("handler failed halfway");
            assertThat(state.hasPendingBroadcast()).isTrue();

            assertThat(state.mutate(board -> board.counts.put("a", 1))).isFalse();

            scheduler.advanceTimeBy(THROTTLE);
            List<JsonNode> payloads = payloads();
            assertThat(payloads).hasSize(1);
            assertThat(payloads.get(0).get("counts").get("a").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("should schedule nothing when the mutator throws before changing anything")
        void failureWithoutChange() {
            WatchedState<Board> state = factory.create(TOPIC, new Board(), THROTTLE);

            assertThatThrownBy(() -> state.mutate(board -> {
                throw new IllegalArgumentException("rejected");
            })).isInstanceOf(IllegalArgumentException.class);

            assertThat(state.hasPendingBroadcast()).isFalse();
        }
    }

    @Nested
    @DisplayName("Flush and failures")
    class FlushTests {

        @Test
        @DisplayName("should broadcast immediately on flush and cancel the window")
        void flush() {
            WatchedState<Board> state = factory.create(TOPIC, new Board(), THROTTLE);
            state.mutate(board -> board.counts.put("a", 1));

            Optional<BroadcastResult> result = state.flush();

            assertThat(result).hasValueSatisfying(r -> assertThat(r.getDelivered()).isEqualTo(1));
            assertThat(state.hasPendingBroadcast()).isFalse();

            scheduler.advanceTimeBy(Duration.ofSeconds(2));
            assertThat(subscriber.frames()).hasSize(1);
        }

        @Test
        @DisplayName("should skip a broadcast that cannot be serialized and retry on the next mutation")
        void serializationFailureRetries() throws Exception {
            WatchedState<Board> state = factory.create(TOPIC, new Board(), THROTTLE);

            state.mutate(board -> board.broken = true);
            scheduler.advanceTimeBy(THROTTLE);
            assertThat(subscriber.frames()).isEmpty();
            assertThat(state.hasPendingBroadcast()).isFalse();

            state.mutate(board -> {
                board.broken = false;
                board.counts.put("a", 1);
            });
            scheduler.advanceTimeBy(THROTTLE);

            assertThat(payloads()).hasSize(1);
            assertThat(payloads().get(0).get("counts").get("a").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("should drop the pending broadcast on cancel")
        void cancel() {
            WatchedState<Board> state = factory.create(TOPIC, new Board(), THROTTLE);
            state.mutate(board -> board.counts.put("a", 1));

            state.cancel();
            scheduler.advanceTimeBy(Duration.ofSeconds(2));

            assertThat(subscriber.frames()).isEmpty();
        }
    }

    @Test
    @DisplayName("should serialize concurrent mutations")
    void concurrentMutations() throws Exception {
        WatchedState<Board> state = factory.create(TOPIC, new Board(), THROTTLE);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 250; i++) {
                        state.mutate(board -> board.counts.merge("n", 1, Integer::sum));
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        Integer total = state.read(board -> board.counts.get("n"));
        assertThat(total).isEqualTo(1000);
        scheduler.advanceTimeBy(THROTTLE);
        List<JsonNode> payloads = payloads();
        assertThat(payloads).hasSize(1);
        assertThat(payloads.get(0).get("counts").get("n").asInt()).isEqualTo(1000);
    }

    @Test
    @DisplayName("should expose a detached snapshot")
    void snapshot() throws Exception {
        WatchedState<Board> state = factory.create(TOPIC, new Board(), THROTTLE);
        state.mutate(board -> board.counts.put("a", 1));

        JsonNode snapshot = state.snapshot();
        state.mutate(board -> board.counts.put("a", 2));

        assertThat(snapshot.get("counts").get("a").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("should require a positive throttle interval")
    void requirePositiveThrottle() {
        assertThatThrownBy(() -> factory.create(TOPIC, new Board(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> factory.create(TOPIC, new Board(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> factory.create(" ", new Board(), THROTTLE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static class Board {
        public Map<String, Integer> counts = new LinkedHashMap<>();

        @JsonIgnore
        public boolean broken;

        public String getStatus() {
            if (broken) {
                throw new IllegalStateException("board is being rebuilt");
            }
            return "ok";
        }
    }
}
