package com.z254.beacon.realtime.connection;

import com.z254.beacon.realtime.support.RecordingChannel;
import com.z254.beacon.realtime.support.TestConnections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConnectionRegistry}.
 */
class ConnectionRegistryTest {

    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
    }

    @Nested
    @DisplayName("Subscriptions")
    class SubscriptionTests {

        @Test
        @DisplayName("should subscribe idempotently")
        void subscribeIdempotent() {
            Connection connection = TestConnections.open(registry, "a");

            assertThat(registry.subscribe("a", "/tickets")).isTrue();
            assertThat(registry.subscribe("a", "/tickets")).isFalse();

            assertThat(registry.subscriberCount("/tickets")).isEqualTo(1);
            assertThat(connection.getTopics()).containsExactly("/tickets");
            assertThat(registry.topicsFor("a")).containsExactly("/tickets");
        }

        @Test
        @DisplayName("should ignore subscriptions for unknown connections")
        void subscribeUnknownConnection() {
            assertThat(registry.subscribe("ghost", "/tickets")).isFalse();
            assertThat(registry.subscriberCount("/tickets")).isZero();
        }

        @Test
        @DisplayName("should treat unsubscribe without a mapping as a no-op")
        void unsubscribeWithoutMapping() {
            TestConnections.open(registry, "a");

            assertThat(registry.unsubscribe("a", "/tickets")).isFalse();
            assertThat(registry.unsubscribe("ghost", "/tickets")).isFalse();
        }

        @Test
        @DisplayName("should unsubscribe and drop empty topics")
        void unsubscribe() {
            TestConnections.open(registry, "a");
            registry.subscribe("a", "/tickets");

            assertThat(registry.unsubscribe("a", "/tickets")).isTrue();
            assertThat(registry.connectionsFor("/tickets")).isEmpty();
            assertThat(registry.topicsFor("a")).isEmpty();
        }

        @Test
        @DisplayName("should reject blank topics")
        void rejectBlankTopic() {
            TestConnections.open(registry, "a");

            assertThatThrownBy(() -> registry.subscribe("a", " "))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.connectionsFor(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Removal")
    class RemovalTests {

        @Test
        @DisplayName("should remove every index entry for a removed connection")
        void removeClearsIndex() {
            Connection connection = TestConnections.open(registry, "a");
            TestConnections.open(registry, "b");
            registry.subscribe("a", "/t1");
            registry.subscribe("a", "/t2");
            registry.subscribe("b", "/t2");

            assertThat(registry.remove("a")).contains(connection);

            assertThat(registry.connectionsFor("/t1")).isEmpty();
            assertThat(registry.connectionsFor("/t2")).extracting(Connection::getId).containsExactly("b");
            assertThat(registry.find("a")).isEmpty();
            assertThat(registry.size()).isEqualTo(1);
            // Topics stay readable for close listeners
            assertThat(connection.getTopics()).containsExactlyInAnyOrder("/t1", "/t2");
        }

        @Test
        @DisplayName("should be idempotent")
        void removeIdempotent() {
            TestConnections.open(registry, "a");

            assertThat(registry.remove("a")).isPresent();
            assertThat(registry.remove("a")).isEmpty();
        }

        @Test
        @DisplayName("should prune connections whose socket closed")
        void pruneClosed() {
            RecordingChannel channel = new RecordingChannel();
            Connection dead = TestConnections.open(registry, "dead", channel);
            TestConnections.open(registry, "alive");
            registry.subscribe("dead", "/tickets");
            registry.subscribe("alive", "/tickets");

            channel.disconnect();

            assertThat(registry.pruneClosed()).containsExactly(dead);
            assertThat(registry.connectionsFor("/tickets")).extracting(Connection::getId).containsExactly("alive");
        }

        @Test
        @DisplayName("should leave no index entries after concurrent subscribe and remove")
        void concurrentSubscribeAndRemove() throws InterruptedException {
            int connections = 200;
            for (int i = 0; i < connections; i++) {
                TestConnections.open(registry, "c" + i);
            }

            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch done = new CountDownLatch(connections * 2);
            for (int i = 0; i < connections; i++) {
                String id = "c" + i;
                executor.submit(() -> {
                    try {
                        for (int t = 0; t < 5; t++) {
                            registry.subscribe(id, "/topic-" + t);
                        }
                    } finally {
                        done.countDown();
                    }
                });
                executor.submit(() -> {
                    try {
                        registry.remove(id);
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(registry.size()).isZero();
            for (int t = 0; t < 5; t++) {
                assertThat(registry.subscriberCount("/topic-" + t)).isZero();
            }
        }
    }

    @Nested
    @DisplayName("Snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("should not change a snapshot when the registry changes")
        void snapshotIsStable() {
            TestConnections.open(registry, "a");
            registry.subscribe("a", "/tickets");

            List<Connection> snapshot = registry.connectionsFor("/tickets");
            registry.remove("a");

            assertThat(snapshot).hasSize(1);
            assertThat(registry.connectionsFor("/tickets")).isEmpty();
        }

        @Test
        @DisplayName("should list connections in registration order")
        void connectionsInOrder() {
            TestConnections.open(registry, "a");
            TestConnections.open(registry, "b");
            TestConnections.open(registry, "c");

            assertThat(registry.connections()).extracting(Connection::getId).containsExactly("a", "b", "c");
        }
    }
}
