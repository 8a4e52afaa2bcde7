package com.z254.beacon.realtime.connection;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Single source of truth for who is connected and which topics they listen to.
 *
 * <p>All mutations and reads of the connection map and the topic index happen under one
 * monitor. Readers get copies, so a broadcast can iterate while other connections
 * subscribe, unsubscribe or disconnect, and the lock is never held across a send.
 */
@Slf4j
public class ConnectionRegistry {

    private final Object lock = new Object();
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final Map<String, Set<String>> topicIndex = new HashMap<>();

    public void register(Connection connection) {
        synchronized (lock) {
            Connection previous = connections.put(connection.getId(), connection);
            if (previous != null && previous != connection) {
                unindex(previous);
            }
        }
        log.debug("Registered connection {}", connection.getId());
    }

    /**
     * Subscribe a connection to a topic. No-op when the connection is unknown or already subscribed.
     *
     * @return true if a new subscription was added
     */
    public boolean subscribe(String connectionId, String topic) {
        requireTopic(topic);
        synchronized (lock) {
            Connection connection = connections.get(connectionId);
            if (connection == null) {
                return false;
            }
            boolean added = topicIndex.computeIfAbsent(topic, k -> new LinkedHashSet<>()).add(connectionId);
            connection.topics().add(topic);
            if (added) {
                log.debug("Connection {} subscribed to {}", connectionId, topic);
            }
            return added;
        }
    }

    /**
     * Unsubscribe a connection from a topic. No-op when there is no such subscription.
     *
     * @return true if a subscription was removed
     */
    public boolean unsubscribe(String connectionId, String topic) {
        requireTopic(topic);
        synchronized (lock) {
            Connection connection = connections.get(connectionId);
            if (connection != null) {
                connection.topics().remove(topic);
            }
            Set<String> subscribers = topicIndex.get(topic);
            if (subscribers == null) {
                return false;
            }
            boolean removed = subscribers.remove(connectionId);
            if (subscribers.isEmpty()) {
                topicIndex.remove(topic);
            }
            if (removed) {
                log.debug("Connection {} unsubscribed from {}", connectionId, topic);
            }
            return removed;
        }
    }

    /**
     * Remove a connection and every index entry that points at it. Idempotent.
     */
    public Optional<Connection> remove(String connectionId) {
        Connection removed;
        synchronized (lock) {
            removed = connections.remove(connectionId);
            if (removed != null) {
                unindex(removed);
            }
        }
        if (removed != null) {
            log.debug("Removed connection {}", connectionId);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Snapshot of the connections currently subscribed to a topic.
     */
    public List<Connection> connectionsFor(String topic) {
        requireTopic(topic);
        synchronized (lock) {
            Set<String> ids = topicIndex.get(topic);
            if (ids == null) {
                return List.of();
            }
            List<Connection> snapshot = new ArrayList<>(ids.size());
            for (String id : ids) {
                Connection connection = connections.get(id);
                if (connection != null) {
                    snapshot.add(connection);
                }
            }
            return snapshot;
        }
    }

    /**
     * Snapshot of every registered connection.
     */
    public List<Connection> connections() {
        synchronized (lock) {
            return new ArrayList<>(connections.values());
        }
    }

    public Optional<Connection> find(String connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(connections.get(connectionId));
        }
    }

    public Set<String> topicsFor(String connectionId) {
        synchronized (lock) {
            Connection connection = connections.get(connectionId);
            return connection == null ? Set.of() : Set.copyOf(connection.topics());
        }
    }

    public int subscriberCount(String topic) {
        synchronized (lock) {
            Set<String> ids = topicIndex.get(topic);
            return ids == null ? 0 : ids.size();
        }
    }

    public int size() {
        synchronized (lock) {
            return connections.size();
        }
    }

    /**
     * Remove every connection whose socket no longer accepts writes.
     *
     * @return the removed connections
     */
    public List<Connection> pruneClosed() {
        List<Connection> dead = new ArrayList<>();
        synchronized (lock) {
            for (Connection connection : connections.values()) {
                if (!connection.isOpen()) {
                    dead.add(connection);
                }
            }
            for (Connection connection : dead) {
                connections.remove(connection.getId());
                unindex(connection);
            }
        }
        if (!dead.isEmpty()) {
            log.debug("Cleaned up {} dead connection(s)", dead.size());
        }
        return dead;
    }

    // Caller holds lock. The connection keeps its topic set so close listeners can inspect it.
    private void unindex(Connection connection) {
        for (String topic : connection.topics()) {
            Set<String> subscribers = topicIndex.get(topic);
            if (subscribers != null) {
                subscribers.remove(connection.getId());
                if (subscribers.isEmpty()) {
                    topicIndex.remove(topic);
                }
            }
        }
    }

    private static void requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic must not be blank");
        }
    }
}
