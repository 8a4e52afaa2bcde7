package com.z254.beacon.realtime.routing;

import com.z254.beacon.realtime.broadcast.BroadcastEngine;
import com.z254.beacon.realtime.broadcast.BroadcastResult;
import com.z254.beacon.realtime.connection.Connection;
import com.z254.beacon.realtime.connection.ConnectionRegistry;

import java.util.Map;
import java.util.Set;

/**
 * What a handler may do with the connection that sent the request.
 */
public class ConnectionContext {

    private final Connection connection;
    private final ConnectionRegistry registry;
    private final BroadcastEngine broadcastEngine;

    public ConnectionContext(Connection connection, ConnectionRegistry registry, BroadcastEngine broadcastEngine) {
        this.connection = connection;
        this.registry = registry;
        this.broadcastEngine = broadcastEngine;
    }

    public String getConnectionId() {
        return connection.getId();
    }

    public Map<String, Object> getAttributes() {
        return connection.getAttributes();
    }

    /**
     * False once the connection has been removed from the registry.
     */
    public boolean isRegistered() {
        return registry.find(connection.getId()).isPresent();
    }

    public Set<String> getTopics() {
        return registry.topicsFor(connection.getId());
    }

    public boolean subscribe(String topic) {
        return registry.subscribe(connection.getId(), topic);
    }

    public boolean unsubscribe(String topic) {
        return registry.unsubscribe(connection.getId(), topic);
    }

    public BroadcastResult broadcast(String topic, Object payload) {
        return broadcastEngine.broadcast(topic, payload);
    }

    public BroadcastResult broadcastAll(String topic, Object payload) {
        return broadcastEngine.broadcastAll(topic, payload);
    }
}
