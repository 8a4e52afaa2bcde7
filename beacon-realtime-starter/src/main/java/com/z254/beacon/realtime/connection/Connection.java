package com.z254.beacon.realtime.connection;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live client socket and the topics it listens to.
 * Subscriptions are maintained by {@link ConnectionRegistry}; nothing else should mutate them.
 */
@Slf4j
public class Connection {

    /** Normal closure. */
    public static final int CLOSE_NORMAL = 1000;
    /** Server-side failure, used when a send fails during broadcast. */
    public static final int CLOSE_SERVER_ERROR = 1011;

    private final String id;
    private final RealtimeChannel channel;
    private final Instant connectedAt;
    private final Map<String, Object> attributes;
    private final Set<String> topics = ConcurrentHashMap.newKeySet();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);

    public Connection(String id, RealtimeChannel channel) {
        this(id, channel, Map.of());
    }

    public Connection(String id, RealtimeChannel channel, Map<String, Object> attributes) {
        this.id = id;
        this.channel = channel;
        this.connectedAt = Instant.now();
        this.attributes = Collections.unmodifiableMap(new HashMap<>(attributes));
    }

    public String getId() {
        return id;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public ConnectionState getState() {
        return state.get();
    }

    /**
     * Topics this connection is subscribed to (read-only view).
     */
    public Set<String> getTopics() {
        return Collections.unmodifiableSet(topics);
    }

    Set<String> topics() {
        return topics;
    }

    /**
     * True while the connection is {@link ConnectionState#OPEN} and its socket accepts writes.
     */
    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN && channel.isOpen();
    }

    /**
     * Send one text frame.
     *
     * @throws IOException when the connection is not open or the transport rejects the frame
     */
    public void send(String frame) throws IOException {
        if (state.get() != ConnectionState.OPEN) {
            throw new IOException("Connection " + id + " is " + state.get());
        }
        channel.send(frame);
    }

    public boolean markOpen() {
        return transition(ConnectionState.OPEN);
    }

    /**
     * Enter {@link ConnectionState#CLOSING} and close the socket.
     *
     * @return true if this call performed the transition
     */
    public boolean close(int code, String reason) {
        if (!transition(ConnectionState.CLOSING)) {
            return false;
        }
        try {
            channel.close(code, reason);
        } catch (RuntimeException e) {
            log.debug("Error closing channel for connection {}: {}", id, e.getMessage());
        }
        return true;
    }

    public boolean markClosed() {
        return transition(ConnectionState.CLOSED);
    }

    private boolean transition(ConnectionState next) {
        while (true) {
            ConnectionState current = state.get();
            if (!current.canTransitionTo(next)) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                log.trace("Connection {} {} -> {}", id, current, next);
                return true;
            }
        }
    }

    @Override
    public String toString() {
        return "Connection[" + id + ", " + state.get() + ", topics=" + topics + "]";
    }
}
