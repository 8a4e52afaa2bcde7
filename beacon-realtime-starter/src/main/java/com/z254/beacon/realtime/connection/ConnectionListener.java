package com.z254.beacon.realtime.connection;

/**
 * Callback for connection lifecycle changes. Implementations must not block.
 */
public interface ConnectionListener {

    default void onOpen(Connection connection) {
    }

    /**
     * Called after the connection has been removed from the registry.
     */
    default void onClose(Connection connection) {
    }
}
