package com.z254.beacon.realtime.connection;

/**
 * Lifecycle of a {@link Connection}. Transitions only move forward; {@link #CLOSED} is terminal.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED;

    boolean canTransitionTo(ConnectionState next) {
        return next.ordinal() > this.ordinal();
    }
}
