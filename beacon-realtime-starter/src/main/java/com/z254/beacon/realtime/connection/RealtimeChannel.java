package com.z254.beacon.realtime.connection;

import java.io.IOException;

/**
 * Transport underneath a {@link Connection}: one text frame at a time, in call order.
 */
public interface RealtimeChannel {

    /**
     * Queue a text frame for delivery.
     *
     * @throws IOException if the peer is gone or the frame cannot be queued
     */
    void send(String frame) throws IOException;

    boolean isOpen();

    /**
     * Close the underlying socket with a WebSocket close code. Safe to call more than once.
     */
    void close(int code, String reason);
}
