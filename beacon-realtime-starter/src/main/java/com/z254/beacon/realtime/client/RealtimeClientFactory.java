package com.z254.beacon.realtime.client;

import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import java.time.Duration;

/**
 * Creates {@link RealtimeClient} instances that share a codec, a transport and the
 * configured default request timeout.
 */
public class RealtimeClientFactory {

    private final WebSocketClient webSocketClient;
    private final EnvelopeCodec codec;
    private final Duration requestTimeout;

    public RealtimeClientFactory(EnvelopeCodec codec, Duration requestTimeout) {
        this(new ReactorNettyWebSocketClient(), codec, requestTimeout);
    }

    public RealtimeClientFactory(WebSocketClient webSocketClient, EnvelopeCodec codec, Duration requestTimeout) {
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("Request timeout must be positive: " + requestTimeout);
        }
        this.webSocketClient = webSocketClient;
        this.codec = codec;
        this.requestTimeout = requestTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * A new, unconnected client.
     */
    public RealtimeClient create() {
        return new RealtimeClient(webSocketClient, codec, requestTimeout);
    }
}
