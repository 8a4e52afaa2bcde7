package com.z254.beacon.realtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the realtime layer.
 * <p>
 * Prefix: {@code beacon.realtime}
 * <p>
 * Example configuration:
 * <pre>
 * beacon:
 *   realtime:
 *     enabled: true
 *     path: /ws
 *     send-queue-capacity: 1024
 *     max-in-flight-requests: 16
 *     client:
 *       request-timeout: 10s
 * </pre>
 */
@ConfigurationProperties(prefix = "beacon.realtime")
public class RealtimeProperties {

    /**
     * Whether the realtime endpoint is enabled (default: true).
     */
    private boolean enabled = true;

    /**
     * Path the WebSocket endpoint is mapped to.
     */
    private String path = "/ws";

    /**
     * Frames buffered per connection before a send counts as failed.
     */
    private int sendQueueCapacity = 1024;

    /**
     * Requests processed concurrently per connection.
     */
    private int maxInFlightRequests = 16;

    /**
     * Order of the WebSocket handler mapping relative to other handler mappings.
     */
    private int handlerMappingOrder = -1;

    /**
     * Whether every dispatched request is logged.
     */
    private boolean logRequests = true;

    private Client client = new Client();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getSendQueueCapacity() {
        return sendQueueCapacity;
    }

    public void setSendQueueCapacity(int sendQueueCapacity) {
        this.sendQueueCapacity = sendQueueCapacity;
    }

    public int getMaxInFlightRequests() {
        return maxInFlightRequests;
    }

    public void setMaxInFlightRequests(int maxInFlightRequests) {
        this.maxInFlightRequests = maxInFlightRequests;
    }

    public int getHandlerMappingOrder() {
        return handlerMappingOrder;
    }

    public void setHandlerMappingOrder(int handlerMappingOrder) {
        this.handlerMappingOrder = handlerMappingOrder;
    }

    public boolean isLogRequests() {
        return logRequests;
    }

    public void setLogRequests(boolean logRequests) {
        this.logRequests = logRequests;
    }

    public Client getClient() {
        return client;
    }

    public void setClient(Client client) {
        this.client = client;
    }

    /**
     * Settings for {@link com.z254.beacon.realtime.client.RealtimeClient}.
     */
    public static class Client {

        /**
         * How long a request waits for its response.
         */
        private Duration requestTimeout = Duration.ofSeconds(10);

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }
}
