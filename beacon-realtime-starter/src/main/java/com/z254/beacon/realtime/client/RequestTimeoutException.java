package com.z254.beacon.realtime.client;

import java.time.Duration;

/**
 * No response arrived for a request within its timeout.
 */
public class RequestTimeoutException extends RuntimeException {

    private final String requestId;

    public RequestTimeoutException(String requestId, Duration timeout) {
        super("Request " + requestId + " timed out after " + timeout.toMillis() + "ms");
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
