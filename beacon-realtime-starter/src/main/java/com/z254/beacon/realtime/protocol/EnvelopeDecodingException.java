package com.z254.beacon.realtime.protocol;

import lombok.Getter;

/**
 * Raised when an inbound frame cannot be turned into an {@link Envelope}.
 */
@Getter
public class EnvelopeDecodingException extends Exception {

    private final ErrorKind kind;

    /**
     * Correlation id recovered from the frame, or {@code null}.
     */
    private final String requestId;

    public EnvelopeDecodingException(ErrorKind kind, String message, String requestId) {
        super(message);
        this.kind = kind;
        this.requestId = requestId;
    }

    public EnvelopeDecodingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.requestId = null;
    }

    public ErrorEnvelope toErrorEnvelope() {
        return new ErrorEnvelope(requestId, kind, getMessage());
    }
}
