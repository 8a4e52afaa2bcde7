package com.z254.beacon.realtime.protocol;

/**
 * Raised when an envelope or payload cannot be serialized.
 */
public class EnvelopeEncodingException extends Exception {

    public EnvelopeEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
