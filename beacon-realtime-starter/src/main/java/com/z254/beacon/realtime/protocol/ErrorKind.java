package com.z254.beacon.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of an error carried by an error response or a standalone error envelope.
 */
public enum ErrorKind {
    /** Inbound frame is not a JSON object. */
    INVALID_JSON("invalid_json"),
    /** Inbound frame has no recognized {@code type}. */
    UNKNOWN_TYPE("unknown_type"),
    /** Recognized type, but a required field is missing or invalid. */
    MALFORMED_MESSAGE("malformed_message"),
    /** No route matched the request method and path. */
    NOT_FOUND("not_found"),
    BAD_REQUEST("bad_request"),
    CONFLICT("conflict"),
    /** The handler threw or signalled an unexpected exception. */
    HANDLER_FAILURE("handler_failure");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ErrorKind fromWire(String value) {
        for (ErrorKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return kind;
            }
        }
        return HANDLER_FAILURE;
    }
}
