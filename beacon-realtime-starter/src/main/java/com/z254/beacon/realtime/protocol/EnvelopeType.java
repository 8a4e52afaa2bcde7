package com.z254.beacon.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Discriminator carried in the {@code type} field of every envelope.
 */
public enum EnvelopeType {
    REQUEST("request"),
    RESPONSE("response"),
    EVENT("event"),
    ERROR("error"),
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe");

    private final String wireName;

    EnvelopeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<EnvelopeType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst();
    }
}
