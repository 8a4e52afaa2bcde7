package com.z254.beacon.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A unit on the wire. Every variant serializes its {@link EnvelopeType} as {@code type}.
 */
public interface Envelope {

    @JsonProperty("type")
    EnvelopeType getType();
}
