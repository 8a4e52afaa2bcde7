package com.z254.beacon.tracker.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum AgentStatus {
    IDLE,
    WORKING,
    ERROR,
    OFFLINE;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AgentStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AgentStatus status : values()) {
            if (status.getWireName().equalsIgnoreCase(value.trim())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
