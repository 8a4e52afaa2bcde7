package com.z254.beacon.tracker.ticket;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum TicketStatus {
    BACKLOG,
    TODO,
    IN_PROGRESS,
    REVIEW,
    CLOSED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TicketStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TicketStatus status : values()) {
            if (status.getWireName().equalsIgnoreCase(value.trim())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
