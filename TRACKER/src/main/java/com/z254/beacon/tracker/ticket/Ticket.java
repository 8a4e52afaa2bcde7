package com.z254.beacon.tracker.ticket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Ticket {

    private String id;
    private String title;
    private String description;
    private TicketStatus status;
    private Integer priority;
    private String assigneeId;
    private Instant createdAt;
    private Instant updatedAt;
}
