package com.z254.beacon.tracker.ticket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields a client may set when creating or updating a ticket. Absent fields are left unchanged on update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TicketDraft {

    private String title;
    private String description;
    private String status;
    private Integer priority;
    private String assigneeId;
}
