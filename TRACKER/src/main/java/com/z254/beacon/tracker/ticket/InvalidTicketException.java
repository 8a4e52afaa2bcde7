package com.z254.beacon.tracker.ticket;

/**
 * A ticket draft failed validation.
 */
public class InvalidTicketException extends RuntimeException {

    public InvalidTicketException(String message) {
        super(message);
    }
}
