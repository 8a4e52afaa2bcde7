package com.z254.beacon.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TRACKER - ticket tracker with a live agent board.
 *
 * <p>Every API call arrives as a request envelope over the BEACON realtime socket:
 * <ul>
 *   <li>Tickets - CRUD with {@code ticket:*} events on {@code /tickets}</li>
 *   <li>Agent board - watched state published on {@code /agents/state}</li>
 *   <li>Agent tasks - targeted pushes on {@code /agents/:id/tasks}</li>
 * </ul>
 */
@SpringBootApplication
public class TrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackerApplication.class, args);
    }
}
