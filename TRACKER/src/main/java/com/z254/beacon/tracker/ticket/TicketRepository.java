package com.z254.beacon.tracker.ticket;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Storage for tickets.
 */
public interface TicketRepository {

    Mono<Ticket> save(Ticket ticket);

    Mono<Ticket> findById(String id);

    Flux<Ticket> findAll();

    Flux<Ticket> findByStatus(TicketStatus status);

    /**
     * @return true if a ticket was removed
     */
    Mono<Boolean> deleteById(String id);
}
