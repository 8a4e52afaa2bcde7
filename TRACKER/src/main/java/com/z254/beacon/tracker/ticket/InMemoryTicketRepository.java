package com.z254.beacon.tracker.ticket;

import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link TicketRepository}. Tickets are listed oldest first.
 */
@Repository
public class InMemoryTicketRepository implements TicketRepository {

    private final Map<String, Ticket> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Ticket> save(Ticket ticket) {
        if (ticket.getId() == null || ticket.getId().isBlank()) {
            ticket.setId(UUID.randomUUID().toString());
        }
        Instant now = Instant.now();
        if (ticket.getCreatedAt() == null) {
            ticket.setCreatedAt(now);
        }
        ticket.setUpdatedAt(now);
        store.put(ticket.getId(), ticket);
        return Mono.just(ticket);
    }

    @Override
    public Mono<Ticket> findById(String id) {
        return Mono.justOrEmpty(store.get(id));
    }

    @Override
    public Flux<Ticket> findAll() {
        return Flux.fromStream(store.values().stream()
                .sorted(Comparator.comparing(Ticket::getCreatedAt).thenComparing(Ticket::getId)));
    }

    @Override
    public Flux<Ticket> findByStatus(TicketStatus status) {
        return findAll().filter(ticket -> ticket.getStatus() == status);
    }

    @Override
    public Mono<Boolean> deleteById(String id) {
        return Mono.just(store.remove(id) != null);
    }
}
