package com.z254.beacon.tracker.ticket;

import com.z254.beacon.realtime.broadcast.BroadcastEngine;
import com.z254.beacon.tracker.agent.AgentStateTracker;
import com.z254.beacon.tracker.config.TrackerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ticket lifecycle. Every change is announced on {@link #TOPIC}; assigning a ticket also
 * pushes a task to the assignee's task topic.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TicketService {

    public static final String TOPIC = "/tickets";

    private final TicketRepository repository;
    private final BroadcastEngine broadcastEngine;
    private final TrackerProperties properties;

    public Flux<Ticket> list(TicketStatus status) {
        return status == null ? repository.findAll() : repository.findByStatus(status);
    }

    public Mono<Ticket> get(String id) {
        return repository.findById(id);
    }

    public Mono<Ticket> create(TicketDraft draft) {
        return Mono.defer(() -> {
            String title = requireTitle(draft.getTitle());
            Ticket ticket = Ticket.builder()
                    .title(title)
                    .description(draft.getDescription())
                    .status(draft.getStatus() == null ? TicketStatus.BACKLOG : parseStatus(draft.getStatus()))
                    .priority(draft.getPriority())
                    .assigneeId(blankToNull(draft.getAssigneeId()))
                    .build();
            return repository.save(ticket);
        }).doOnNext(ticket -> {
            log.info("Created ticket {}: {}", ticket.getId(), ticket.getTitle());
            publish("ticket:created", "ticket", ticket);
            if (ticket.getAssigneeId() != null) {
                assignTask(ticket);
            }
        });
    }

    /**
     * Apply the non-null fields of {@code changes}. Empty when the ticket does not exist.
     */
    public Mono<Ticket> update(String id, TicketDraft changes) {
        return repository.findById(id)
                .flatMap(existing -> {
                    Ticket updated = existing.toBuilder().build();
                    if (changes.getTitle() != null) {
                        updated.setTitle(requireTitle(changes.getTitle()));
                    }
                    if (changes.getDescription() != null) {
                        updated.setDescription(changes.getDescription());
                    }
                    if (changes.getStatus() != null) {
                        updated.setStatus(parseStatus(changes.getStatus()));
                    }
                    if (changes.getPriority() != null) {
                        updated.setPriority(changes.getPriority());
                    }
                    if (changes.getAssigneeId() != null) {
                        updated.setAssigneeId(blankToNull(changes.getAssigneeId()));
                    }
                    boolean reassigned = updated.getAssigneeId() != null
                            && !Objects.equals(existing.getAssigneeId(), updated.getAssigneeId());
                    return repository.save(updated)
                            .doOnNext(saved -> {
                                publish("ticket:updated", "ticket", saved);
                                if (reassigned) {
                                    assignTask(saved);
                                }
                            });
                });
    }

    /**
     * @return true if the ticket existed
     */
    public Mono<Boolean> delete(String id) {
        return repository.deleteById(id)
                .doOnNext(deleted -> {
                    if (deleted) {
                        log.info("Deleted ticket {}", id);
                        publish("ticket:deleted", "ticketId", id);
                    }
                });
    }

    private void publish(String type, String key, Object value) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", type);
        event.put(key, value);
        broadcastEngine.broadcast(TOPIC, event);
    }

    private void assignTask(Ticket ticket) {
        Map<String, Object> task = new LinkedHashMap<>();
        task.put("taskType", "assignment");
        task.put("ticketId", ticket.getId());
        task.put("title", ticket.getTitle());
        String topic = AgentStateTracker.tasksTopic(ticket.getAssigneeId());
        int delivered = broadcastEngine.emitEvent(topic, task).getDelivered();
        log.info("Pushed assignment of ticket {} to {} ({} listener(s))", ticket.getId(), topic, delivered);
    }

    private String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new InvalidTicketException("Ticket title is required");
        }
        String trimmed = title.trim();
        int max = properties.getTickets().getMaxTitleLength();
        if (trimmed.length() > max) {
            throw new InvalidTicketException("Ticket title exceeds " + max + " characters");
        }
        return trimmed;
    }

    private static TicketStatus parseStatus(String status) {
        return TicketStatus.fromWire(status)
                .orElseThrow(() -> new InvalidTicketException("Unknown ticket status: " + status));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
