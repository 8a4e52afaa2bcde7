package com.z254.beacon.tracker.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.beacon.realtime.routing.ConnectionContext;
import com.z254.beacon.realtime.routing.HandlerResult;
import com.z254.beacon.realtime.routing.RealtimeRouter;
import com.z254.beacon.realtime.routing.RouteRegistrar;
import com.z254.beacon.realtime.routing.RouteRequest;
import com.z254.beacon.tracker.ticket.InvalidTicketException;
import com.z254.beacon.tracker.ticket.TicketDraft;
import com.z254.beacon.tracker.ticket.TicketService;
import com.z254.beacon.tracker.ticket.TicketStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Ticket CRUD over the socket.
 *
 * <pre>
 * GET    /api/tickets[?status=...]  -> {tickets: [...]}
 * GET    /api/tickets/:id           -> {ticket}
 * POST   /api/tickets               -> {ticket}
 * PUT    /api/tickets/:id           -> {ticket}
 * DELETE /api/tickets/:id           -> {success: true}
 * </pre>
 */
@Component
@Order(10)
@Slf4j
@RequiredArgsConstructor
public class TicketRoutes implements RouteRegistrar {

    private final TicketService ticketService;
    private final ObjectMapper objectMapper;

    @Override
    public void register(RealtimeRouter router) {
        router.get("/api/tickets", this::list);
        router.get("/api/tickets/:id", this::get);
        router.post("/api/tickets", this::create);
        router.put("/api/tickets/:id", this::update);
        router.delete("/api/tickets/:id", this::delete);
    }

    Mono<HandlerResult> list(RouteRequest request, ConnectionContext context) {
        String statusParam = request.query("status");
        TicketStatus status = null;
        if (statusParam != null && !statusParam.isBlank()) {
            status = TicketStatus.fromWire(statusParam).orElse(null);
            if (status == null) {
                return Mono.just(HandlerResult.badRequest("Unknown ticket status: " + statusParam));
            }
        }
        return ticketService.list(status)
                .collectList()
                .map(tickets -> HandlerResult.ok(Map.of("tickets", tickets)));
    }

    Mono<HandlerResult> get(RouteRequest request, ConnectionContext context) {
        String id = request.param("id");
        return ticketService.get(id)
                .map(ticket -> HandlerResult.ok(Map.of("ticket", ticket)))
                .defaultIfEmpty(HandlerResult.notFound("Ticket not found: " + id));
    }

    Mono<HandlerResult> create(RouteRequest request, ConnectionContext context) {
        return Mono.defer(() -> ticketService.create(readDraft(request)))
                .map(ticket -> HandlerResult.ok(Map.of("ticket", ticket)))
                .onErrorResume(InvalidTicketException.class, e -> Mono.just(HandlerResult.badRequest(e.getMessage())));
    }

    Mono<HandlerResult> update(RouteRequest request, ConnectionContext context) {
        String id = request.param("id");
        return Mono.defer(() -> ticketService.update(id, readDraft(request)))
                .map(ticket -> HandlerResult.ok(Map.of("ticket", ticket)))
                .defaultIfEmpty(HandlerResult.notFound("Ticket not found: " + id))
                .onErrorResume(InvalidTicketException.class, e -> Mono.just(HandlerResult.badRequest(e.getMessage())));
    }

    Mono<HandlerResult> delete(RouteRequest request, ConnectionContext context) {
        String id = request.param("id");
        return ticketService.delete(id)
                .map(deleted -> deleted
                        ? HandlerResult.ok(Map.of("success", true))
                        : HandlerResult.notFound("Ticket not found: " + id));
    }

    private TicketDraft readDraft(RouteRequest request) {
        if (!request.hasBody()) {
            throw new InvalidTicketException("Request body is required");
        }
        try {
            return objectMapper.treeToValue(request.getBody(), TicketDraft.class);
        } catch (JsonProcessingException e) {
            log.debug("Rejected ticket body on {} {}: {}", request.getMethod(), request.getPath(), e.getOriginalMessage());
            throw new InvalidTicketException("Malformed ticket body: " + e.getOriginalMessage());
        }
    }
}
