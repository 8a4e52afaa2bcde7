package com.z254.beacon.tracker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.beacon.realtime.routing.ConnectionContext;
import com.z254.beacon.realtime.routing.HandlerResult;
import com.z254.beacon.realtime.routing.RealtimeRouter;
import com.z254.beacon.realtime.routing.RouteHandler;
import com.z254.beacon.realtime.routing.RouteRegistrar;
import com.z254.beacon.realtime.routing.RouteRequest;
import com.z254.beacon.tracker.agent.AgentState;
import com.z254.beacon.tracker.agent.AgentStateTracker;
import com.z254.beacon.tracker.agent.AgentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

/**
 * Agent presence and status routes. An agent service calls {@code online} once per
 * connection; that subscribes the connection to the agent's task topic so that losing the
 * connection marks the agent offline.
 */
@Component
@Order(20)
@Slf4j
@RequiredArgsConstructor
public class AgentRoutes implements RouteRegistrar {

    private final AgentStateTracker tracker;

    @Override
    public void register(RealtimeRouter router) {
        router.get("/api/agents/state", this::state);
        router.post("/api/agents/:id/online", RouteHandler.sync(this::online));
        router.post("/api/agents/:id/heartbeat", RouteHandler.sync(this::heartbeat));
        router.put("/api/agents/:id/status", RouteHandler.sync(this::status));
    }

    Mono<HandlerResult> state(RouteRequest request, ConnectionContext context) {
        return Mono.fromCallable(tracker::snapshot).map(HandlerResult::ok);
    }

    HandlerResult online(RouteRequest request, ConnectionContext context) {
        String agentId = request.param("id");
        String topic = AgentStateTracker.tasksTopic(agentId);
        if (!context.subscribe(topic) && !context.getTopics().contains(topic)) {
            return HandlerResult.conflict("Connection " + context.getConnectionId() + " is closed");
        }
        AgentState state = tracker.markOnline(agentId);
        if (!context.isRegistered()) {
            // Closed between subscribe and markOnline; its close listener may already have run.
            tracker.markOfflineIfUnattended(agentId);
            return HandlerResult.conflict("Connection " + context.getConnectionId() + " is closed");
        }
        log.info("Agent {} online via connection {}", agentId, context.getConnectionId());
        return HandlerResult.ok(Map.of("agentId", agentId, "tasksTopic", topic, "state", state));
    }

    HandlerResult heartbeat(RouteRequest request, ConnectionContext context) {
        String agentId = request.param("id");
        return HandlerResult.ok(Map.of("agentId", agentId, "state", tracker.heartbeat(agentId)));
    }

    HandlerResult status(RouteRequest request, ConnectionContext context) {
        String agentId = request.param("id");
        String value = Optional.ofNullable(request.getBody())
                .map(body -> body.get("status"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .orElse(null);
        if (value == null) {
            return HandlerResult.badRequest("Field 'status' is required");
        }
        return AgentStatus.fromWire(value)
                .map(status -> HandlerResult.ok(Map.of("agentId", agentId, "state", tracker.setStatus(agentId, status))))
                .orElseGet(() -> HandlerResult.badRequest("Unknown agent status: " + value));
    }
}
