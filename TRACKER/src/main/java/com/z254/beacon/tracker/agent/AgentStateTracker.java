package com.z254.beacon.tracker.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.beacon.realtime.connection.Connection;
import com.z254.beacon.realtime.connection.ConnectionListener;
import com.z254.beacon.realtime.connection.ConnectionRegistry;
import com.z254.beacon.realtime.protocol.EnvelopeEncodingException;
import com.z254.beacon.realtime.state.WatchedState;
import com.z254.beacon.realtime.state.WatchedStateFactory;
import com.z254.beacon.tracker.config.TrackerProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Live board of agent states, published in full on {@link #STATE_TOPIC} whenever it changes.
 *
 * <p>An agent is online while at least one connection listens on its task topic. When the
 * last such connection closes the agent is marked offline.
 */
@Component
@Slf4j
public class AgentStateTracker implements ConnectionListener {

    public static final String STATE_TOPIC = "/agents/state";

    private static final Pattern TASKS_TOPIC = Pattern.compile("^/agents/([^/]+)/tasks$");

    private final ConnectionRegistry registry;
    private final WatchedState<Map<String, AgentState>> board;

    public AgentStateTracker(WatchedStateFactory stateFactory, ConnectionRegistry registry,
                             TrackerProperties properties) {
        this.registry = registry;
        Map<String, AgentState> initial = new LinkedHashMap<>();
        for (String agentId : properties.getAgents()) {
            initial.put(agentId, new AgentState());
        }
        this.board = stateFactory.create(STATE_TOPIC, initial, properties.getAgentStateThrottle());
        log.info("Initialized agent state tracking for {} agent(s), throttle {}",
                initial.size(), properties.getAgentStateThrottle());
    }

    public static String tasksTopic(String agentId) {
        return "/agents/" + agentId + "/tasks";
    }

    public AgentState markOnline(String agentId) {
        return update(agentId, state -> state.setServiceOnline(true));
    }

    public AgentState markOffline(String agentId) {
        return update(agentId, state -> state.setServiceOnline(false));
    }

    public AgentState heartbeat(String agentId) {
        long now = Instant.now().toEpochMilli();
        return update(agentId, state -> {
            state.setServiceOnline(true);
            state.setLastHeartbeat(now);
        });
    }

    public AgentState setStatus(String agentId, AgentStatus status) {
        return update(agentId, state -> state.setDeclaredStatus(status));
    }

    public Optional<AgentState> get(String agentId) {
        return board.read(states -> Optional.ofNullable(states.get(agentId)).map(AgentState::copy));
    }

    public JsonNode snapshot() throws EnvelopeEncodingException {
        return board.snapshot();
    }

    /**
     * Broadcast the board now instead of waiting for the throttle window.
     */
    public void publishNow() {
        board.flush();
    }

    @Override
    public void onClose(Connection connection) {
        for (String topic : connection.getTopics()) {
            Matcher matcher = TASKS_TOPIC.matcher(topic);
            if (matcher.matches()) {
                markOfflineIfUnattended(matcher.group(1));
            }
        }
    }

    /**
     * Mark an agent offline when no connection listens on its task topic any more.
     *
     * @return true if the agent was marked offline
     */
    public boolean markOfflineIfUnattended(String agentId) {
        if (registry.subscriberCount(tasksTopic(agentId)) > 0) {
            return false;
        }
        log.info("Agent {} has no live connection, marking offline", agentId);
        markOffline(agentId);
        return true;
    }

    @PreDestroy
    public void shutdown() {
        board.cancel();
    }

    private AgentState update(String agentId, Consumer<AgentState> change) {
        board.mutate(states -> change.accept(states.computeIfAbsent(agentId, id -> new AgentState())));
        return board.read(states -> states.get(agentId).copy());
    }
}
