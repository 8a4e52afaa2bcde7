package com.z254.beacon.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.beacon.realtime.client.RealtimeClient;
import com.z254.beacon.realtime.client.RealtimeClientFactory;
import com.z254.beacon.realtime.client.RemoteRequestException;
import com.z254.beacon.realtime.protocol.ErrorKind;
import com.z254.beacon.realtime.protocol.EventEnvelope;
import com.z254.beacon.tracker.agent.AgentStateTracker;
import com.z254.beacon.tracker.ticket.TicketService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests over a real socket.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "tracker.agent-state-throttle=200ms",
                "tracker.agents=planner",
                "beacon.realtime.client.request-timeout=5s"
        })
class RealtimeIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @LocalServerPort
    private int port;

    @Autowired
    private RealtimeClientFactory clientFactory;

    private RealtimeClient viewer;
    private RealtimeClient editor;

    @BeforeEach
    void setUp() {
        viewer = connect();
        editor = connect();
    }

    @AfterEach
    void tearDown() {
        viewer.close();
        editor.close();
    }

    private RealtimeClient connect() {
        RealtimeClient client = clientFactory.create();
        client.connect(URI.create("ws://localhost:" + port + "/ws")).block(TIMEOUT);
        return client;
    }

    @Test
    @DisplayName("should deliver a ticket event to subscribers but not to the unsubscribed")
    void ticketEventReachesSubscribers() {
        viewer.subscribe(TicketService.TOPIC).block(TIMEOUT);

        StepVerifier.create(viewer.events(TicketService.TOPIC).next())
                .then(() -> editor.post("/api/tickets", Map.of("title", "Wire up login")).block(TIMEOUT))
                .assertNext(event -> {
                    assertThat(event.getPayload().get("type").asText()).isEqualTo("ticket:created");
                    assertThat(event.getPayload().get("ticket").get("title").asText()).isEqualTo("Wire up login");
                })
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    @DisplayName("should correlate responses and surface route errors")
    void requestResponse() {
        JsonNode created = editor.post("/api/tickets", Map.of("title", "Check logs")).block(TIMEOUT);
        String id = created.get("ticket").get("id").asText();

        StepVerifier.create(editor.get("/api/tickets/" + id))
                .assertNext(data -> assertThat(data.get("ticket").get("id").asText()).isEqualTo(id))
                .verifyComplete();

        StepVerifier.create(editor.get("/api/tickets/does-not-exist"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(RemoteRequestException.class);
                    assertThat(((RemoteRequestException) error).getKind()).isEqualTo(ErrorKind.NOT_FOUND);
                })
                .verify(TIMEOUT);

        StepVerifier.create(editor.get("/api/nothing-here"))
                .expectErrorSatisfies(error -> assertThat(error).hasMessageContaining("No route matched for: GET /api/nothing-here"))
                .verify(TIMEOUT);
    }

    @Test
    @DisplayName("should push assignments to the agent and mark it offline when it disconnects")
    void agentPresence() {
        RealtimeClient agent = connect();
        agent.post("/api/agents/planner/online", null).block(TIMEOUT);
        viewer.subscribe(AgentStateTracker.STATE_TOPIC).block(TIMEOUT);

        StepVerifier.create(agent.events(AgentStateTracker.tasksTopic("planner")).next())
                .then(() -> editor.post("/api/tickets", Map.of("title", "Plan sprint", "assigneeId", "planner")).block(TIMEOUT))
                .assertNext(event -> assertThat(event.getPayload().get("taskType").asText()).isEqualTo("assignment"))
                .expectComplete()
                .verify(TIMEOUT);

        StepVerifier.create(viewer.events(AgentStateTracker.STATE_TOPIC)
                        .map(EventEnvelope::getPayload)
                        .filter(board -> "offline".equals(board.path("planner").path("status").asText()))
                        .next())
                .then(agent::close)
                .assertNext(board -> assertThat(board.get("planner").get("serviceOnline").asBoolean()).isFalse())
                .expectComplete()
                .verify(TIMEOUT);
    }
}
