package com.z254.beacon.realtime.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.beacon.realtime.broadcast.BroadcastEngine;
import com.z254.beacon.realtime.connection.Connection;
import com.z254.beacon.realtime.connection.ConnectionListener;
import com.z254.beacon.realtime.connection.ConnectionRegistry;
import com.z254.beacon.realtime.connection.ConnectionState;
import com.z254.beacon.realtime.observability.RealtimeMetrics;
import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import com.z254.beacon.realtime.routing.HandlerResult;
import com.z254.beacon.realtime.routing.RealtimeRouter;
import com.z254.beacon.realtime.routing.RouteHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RealtimeWebSocketHandler}.
 */
@ExtendWith(MockitoExtension.class)
class RealtimeWebSocketHandlerTest {

    @Mock
    private WebSocketSession session;

    @Mock
    private ConnectionListener listener;

    private ConnectionRegistry registry;
    private BroadcastEngine engine;
    private RealtimeWebSocketHandler handler;
    private List<String> sentMessages;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        EnvelopeCodec codec = new EnvelopeCodec(objectMapper);
        registry = new ConnectionRegistry();
        RealtimeMetrics metrics = new RealtimeMetrics(new SimpleMeterRegistry(), registry);
        engine = new BroadcastEngine(registry, codec, metrics);
        RealtimeRouter router = new RealtimeRouter(codec, metrics);
        router.get("/api/hello", RouteHandler.sync((req, ctx) -> HandlerResult.ok("world")));
        InboundMessageProcessor processor = new InboundMessageProcessor(codec, router, registry, engine, metrics);
        handler = new RealtimeWebSocketHandler(registry, processor, metrics, List.of(listener), 16, 4);

        sentMessages = new CopyOnWriteArrayList<>();
        lenient().when(session.getId()).thenReturn("session-1");
        lenient().when(session.isOpen()).thenReturn(true);
        lenient().when(session.getAttributes()).thenReturn(Map.of("user", "alice"));
        lenient().when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());
        lenient().when(session.textMessage(anyString())).thenAnswer(inv -> {
            String payload = inv.getArgument(0);
            WebSocketMessage msg = mock(WebSocketMessage.class);
            lenient().when(msg.getPayloadAsText()).thenReturn(payload);
            return msg;
        });
        lenient().when(session.send(any())).thenAnswer(inv -> {
            Publisher<WebSocketMessage> outbound = inv.getArgument(0);
            return Flux.from(outbound)
                    .doOnNext(msg -> sentMessages.add(msg.getPayloadAsText()))
                    .then();
        });
    }

    private WebSocketMessage inbound(String payload) {
        WebSocketMessage msg = mock(WebSocketMessage.class);
        when(msg.getPayloadAsText()).thenReturn(payload);
        return msg;
    }

    @Nested
    @DisplayName("Session lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should register the connection while the session is open")
        void registerWhileOpen() {
            Sinks.Many<WebSocketMessage> inboundSink = Sinks.many().unicast().onBackpressureBuffer();
            when(session.receive()).thenReturn(inboundSink.asFlux());

            StepVerifier.create(handler.handle(session))
                    .then(() -> {
                        assertThat(registry.find("session-1")).isPresent();
                        assertThat(registry.find("session-1").get().getAttributes()).containsEntry("user", "alice");
                        assertThat(registry.find("session-1").get().getState()).isEqualTo(ConnectionState.OPEN);
                    })
                    .then(inboundSink::tryEmitComplete)
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(registry.size()).isZero();
        }

        @Test
        @DisplayName("should notify listeners on open and close")
        void notifyListeners() {
            when(session.receive()).thenReturn(Flux.empty());

            StepVerifier.create(handler.handle(session))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            ArgumentCaptor<Connection> opened = ArgumentCaptor.forClass(Connection.class);
            ArgumentCaptor<Connection> closed = ArgumentCaptor.forClass(Connection.class);
            verify(listener).onOpen(opened.capture());
            verify(listener).onClose(closed.capture());
            assertThat(closed.getValue()).isSameAs(opened.getValue());
            assertThat(closed.getValue().getState()).isEqualTo(ConnectionState.CLOSED);
        }

        @Test
        @DisplayName("should remove subscriptions when the session ends")
        void removeSubscriptionsOnClose() {
            Sinks.Many<WebSocketMessage> inboundSink = Sinks.many().unicast().onBackpressureBuffer();
            when(session.receive()).thenReturn(inboundSink.asFlux());

            StepVerifier.create(handler.handle(session))
                    .then(() -> inboundSink.tryEmitNext(inbound("{\"type\":\"subscribe\",\"topic\":\"/tickets\"}")))
                    .then(() -> assertThat(registry.subscriberCount("/tickets")).isEqualTo(1))
                    .then(inboundSink::tryEmitComplete)
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(registry.subscriberCount("/tickets")).isZero();
        }
    }

    @Nested
    @DisplayName("Message handling")
    class MessageTests {

        @Test
        @DisplayName("should answer a request on the same session")
        void answerRequest() {
            WebSocketMessage request =
                    inbound("{\"type\":\"request\",\"id\":\"r1\",\"method\":\"GET\",\"path\":\"/api/hello\"}");
            when(session.receive()).thenReturn(Flux.just(request));

            StepVerifier.create(handler.handle(session))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(sentMessages).hasSize(1);
            assertThat(sentMessages.get(0))
                    .contains("\"type\":\"response\"")
                    .contains("\"id\":\"r1\"")
                    .contains("\"data\":\"world\"");
        }

        @Test
        @DisplayName("should survive a malformed frame and keep processing")
        void malformedThenValid() {
            WebSocketMessage garbage = inbound("garbage");
            WebSocketMessage request = inbound("{\"type\":\"request\",\"id\":\"r2\",\"path\":\"/api/hello\"}");
            when(session.receive()).thenReturn(Flux.just(garbage, request));

            StepVerifier.create(handler.handle(session))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(sentMessages).anyMatch(msg -> msg.contains("\"kind\":\"invalid_json\""));
            assertThat(sentMessages).anyMatch(msg -> msg.contains("\"id\":\"r2\"") && msg.contains("\"ok\":true"));
        }

        @Test
        @DisplayName("should push broadcasts to a subscribed session")
        void receiveBroadcast() {
            Sinks.Many<WebSocketMessage> inboundSink = Sinks.many().unicast().onBackpressureBuffer();
            when(session.receive()).thenReturn(inboundSink.asFlux());

            StepVerifier.create(handler.handle(session))
                    .then(() -> inboundSink.tryEmitNext(inbound("{\"type\":\"subscribe\",\"topic\":\"/tickets\"}")))
                    .then(() -> engine.broadcast("/tickets", Map.of("id", 1)))
                    .then(inboundSink::tryEmitComplete)
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(sentMessages).anyMatch(msg -> msg.contains("\"type\":\"event\"") && msg.contains("\"topic\":\"/tickets\""));
        }
    }
}
