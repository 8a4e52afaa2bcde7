package com.z254.beacon.realtime.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.beacon.realtime.protocol.Envelope;
import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import com.z254.beacon.realtime.protocol.EnvelopeDecodingException;
import com.z254.beacon.realtime.protocol.EnvelopeEncodingException;
import com.z254.beacon.realtime.protocol.ErrorEnvelope;
import com.z254.beacon.realtime.protocol.EventEnvelope;
import com.z254.beacon.realtime.protocol.RequestEnvelope;
import com.z254.beacon.realtime.protocol.ResponseEnvelope;
import com.z254.beacon.realtime.protocol.SubscriptionEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client side of the realtime protocol: request/response over one socket plus a stream of
 * topic events.
 *
 * <p>Frames sent before the socket opens are buffered and flushed once it does. A client
 * instance owns one connection; create a new instance to reconnect.
 */
@Slf4j
public class RealtimeClient implements AutoCloseable {

    private final WebSocketClient webSocketClient;
    private final EnvelopeCodec codec;
    private final RequestCorrelator correlator;
    private final Duration requestTimeout;

    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
    private final Sinks.Many<EventEnvelope> events = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<ErrorEnvelope> errors = Sinks.many().multicast().directBestEffort();
    private final AtomicBoolean connected = new AtomicBoolean();
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile Disposable session;

    public RealtimeClient(WebSocketClient webSocketClient, EnvelopeCodec codec, Duration requestTimeout) {
        this(webSocketClient, codec, new RequestCorrelator(), requestTimeout);
    }

    public RealtimeClient(WebSocketClient webSocketClient, EnvelopeCodec codec,
                          RequestCorrelator correlator, Duration requestTimeout) {
        this.webSocketClient = webSocketClient;
        this.codec = codec;
        this.correlator = correlator;
        this.requestTimeout = requestTimeout;
    }

    // --------------------------------------------------------------------------------------------
    // Lifecycle
    // --------------------------------------------------------------------------------------------

    /**
     * Open the socket. The returned Mono completes once the handshake succeeds.
     */
    public Mono<Void> connect(URI uri) {
        if (!started.compareAndSet(false, true)) {
            return Mono.error(new IllegalStateException("Client already connected"));
        }
        Sinks.Empty<Void> opened = Sinks.empty();
        session = webSocketClient.execute(uri, webSocketSession -> {
                    connected.set(true);
                    opened.tryEmitEmpty();
                    log.debug("Realtime client connected to {}", uri);

                    Mono<Void> input = webSocketSession.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .doOnNext(this::handleFrame)
                            .then();
                    Mono<Void> output = webSocketSession.send(
                            outbound.asFlux().map(webSocketSession::textMessage));
                    return Mono.zip(input, output).then();
                })
                .doFinally(signal -> onDisconnected())
                .subscribe(
                        unused -> { },
                        error -> {
                            log.warn("Realtime connection to {} failed: {}", uri, error.getMessage());
                            opened.tryEmitError(error);
                        });
        return opened.asMono();
    }

    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public void close() {
        synchronized (outbound) {
            outbound.tryEmitComplete();
        }
        Disposable current = session;
        if (current != null) {
            current.dispose();
        }
        onDisconnected();
    }

    // --------------------------------------------------------------------------------------------
    // Requests
    // --------------------------------------------------------------------------------------------

    /**
     * Send a request and wait for the matching response's {@code data}.
     * Fails with {@link RemoteRequestException} or {@link RequestTimeoutException}.
     */
    public Mono<JsonNode> request(String method, String path, Object body) {
        return Mono.defer(() -> {
            JsonNode bodyTree;
            try {
                bodyTree = body == null ? null : codec.toTree(body);
            } catch (EnvelopeEncodingException e) {
                return Mono.error(e);
            }
            PendingRequest pending = correlator.open(requestTimeout);
            RequestEnvelope request = RequestEnvelope.builder()
                    .id(pending.getId())
                    .method(method.toUpperCase(Locale.ROOT))
                    .path(path)
                    .body(bodyTree)
                    .build();
            try {
                send(request);
            } catch (EnvelopeEncodingException | IllegalStateException e) {
                correlator.fail(pending.getId(), e);
            }
            return pending.getResponse();
        });
    }

    public <T> Mono<T> request(String method, String path, Object body, Class<T> responseType) {
        return request(method, path, body).handle((data, sink) -> {
            try {
                sink.next(codec.getObjectMapper().treeToValue(data, responseType));
            } catch (Exception e) {
                sink.error(e);
            }
        });
    }

    public Mono<JsonNode> get(String path) {
        return request("GET", path, null);
    }

    public Mono<JsonNode> post(String path, Object body) {
        return request("POST", path, body);
    }

    public Mono<JsonNode> put(String path, Object body) {
        return request("PUT", path, body);
    }

    public Mono<JsonNode> delete(String path) {
        return request("DELETE", path, null);
    }

    // --------------------------------------------------------------------------------------------
    // Subscriptions
    // --------------------------------------------------------------------------------------------

    /**
     * Subscribe this connection to a topic; completes when the server acknowledges.
     */
    public Mono<Void> subscribe(String topic) {
        return subscription(topic, false);
    }

    public Mono<Void> unsubscribe(String topic) {
        return subscription(topic, true);
    }

    /**
     * Every event received, in arrival order. Events received before subscribing are not replayed.
     */
    public Flux<EventEnvelope> events() {
        return events.asFlux();
    }

    public Flux<EventEnvelope> events(String topic) {
        return events.asFlux().filter(event -> topic.equals(event.getTopic()));
    }

    /**
     * Standalone errors from the server and frames this client could not decode.
     */
    public Flux<ErrorEnvelope> errors() {
        return errors.asFlux();
    }

    public int pendingRequests() {
        return correlator.pendingCount();
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Mono<Void> subscription(String topic, boolean unsubscribe) {
        return Mono.defer(() -> {
            PendingRequest pending = correlator.open(requestTimeout);
            SubscriptionEnvelope envelope = unsubscribe
                    ? SubscriptionEnvelope.unsubscribe(pending.getId(), topic)
                    : SubscriptionEnvelope.subscribe(pending.getId(), topic);
            try {
                send(envelope);
            } catch (EnvelopeEncodingException | IllegalStateException e) {
                correlator.fail(pending.getId(), e);
            }
            return pending.getResponse().then();
        });
    }

    private void send(Envelope envelope) throws EnvelopeEncodingException {
        String frame = codec.encode(envelope);
        Sinks.EmitResult result;
        synchronized (outbound) {
            result = outbound.tryEmitNext(frame);
        }
        if (result.isFailure()) {
            throw new IllegalStateException("Cannot send " + envelope.getType().getWireName() + ": " + result);
        }
    }

    void handleFrame(String frame) {
        Envelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (EnvelopeDecodingException e) {
            log.warn("Received invalid frame: {}", e.getMessage());
            errors.tryEmitNext(e.toErrorEnvelope());
            return;
        }

        switch (envelope.getType()) {
            case RESPONSE -> correlator.complete((ResponseEnvelope) envelope);
            case EVENT -> events.tryEmitNext((EventEnvelope) envelope);
            case ERROR -> {
                ErrorEnvelope error = (ErrorEnvelope) envelope;
                boolean correlated = error.getId() != null
                        && correlator.fail(error.getId(), new RemoteRequestException(error.getKind(), error.getError()));
                if (!correlated) {
                    errors.tryEmitNext(error);
                }
            }
            default -> log.debug("Ignoring unexpected {} frame from server", envelope.getType().getWireName());
        }
    }

    private void onDisconnected() {
        if (connected.getAndSet(false)) {
            log.debug("Realtime client disconnected");
        }
        correlator.failAll(new IllegalStateException("Connection closed"));
        events.tryEmitComplete();
        errors.tryEmitComplete();
    }
}
