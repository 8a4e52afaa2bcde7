package com.z254.beacon.realtime.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Encodes envelopes to text frames and validates inbound frames.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>the frame must be a JSON object, otherwise {@link ErrorKind#INVALID_JSON}</li>
 *   <li>{@code type} must name a known {@link EnvelopeType}, otherwise {@link ErrorKind#UNKNOWN_TYPE}</li>
 *   <li>required fields per variant must be present, otherwise {@link ErrorKind#MALFORMED_MESSAGE}</li>
 * </ul>
 */
@Slf4j
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.readerFor(JsonNode.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Serialize an envelope to a text frame.
     */
    public String encode(Envelope envelope) throws EnvelopeEncodingException {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new EnvelopeEncodingException(
                    "Failed to encode " + envelope.getType().getWireName() + " envelope: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Convert an arbitrary payload into a JSON tree. {@code null} becomes {@link NullNode}.
     */
    public JsonNode toTree(Object payload) throws EnvelopeEncodingException {
        if (payload == null) {
            return NullNode.getInstance();
        }
        if (payload instanceof JsonNode node) {
            return node;
        }
        try {
            return objectMapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            throw new EnvelopeEncodingException(
                    "Failed to serialize payload of type " + payload.getClass().getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse and validate an inbound text frame.
     */
    public Envelope decode(String frame) throws EnvelopeDecodingException {
        JsonNode root;
        try {
            root = strictReader.readValue(frame);
        } catch (JsonProcessingException e) {
            throw new EnvelopeDecodingException(ErrorKind.INVALID_JSON,
                    "Invalid JSON message: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new EnvelopeDecodingException(ErrorKind.INVALID_JSON,
                    "Invalid message format: expected a JSON object", (String) null);
        }

        String id = textOrNull(root, "id");
        String typeName = textOrNull(root, "type");
        EnvelopeType type = EnvelopeType.fromWire(typeName)
                .orElseThrow(() -> new EnvelopeDecodingException(ErrorKind.UNKNOWN_TYPE,
                        typeName == null ? "Missing message type" : "Unknown message type: " + typeName, id));

        return switch (type) {
            case REQUEST -> decodeRequest(root, id);
            case RESPONSE -> decodeResponse(root, id);
            case EVENT -> decodeEvent(root, id);
            case ERROR -> decodeError(root, id);
            case SUBSCRIBE, UNSUBSCRIBE -> decodeSubscription(root, id, type == EnvelopeType.UNSUBSCRIBE);
        };
    }

    private RequestEnvelope decodeRequest(JsonNode root, String id) throws EnvelopeDecodingException {
        String path = textOrNull(root, "path");
        if (path == null || path.isBlank()) {
            throw new EnvelopeDecodingException(ErrorKind.MALFORMED_MESSAGE, "Missing required field: path", id);
        }
        String method = textOrNull(root, "method");
        method = method == null || method.isBlank()
                ? RequestEnvelope.DEFAULT_METHOD
                : method.trim().toUpperCase(Locale.ROOT);

        JsonNode body = root.get("body");
        if (body != null && body.isNull()) {
            body = null;
        }
        return RequestEnvelope.builder()
                .id(id)
                .method(method)
                .path(path.trim())
                .body(body)
                .build();
    }

    private ResponseEnvelope decodeResponse(JsonNode root, String id) throws EnvelopeDecodingException {
        if (id == null) {
            throw new EnvelopeDecodingException(ErrorKind.MALFORMED_MESSAGE, "Missing required field: id", (String) null);
        }
        JsonNode ok = root.get("ok");
        if (ok == null || !ok.isBoolean()) {
            throw new EnvelopeDecodingException(ErrorKind.MALFORMED_MESSAGE, "Missing required field: ok", id);
        }
        JsonNode kind = root.get("kind");
        return ResponseEnvelope.builder()
                .id(id)
                .ok(ok.booleanValue())
                .data(root.get("data"))
                .error(textOrNull(root, "error"))
                .kind(kind == null || kind.isNull() ? null : ErrorKind.fromWire(kind.asText()))
                .build();
    }

    private EventEnvelope decodeEvent(JsonNode root, String id) throws EnvelopeDecodingException {
        String topic = textOrNull(root, "topic");
        if (topic == null || topic.isBlank()) {
            throw new EnvelopeDecodingException(ErrorKind.MALFORMED_MESSAGE, "Missing required field: topic", id);
        }
        JsonNode payload = root.get("payload");
        return new EventEnvelope(topic, payload == null ? NullNode.getInstance() : payload);
    }

    private ErrorEnvelope decodeError(JsonNode root, String id) {
        JsonNode kind = root.get("kind");
        return ErrorEnvelope.builder()
                .id(id)
                .kind(kind == null || kind.isNull() ? ErrorKind.HANDLER_FAILURE : ErrorKind.fromWire(kind.asText()))
                .error(textOrNull(root, "error"))
                .build();
    }

    private SubscriptionEnvelope decodeSubscription(JsonNode root, String id, boolean unsubscribe)
            throws EnvelopeDecodingException {
        String topic = textOrNull(root, "topic");
        if (topic == null || topic.isBlank()) {
            throw new EnvelopeDecodingException(ErrorKind.MALFORMED_MESSAGE, "Missing required field: topic", id);
        }
        return new SubscriptionEnvelope(unsubscribe, id, topic.trim());
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }
}
