package com.z254.beacon.realtime.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;
import reactor.core.publisher.Mono;

/**
 * A correlation id and the eventual response data for it.
 */
@Value
public class PendingRequest {
    String id;
    Mono<JsonNode> response;
}
