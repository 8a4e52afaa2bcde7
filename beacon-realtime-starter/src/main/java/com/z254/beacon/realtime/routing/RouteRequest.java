package com.z254.beacon.realtime.routing;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A matched request as seen by a handler.
 */
@Value
@Builder(toBuilder = true)
public class RouteRequest {

    /** Correlation id, {@code null} for fire-and-forget requests. */
    String id;
    String method;
    /** Path without query string. */
    String path;
    /** Original path as sent, including any query string. */
    String url;
    @Builder.Default
    Map<String, String> params = Map.of();
    @Builder.Default
    Map<String, String> query = Map.of();
    JsonNode body;

    public String param(String name) {
        return params.get(name);
    }

    public String query(String name) {
        return query.get(name);
    }

    public boolean hasBody() {
        return body != null && !body.isNull() && !body.isMissingNode();
    }
}
