package com.z254.beacon.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request addressed to a server-side route. The {@code id} is optional: requests without
 * one are fire-and-forget and only produce a frame when they fail.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestEnvelope implements Envelope {

    public static final String DEFAULT_METHOD = "GET";

    private String id;
    private String method;
    private String path;
    private JsonNode body;

    @Override
    public EnvelopeType getType() {
        return EnvelopeType.REQUEST;
    }
}
