package com.z254.beacon.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to a {@link RequestEnvelope}, matched by {@code id}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResponseEnvelope implements Envelope {

    private String id;
    private boolean ok;
    private JsonNode data;
    private String error;
    private ErrorKind kind;

    @Override
    public EnvelopeType getType() {
        return EnvelopeType.RESPONSE;
    }

    public static ResponseEnvelope success(String id, JsonNode data) {
        return ResponseEnvelope.builder()
                .id(id)
                .ok(true)
                .data(data)
                .build();
    }

    public static ResponseEnvelope failure(String id, ErrorKind kind, String error) {
        return ResponseEnvelope.builder()
                .id(id)
                .ok(false)
                .kind(kind)
                .error(error)
                .build();
    }
}
