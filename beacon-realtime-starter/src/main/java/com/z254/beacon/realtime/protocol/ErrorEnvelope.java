package com.z254.beacon.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standalone error, sent when there is no request to answer (malformed frame, failed
 * fire-and-forget request). Carries the request id when one could be recovered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorEnvelope implements Envelope {

    private String id;
    private ErrorKind kind;
    private String error;

    @Override
    public EnvelopeType getType() {
        return EnvelopeType.ERROR;
    }

    public static ErrorEnvelope of(ErrorKind kind, String error) {
        return new ErrorEnvelope(null, kind, error);
    }
}
