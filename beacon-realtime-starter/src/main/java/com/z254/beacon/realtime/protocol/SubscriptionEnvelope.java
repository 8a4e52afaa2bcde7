package com.z254.beacon.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Subscribe or unsubscribe the sending connection to a topic. When {@code id} is present
 * the server acknowledges with a success response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubscriptionEnvelope implements Envelope {

    @JsonIgnore
    private boolean unsubscribe;
    private String id;
    private String topic;

    @Override
    public EnvelopeType getType() {
        return unsubscribe ? EnvelopeType.UNSUBSCRIBE : EnvelopeType.SUBSCRIBE;
    }

    public static SubscriptionEnvelope subscribe(String id, String topic) {
        return new SubscriptionEnvelope(false, id, topic);
    }

    public static SubscriptionEnvelope unsubscribe(String id, String topic) {
        return new SubscriptionEnvelope(true, id, topic);
    }
}
