package com.z254.beacon.realtime.broadcast;

import lombok.Value;

import java.util.List;

/**
 * Outcome of one broadcast pass.
 */
@Value
public class BroadcastResult {

    String topic;
    int attempted;
    int delivered;

    /**
     * Ids of the connections evicted because they could not be written to.
     */
    List<String> evicted;

    /**
     * True when the payload could not be serialized and nothing was sent.
     */
    boolean encodingFailed;

    static BroadcastResult encodingFailure(String topic) {
        return new BroadcastResult(topic, 0, 0, List.of(), true);
    }
}
