package com.z254.beacon.tracker.agent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One agent's entry on the board.
 */
@Data
@NoArgsConstructor
public class AgentState {

    private boolean serviceOnline;
    private Long lastHeartbeat;

    /**
     * Status last reported by the agent itself.
     */
    @JsonIgnore
    private AgentStatus declaredStatus = AgentStatus.IDLE;

    /**
     * Status shown on the board: an agent whose service is gone is offline unless it is
     * still working on something.
     */
    @JsonProperty("status")
    public AgentStatus getStatus() {
        if (!serviceOnline && declaredStatus != AgentStatus.WORKING) {
            return AgentStatus.OFFLINE;
        }
        return declaredStatus;
    }

    public AgentState copy() {
        AgentState copy = new AgentState();
        copy.setServiceOnline(serviceOnline);
        copy.setLastHeartbeat(lastHeartbeat);
        copy.setDeclaredStatus(declaredStatus);
        return copy;
    }
}
