package com.z254.beacon.tracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for TRACKER.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    /**
     * Minimum interval between agent board broadcasts.
     */
    private Duration agentStateThrottle = Duration.ofSeconds(2);

    /**
     * Agents present on the board at startup, reported offline until they connect.
     */
    private List<String> agents = new ArrayList<>();

    private TicketProperties tickets = new TicketProperties();

    @Data
    public static class TicketProperties {
        private int maxTitleLength = 200;
    }
}
