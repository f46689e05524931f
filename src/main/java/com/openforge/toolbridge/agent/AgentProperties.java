package com.openforge.toolbridge.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Turn and session limits.
 *
 * agent:
 *   turn-timeout-seconds: 120
 *   turn-workers: 16
 *   session:
 *     idle-timeout-minutes: 30
 */
@ConfigurationProperties(prefix = "agent")
public record AgentProperties(
        @DefaultValue("120") int turnTimeoutSeconds,
        @DefaultValue("16") int turnWorkers,
        @DefaultValue Session session
) {

    public record Session(
            @DefaultValue("30") int idleTimeoutMinutes
    ) {}
}
