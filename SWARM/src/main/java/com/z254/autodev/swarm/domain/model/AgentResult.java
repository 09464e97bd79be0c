package com.z254.autodev.swarm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Output of one agent call made on behalf of a task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResult {

    private String agentId;
    private String agentType;

    /**
     * Position of the call in the execution plan, starting at zero.
     */
    private int step;

    private String output;
    private String provider;
    private long responseTimeMs;
    private int tokensUsed;
    private boolean cached;
    private Instant timestamp;
}
