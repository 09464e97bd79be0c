package com.z254.autodev.swarm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An agent spawned inside a swarm.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agent {

    private String id;
    private String type;
    private String swarmId;

    /**
     * Effective specialization tags: the registry tags or per-spawn overrides.
     */
    @Builder.Default
    private List<String> specializationTags = new ArrayList<>();

    /**
     * Effective complexity handling score (0 - 10).
     */
    private double complexityHandling;

    /**
     * Effective coordination score (0 - 10).
     */
    private double coordinationLevel;

    @Builder.Default
    private AgentStatus status = AgentStatus.IDLE;

    @Builder.Default
    private AgentPerformance performance = new AgentPerformance();

    /**
     * Task the agent is currently working on, if busy.
     */
    private String currentTaskId;

    private Instant createdAt;

    public boolean isIdle() {
        return status == AgentStatus.IDLE;
    }

    public Agent copy() {
        return Agent.builder()
                .id(id)
                .type(type)
                .swarmId(swarmId)
                .specializationTags(new ArrayList<>(specializationTags))
                .complexityHandling(complexityHandling)
                .coordinationLevel(coordinationLevel)
                .status(status)
                .performance(performance.copy())
                .currentTaskId(currentTaskId)
                .createdAt(createdAt)
                .build();
    }
}
