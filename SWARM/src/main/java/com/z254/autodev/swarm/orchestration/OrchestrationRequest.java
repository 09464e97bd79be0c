package com.z254.autodev.swarm.orchestration;

import com.z254.autodev.swarm.domain.model.ComplexityVector;
import com.z254.autodev.swarm.domain.model.ExecutionStrategy;
import com.z254.autodev.swarm.domain.model.TaskPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A task submitted for orchestration across a swarm.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestrationRequest {

    private String swarmId;
    private String description;
    private TaskPriority priority;
    private ComplexityVector complexity;

    /**
     * Maximum agents to assign. Null uses the configured default.
     */
    private Integer maxAgents;

    /**
     * Null means ADAPTIVE.
     */
    private ExecutionStrategy strategy;

    /**
     * Provider for every agent call. Null routes by agent type or capability ranking.
     */
    private String provider;
}
