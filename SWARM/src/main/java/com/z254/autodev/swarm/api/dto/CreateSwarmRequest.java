package com.z254.autodev.swarm.api.dto;

import com.z254.autodev.swarm.domain.model.SwarmStrategy;
import com.z254.autodev.swarm.domain.model.SwarmTopology;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a swarm.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSwarmRequest {

    @NotNull(message = "Topology is required")
    private SwarmTopology topology;

    @Min(value = 1, message = "A swarm needs room for at least one agent")
    private int maxAgents;

    @Builder.Default
    private SwarmStrategy strategy = SwarmStrategy.BALANCED;
}
