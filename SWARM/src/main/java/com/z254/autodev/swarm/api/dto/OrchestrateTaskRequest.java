package com.z254.autodev.swarm.api.dto;

import com.z254.autodev.swarm.domain.model.ComplexityVector;
import com.z254.autodev.swarm.domain.model.ExecutionStrategy;
import com.z254.autodev.swarm.domain.model.PriorityLevel;
import com.z254.autodev.swarm.domain.model.TaskPriority;
import com.z254.autodev.swarm.orchestration.OrchestrationRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for orchestrating a task across a swarm.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestrateTaskRequest {

    @NotBlank(message = "Task description is required")
    @Size(max = 50000, message = "Description must be less than 50000 characters")
    private String description;

    @Builder.Default
    private PriorityLevel priority = PriorityLevel.MEDIUM;

    private Instant deadline;

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    @Valid
    private Complexity complexity;

    @Min(value = 1, message = "maxAgents must be at least 1")
    private Integer maxAgents;

    private ExecutionStrategy strategy;

    private String provider;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Complexity {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double computational;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double logical;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double creative;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double domainSpecific;
    }

    /**
     * Convert to an orchestration request against the given swarm.
     */
    public OrchestrationRequest toRequest(String swarmId) {
        return OrchestrationRequest.builder()
                .swarmId(swarmId)
                .description(description)
                .priority(TaskPriority.builder()
                        .level(priority != null ? priority : PriorityLevel.MEDIUM)
                        .deadline(deadline)
                        .dependencies(dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>())
                        .build())
                .complexity(complexity != null
                        ? ComplexityVector.of(complexity.getComputational(), complexity.getLogical(),
                                complexity.getCreative(), complexity.getDomainSpecific())
                        : null)
                .maxAgents(maxAgents)
                .strategy(strategy)
                .provider(provider)
                .build();
    }
}
