package com.z254.autodev.swarm.api.dto;

import com.z254.autodev.swarm.domain.model.CapabilityOverrides;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for spawning an agent into a swarm.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpawnAgentRequest {

    @NotBlank(message = "Agent type is required")
    private String agentType;

    private List<String> specializationTags;

    @DecimalMin("0.0")
    @DecimalMax("10.0")
    private Double complexityHandling;

    @DecimalMin("0.0")
    @DecimalMax("10.0")
    private Double coordinationLevel;

    /**
     * Convert to capability overrides, or null when nothing is overridden.
     */
    public CapabilityOverrides toOverrides() {
        if (specializationTags == null && complexityHandling == null && coordinationLevel == null) {
            return null;
        }
        return CapabilityOverrides.builder()
                .specializationTags(specializationTags)
                .complexityHandling(complexityHandling)
                .coordinationLevel(coordinationLevel)
                .build();
    }
}
