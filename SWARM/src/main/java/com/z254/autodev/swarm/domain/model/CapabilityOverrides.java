package com.z254.autodev.swarm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-spawn adjustments to an agent type's registered capability profile.
 * Null fields keep the registered value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapabilityOverrides {
    private List<String> specializationTags;
    private Double complexityHandling;
    private Double coordinationLevel;
}
