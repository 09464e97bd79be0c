package com.z254.autodev.swarm.llm.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Caller constraints and priority flags applied when ranking providers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvocationConstraints {

    @Builder.Default
    private Set<String> excludeProviders = new HashSet<>();

    /**
     * Providers with a cost score above this value are skipped.
     */
    private Double maxCost;

    /**
     * Providers with a speed score below this value are skipped.
     */
    private Double minSpeed;

    private boolean optimizeCost;
    private boolean prioritizeSpeed;

    public static InvocationConstraints none() {
        return new InvocationConstraints();
    }

    /**
     * Constraints used for agent calls.
     */
    public static InvocationConstraints forAgents() {
        return InvocationConstraints.builder()
                .optimizeCost(true)
                .prioritizeSpeed(false)
                .build();
    }
}
