package com.z254.autodev.swarm.orchestration;

import com.z254.autodev.swarm.domain.model.ComplexityVector;
import com.z254.autodev.swarm.domain.model.ExecutionStrategy;

/**
 * Resolves the requested execution strategy to PARALLEL or SEQUENTIAL.
 */
public final class StrategyResolver {

    /**
     * Means within this distance of the threshold count as equal to it.
     */
    private static final double THRESHOLD_TOLERANCE = 1e-9;

    private StrategyResolver() {
    }

    /**
     * ADAPTIVE becomes SEQUENTIAL when {@code mean(complexity) > threshold} and more than one agent is
     * assigned, PARALLEL otherwise. A mean equal to the threshold up to rounding stays PARALLEL.
     * Explicit strategies are returned unchanged.
     */
    public static ExecutionStrategy resolve(ExecutionStrategy requested, ComplexityVector complexity,
                                            int assignedAgents, double threshold) {
        if (requested != null && requested != ExecutionStrategy.ADAPTIVE) {
            return requested;
        }
        return complexity.mean() - threshold > THRESHOLD_TOLERANCE && assignedAgents > 1
                ? ExecutionStrategy.SEQUENTIAL
                : ExecutionStrategy.PARALLEL;
    }
}
