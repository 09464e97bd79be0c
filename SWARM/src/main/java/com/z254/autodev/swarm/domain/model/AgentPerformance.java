package com.z254.autodev.swarm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Running performance statistics of a single agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentPerformance {

    private long tasksCompleted;

    /**
     * Running mean of response time in milliseconds.
     */
    private double averageTime;

    /**
     * Running mean of success (1.0) and failure (0.0) observations.
     */
    @Builder.Default
    private double successRate = 1.0;

    /**
     * Folds one observation into the running means.
     * After n observations both means equal the arithmetic mean of those n values.
     */
    public void record(long responseTimeMs, boolean success) {
        long n = tasksCompleted + 1;
        averageTime = (averageTime * tasksCompleted + responseTimeMs) / n;
        successRate = (successRate * tasksCompleted + (success ? 1.0 : 0.0)) / n;
        tasksCompleted = n;
    }

    public AgentPerformance copy() {
        return new AgentPerformance(tasksCompleted, averageTime, successRate);
    }
}
