package com.z254.autodev.swarm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate counters for a swarm.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwarmMetrics {

    private long tasksCompleted;
    private long tasksFailed;
    private int totalAgents;

    /**
     * Running mean of task wall-clock time in milliseconds.
     */
    private double averageResponseTime;

    public void recordTask(long durationMs, boolean success) {
        long finished = tasksCompleted + tasksFailed;
        averageResponseTime = (averageResponseTime * finished + durationMs) / (finished + 1);
        if (success) {
            tasksCompleted++;
        } else {
            tasksFailed++;
        }
    }

    public SwarmMetrics copy() {
        return new SwarmMetrics(tasksCompleted, tasksFailed, totalAgents, averageResponseTime);
    }
}
