package com.z254.autodev.swarm.domain.model;

/**
 * How the agents assigned to a task are driven.
 */
public enum ExecutionStrategy {

    /**
     * All agent calls issued concurrently and joined.
     */
    PARALLEL,

    /**
     * Agent calls issued one at a time, each receiving the prior outputs as context.
     */
    SEQUENTIAL,

    /**
     * Sequential for complex multi-agent tasks, parallel otherwise.
     */
    ADAPTIVE
}
