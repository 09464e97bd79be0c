package com.z254.autodev.swarm.domain.model;

/**
 * Status of an orchestrated task.
 */
public enum TaskStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
