package com.z254.autodev.swarm.domain.model;

/**
 * Lifecycle status of a swarm.
 */
public enum SwarmStatus {

    /**
     * Swarm accepts new agents and tasks.
     */
    ACTIVE,

    /**
     * Teardown requested; waiting for busy agents to finish.
     */
    DRAINING,

    /**
     * Swarm has been torn down.
     */
    CLOSED
}
