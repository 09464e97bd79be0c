package com.z254.autodev.swarm.error;

/**
 * A capacity limit was reached: swarm count, agents per swarm, or a swarm that no longer accepts work.
 */
public class ResourceExhaustedException extends SwarmException {

    public ResourceExhaustedException(String message) {
        super("RESOURCE_EXHAUSTED", message);
    }
}
