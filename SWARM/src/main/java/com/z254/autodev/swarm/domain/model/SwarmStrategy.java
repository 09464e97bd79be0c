package com.z254.autodev.swarm.domain.model;

/**
 * Coordination strategy of a swarm.
 */
public enum SwarmStrategy {
    BALANCED,
    SPECIALIZED,
    ADAPTIVE
}
