package com.z254.autodev.swarm.domain.model;

/**
 * Communication topology of a swarm.
 */
public enum SwarmTopology {
    MESH,
    HIERARCHICAL,
    RING,
    STAR
}
