package com.z254.autodev.swarm.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
