package com.z254.autodev.swarm.domain.model;

public enum AgentStatus {
    IDLE,
    BUSY
}
