package com.z254.autodev.swarm.domain.model;

public enum PriorityLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
