package com.z254.autodev.swarm.resilience;

import lombok.Value;

import java.time.Duration;

@Value
public class CircuitBreakerPolicy {

    /**
     * Consecutive failures that open the circuit.
     */
    int failureThreshold;

    /**
     * Time since the last failure after which one trial call is admitted.
     */
    Duration coolDown;
}
