package com.z254.autodev.swarm.resilience;

/**
 * Inputs of the circuit breaker state machine.
 * <p>
 * {@code CALL_*} events come from calls admitted while the breaker was closed; {@code TRIAL_*}
 * events come only from the single call admitted after the cool-down.
 */
public enum CircuitBreakerEvent {

    CALL_SUCCEEDED,

    CALL_FAILED,

    /**
     * The cool-down has elapsed and a single trial call is let through.
     */
    TRIAL_ADMITTED,

    TRIAL_SUCCEEDED,

    TRIAL_FAILED,

    /**
     * The trial call ended without a verdict (cancelled or rejected locally).
     */
    TRIAL_RELEASED
}
