package com.z254.autodev.swarm.resilience;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Immutable state of one provider's circuit breaker.
 */
@Value
@With
@Builder
public class CircuitBreakerSnapshot {

    CircuitState state;
    int failures;
    Instant lastFailureAt;

    /**
     * True while the single half-open trial call is outstanding.
     */
    boolean trialInFlight;

    public static CircuitBreakerSnapshot closed() {
        return new CircuitBreakerSnapshot(CircuitState.CLOSED, 0, null, false);
    }

    /**
     * Whether the cool-down since the last failure has fully elapsed at {@code now}.
     */
    public boolean isCoolDownElapsed(Instant now, CircuitBreakerPolicy policy) {
        return lastFailureAt == null || !now.isBefore(lastFailureAt.plus(policy.getCoolDown()));
    }
}
