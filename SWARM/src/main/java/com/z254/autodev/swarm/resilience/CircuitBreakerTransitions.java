package com.z254.autodev.swarm.resilience;

import java.time.Instant;

/**
 * Transition function of the circuit breaker: {@code (snapshot, event) -> snapshot}.
 *
 * <pre>
 * CLOSED    --call failed (failures &gt;= threshold)--&gt; OPEN
 * OPEN      --trial admitted (cool-down elapsed)--&gt; HALF_OPEN
 * HALF_OPEN --trial succeeded--&gt; CLOSED
 * HALF_OPEN --trial failed--&gt; OPEN
 * HALF_OPEN --trial released--&gt; OPEN
 * CLOSED, OPEN --call succeeded--&gt; CLOSED
 * </pre>
 *
 * While a trial is outstanding only the trial's own events move the state; late outcomes of
 * calls admitted earlier are counted but never free or settle the trial slot.
 */
public final class CircuitBreakerTransitions {

    private CircuitBreakerTransitions() {
    }

    public static CircuitBreakerSnapshot apply(CircuitBreakerSnapshot current, CircuitBreakerEvent event,
                                               Instant now, CircuitBreakerPolicy policy) {
        return switch (event) {
            case CALL_SUCCEEDED -> isTrialPending(current) ? current : CircuitBreakerSnapshot.closed();
            case CALL_FAILED -> onCallFailed(current, now, policy);
            case TRIAL_ADMITTED -> onTrialAdmitted(current, now, policy);
            case TRIAL_SUCCEEDED -> CircuitBreakerSnapshot.closed();
            case TRIAL_FAILED -> CircuitBreakerSnapshot.builder()
                    .state(CircuitState.OPEN)
                    .failures(current.getFailures() + 1)
                    .lastFailureAt(now)
                    .trialInFlight(false)
                    .build();
            case TRIAL_RELEASED -> isTrialPending(current)
                    ? current.withState(CircuitState.OPEN).withTrialInFlight(false)
                    : current;
        };
    }

    private static boolean isTrialPending(CircuitBreakerSnapshot current) {
        return current.getState() == CircuitState.HALF_OPEN && current.isTrialInFlight();
    }

    private static CircuitBreakerSnapshot onCallFailed(CircuitBreakerSnapshot current, Instant now,
                                                       CircuitBreakerPolicy policy) {
        int failures = current.getFailures() + 1;
        if (isTrialPending(current)) {
            return current.withFailures(failures);
        }
        CircuitState next = current.getState() == CircuitState.CLOSED && failures < policy.getFailureThreshold()
                ? CircuitState.CLOSED
                : CircuitState.OPEN;
        return CircuitBreakerSnapshot.builder()
                .state(next)
                .failures(failures)
                .lastFailureAt(now)
                .trialInFlight(false)
                .build();
    }

    private static CircuitBreakerSnapshot onTrialAdmitted(CircuitBreakerSnapshot current, Instant now,
                                                          CircuitBreakerPolicy policy) {
        if (current.getState() != CircuitState.OPEN || !current.isCoolDownElapsed(now, policy)) {
            return current;
        }
        return current.withState(CircuitState.HALF_OPEN).withTrialInFlight(true);
    }
}
