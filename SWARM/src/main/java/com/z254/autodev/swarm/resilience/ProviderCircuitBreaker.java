package com.z254.autodev.swarm.resilience;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

/**
 * Circuit breaker guarding one upstream provider.
 * State changes are compare-and-set updates of an immutable snapshot.
 */
@Slf4j
public class ProviderCircuitBreaker {

    @Getter
    private final String provider;
    private final CircuitBreakerPolicy policy;
    private final Clock clock;
    private final BiConsumer<CircuitState, CircuitState> transitionListener;
    private final AtomicReference<CircuitBreakerSnapshot> snapshot =
            new AtomicReference<>(CircuitBreakerSnapshot.closed());

    public ProviderCircuitBreaker(String provider, CircuitBreakerPolicy policy, Clock clock,
                                  BiConsumer<CircuitState, CircuitState> transitionListener) {
        this.provider = provider;
        this.policy = policy;
        this.clock = clock;
        this.transitionListener = transitionListener;
    }

    /**
     * Whether a call could be admitted right now. Does not change state.
     */
    public boolean isCallPermitted() {
        CircuitBreakerSnapshot current = snapshot.get();
        return switch (current.getState()) {
            case CLOSED -> true;
            case OPEN -> current.isCoolDownElapsed(clock.instant(), policy);
            case HALF_OPEN -> !current.isTrialInFlight();
        };
    }

    /**
     * Admit a call. An open breaker whose cool-down has elapsed admits exactly one trial call.
     *
     * @return the permit the call reports its outcome through, or empty when the call must fail
     * fast without contacting the provider
     */
    public Optional<Permit> tryAcquirePermission() {
        while (true) {
            CircuitBreakerSnapshot current = snapshot.get();
            switch (current.getState()) {
                case CLOSED:
                    return Optional.of(new Permit(false));
                case HALF_OPEN:
                    if (current.isTrialInFlight()) {
                        return Optional.empty();
                    }
                    if (snapshot.compareAndSet(current, current.withTrialInFlight(true))) {
                        return Optional.of(new Permit(true));
                    }
                    break;
                case OPEN:
                default:
                    Instant now = clock.instant();
                    if (!current.isCoolDownElapsed(now, policy)) {
                        return Optional.empty();
                    }
                    if (transition(current, CircuitBreakerEvent.TRIAL_ADMITTED, now)) {
                        log.info("Circuit breaker for {} half-open, admitting trial call", provider);
                        return Optional.of(new Permit(true));
                    }
                    break;
            }
        }
    }

    /**
     * Records a success of a call admitted while closed.
     */
    public void onSuccess() {
        fire(CircuitBreakerEvent.CALL_SUCCEEDED);
    }

    /**
     * Records a failure of a call admitted while closed.
     */
    public void onFailure() {
        fire(CircuitBreakerEvent.CALL_FAILED);
    }

    /**
     * Current snapshot. An open breaker whose cool-down has elapsed reports HALF_OPEN.
     */
    public CircuitBreakerSnapshot snapshot() {
        CircuitBreakerSnapshot current = snapshot.get();
        if (current.getState() == CircuitState.OPEN && current.isCoolDownElapsed(clock.instant(), policy)) {
            return current.withState(CircuitState.HALF_OPEN);
        }
        return current;
    }

    public CircuitState getState() {
        return snapshot().getState();
    }

    private void fire(CircuitBreakerEvent event) {
        while (true) {
            CircuitBreakerSnapshot current = snapshot.get();
            if (transition(current, event, clock.instant())) {
                return;
            }
        }
    }

    private boolean transition(CircuitBreakerSnapshot current, CircuitBreakerEvent event, Instant now) {
        CircuitBreakerSnapshot next = CircuitBreakerTransitions.apply(current, event, now, policy);
        if (!snapshot.compareAndSet(current, next)) {
            return false;
        }
        if (current.getState() != next.getState()) {
            if (next.getState() == CircuitState.OPEN) {
                log.warn("Circuit breaker for {} opened after {} failures", provider, next.getFailures());
            } else {
                log.info("Circuit breaker for {}: {} -> {}", provider, current.getState(), next.getState());
            }
            transitionListener.accept(current.getState(), next.getState());
        }
        return true;
    }

    /**
     * One admitted call. Settles at most once, and only the trial permit settles the half-open slot.
     */
    public final class Permit {

        @Getter
        private final boolean trial;
        private final AtomicBoolean settled = new AtomicBoolean();

        private Permit(boolean trial) {
            this.trial = trial;
        }

        public void onSuccess() {
            if (settled.compareAndSet(false, true)) {
                fire(trial ? CircuitBreakerEvent.TRIAL_SUCCEEDED : CircuitBreakerEvent.CALL_SUCCEEDED);
            }
        }

        public void onFailure() {
            if (settled.compareAndSet(false, true)) {
                fire(trial ? CircuitBreakerEvent.TRIAL_FAILED : CircuitBreakerEvent.CALL_FAILED);
            }
        }

        /**
         * The call ended without success or failure. Frees the half-open slot when this is the trial.
         */
        public void release() {
            if (settled.compareAndSet(false, true) && trial) {
                fire(CircuitBreakerEvent.TRIAL_RELEASED);
            }
        }
    }
}
