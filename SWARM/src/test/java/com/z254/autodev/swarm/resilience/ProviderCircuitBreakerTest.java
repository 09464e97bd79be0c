package com.z254.autodev.swarm.resilience;

import com.z254.autodev.swarm.config.SwarmProperties;
import com.z254.autodev.swarm.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ProviderCircuitBreaker} and {@link CircuitBreakerRegistry}.
 */
class ProviderCircuitBreakerTest {

    private static final String PROVIDER = "openai/gpt-4-turbo";

    private MutableClock clock;
    private MeterRegistry meterRegistry;
    private CircuitBreakerRegistry registry;
    private ProviderCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        SwarmProperties properties = new SwarmProperties();
        properties.getCircuitBreaker().setFailureThreshold(3);
        properties.getCircuitBreaker().setCoolDown(Duration.ofSeconds(60));
        registry = new CircuitBreakerRegistry(properties, clock, meterRegistry);
        breaker = registry.get(PROVIDER);
    }

    @Nested
    @DisplayName("opening")
    class Opening {

        @Test
        void staysClosedBelowThreshold() {
            breaker.onFailure();
            breaker.onFailure();

            assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(breaker.snapshot().getFailures()).isEqualTo(2);
            assertThat(breaker.tryAcquirePermission()).isPresent();
        }

        @Test
        void opensOnThirdConsecutiveFailure() {
            breaker.onFailure();
            breaker.onFailure();
            breaker.onFailure();

            assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(breaker.isCallPermitted()).isFalse();
            assertThat(breaker.tryAcquirePermission()).isEmpty();
            assertThat(registry.countOpen()).isEqualTo(1);
            assertThat(meterRegistry.get("swarm.circuit.transitions").tag("to", "open").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        void successResetsFailureCount() {
            breaker.onFailure();
            breaker.onFailure();
            breaker.onSuccess();
            breaker.onFailure();

            assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(breaker.snapshot().getFailures()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("cool-down and trial")
    class CoolDown {

        @BeforeEach
        void open() {
            breaker.onFailure();
            breaker.onFailure();
            breaker.onFailure();
        }

        @Test
        void rejectsUntilCoolDownElapses() {
            clock.advance(Duration.ofSeconds(59));

            assertThat(breaker.tryAcquirePermission()).isEmpty();
            assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        }

        @Test
        void admitsExactlyOneTrialAfterCoolDown() {
            clock.advance(Duration.ofSeconds(60));

            assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(breaker.tryAcquirePermission()).hasValueSatisfying(permit ->
                    assertThat(permit.isTrial()).isTrue());
            assertThat(breaker.tryAcquirePermission()).isEmpty();
            assertThat(breaker.isCallPermitted()).isFalse();
        }

        @Test
        void successfulTrialCloses() {
            clock.advance(Duration.ofSeconds(61));
            ProviderCircuitBreaker.Permit trial = breaker.tryAcquirePermission().orElseThrow();

            trial.onSuccess();

            assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(breaker.snapshot().getFailures()).isZero();
        }

        @Test
        void failedTrialReopensWithFreshCoolDown() {
            clock.advance(Duration.ofSeconds(61));
            ProviderCircuitBreaker.Permit trial = breaker.tryAcquirePermission().orElseThrow();

            trial.onFailure();

            assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
            clock.advance(Duration.ofSeconds(30));
            assertThat(breaker.tryAcquirePermission()).isEmpty();
            clock.advance(Duration.ofSeconds(30));
            assertThat(breaker.tryAcquirePermission()).isPresent();
        }

        @Test
        void releasedTrialFreesTheSlot() {
            clock.advance(Duration.ofSeconds(60));
            ProviderCircuitBreaker.Permit trial = breaker.tryAcquirePermission().orElseThrow();

            trial.release();

            assertThat(breaker.tryAcquirePermission()).isPresent();
        }

        @Test
        void permitSettlesOnlyOnce() {
            clock.advance(Duration.ofSeconds(60));
            ProviderCircuitBreaker.Permit trial = breaker.tryAcquirePermission().orElseThrow();

            trial.onFailure();
            clock.advance(Duration.ofSeconds(60));
            ProviderCircuitBreaker.Permit next = breaker.tryAcquirePermission().orElseThrow();
            trial.release();

            assertThat(next.isTrial()).isTrue();
            assertThat(breaker.tryAcquirePermission()).isEmpty();
        }
    }

    @Nested
    @DisplayName("calls admitted before the breaker opened")
    class EarlierCalls {

        private ProviderCircuitBreaker.Permit earlier;
        private ProviderCircuitBreaker.Permit trial;

        @BeforeEach
        void openWithCallOutstandingThenAdmitTrial() {
            earlier = breaker.tryAcquirePermission().orElseThrow();
            breaker.onFailure();
            breaker.onFailure();
            breaker.onFailure();
            clock.advance(Duration.ofSeconds(60));
            trial = breaker.tryAcquirePermission().orElseThrow();
            assertThat(earlier.isTrial()).isFalse();
            assertThat(trial.isTrial()).isTrue();
        }

        @Test
        void releaseDoesNotFreeTheTrialSlot() {
            earlier.release();

            assertThat(breaker.tryAcquirePermission()).isEmpty();
            assertThat(breaker.snapshot().isTrialInFlight()).isTrue();
        }

        @Test
        void lateFailureIsCountedButKeepsTheTrialPending() {
            earlier.onFailure();

            assertThat(breaker.tryAcquirePermission()).isEmpty();
            assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(breaker.snapshot().getFailures()).isEqualTo(4);
        }

        @Test
        void lateSuccessLeavesTheVerdictToTheTrial() {
            earlier.onSuccess();

            assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(breaker.tryAcquirePermission()).isEmpty();

            trial.onFailure();

            assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        }
    }

    @Test
    void unknownProvidersArePermitted() {
        assertThat(registry.isCallPermitted("never/called")).isTrue();
        assertThat(registry.snapshots()).containsOnlyKeys(PROVIDER);
    }
}
