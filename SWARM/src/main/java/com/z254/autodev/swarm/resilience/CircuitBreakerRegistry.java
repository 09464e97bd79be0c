package com.z254.autodev.swarm.resilience;

import com.z254.autodev.swarm.config.SwarmProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider circuit breakers, created on first use.
 */
@Component
public class CircuitBreakerRegistry {

    private final Map<String, ProviderCircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerPolicy policy;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public CircuitBreakerRegistry(SwarmProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.policy = new CircuitBreakerPolicy(
                properties.getCircuitBreaker().getFailureThreshold(),
                properties.getCircuitBreaker().getCoolDown());
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public ProviderCircuitBreaker get(String provider) {
        return breakers.computeIfAbsent(provider, this::create);
    }

    /**
     * Whether a call to the provider could be admitted now. Providers never called are closed.
     */
    public boolean isCallPermitted(String provider) {
        ProviderCircuitBreaker breaker = breakers.get(provider);
        return breaker == null || breaker.isCallPermitted();
    }

    public Map<String, CircuitBreakerSnapshot> snapshots() {
        Map<String, CircuitBreakerSnapshot> result = new TreeMap<>();
        breakers.forEach((provider, breaker) -> result.put(provider, breaker.snapshot()));
        return result;
    }

    public long countOpen() {
        return breakers.values().stream()
                .filter(breaker -> breaker.getState() == CircuitState.OPEN)
                .count();
    }

    public CircuitBreakerPolicy getPolicy() {
        return policy;
    }

    private ProviderCircuitBreaker create(String provider) {
        return new ProviderCircuitBreaker(provider, policy, clock, (from, to) ->
                Counter.builder("swarm.circuit.transitions")
                        .tag("provider", provider)
                        .tag("to", to.name().toLowerCase())
                        .register(meterRegistry)
                        .increment());
    }
}
