package com.z254.autodev.swarm.health;

import com.z254.autodev.swarm.capability.ModelCapabilityTable;
import com.z254.autodev.swarm.resilience.CircuitBreakerRegistry;
import com.z254.autodev.swarm.resilience.InFlightRequestRegistry;
import com.z254.autodev.swarm.resilience.ResponseCache;
import com.z254.autodev.swarm.swarm.SwarmManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Health indicator for the swarm engine.
 * DOWN only when every known provider has an open circuit breaker.
 */
@Component
@Slf4j
public class SwarmHealthIndicator implements ReactiveHealthIndicator {

    private final CircuitBreakerRegistry circuitBreakers;
    private final ModelCapabilityTable modelTable;
    private final ResponseCache responseCache;
    private final InFlightRequestRegistry inFlightRequests;
    private final SwarmManager swarmManager;

    public SwarmHealthIndicator(CircuitBreakerRegistry circuitBreakers,
                                ModelCapabilityTable modelTable,
                                ResponseCache responseCache,
                                InFlightRequestRegistry inFlightRequests,
                                SwarmManager swarmManager) {
        this.circuitBreakers = circuitBreakers;
        this.modelTable = modelTable;
        this.responseCache = responseCache;
        this.inFlightRequests = inFlightRequests;
        this.swarmManager = swarmManager;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(() -> {
                    int providers = modelTable.all().size();
                    long available = modelTable.all().stream()
                            .filter(model -> circuitBreakers.isCallPermitted(model.getProvider()))
                            .count();
                    Health.Builder builder = available > 0 ? Health.up() : Health.down();

                    builder.withDetail("providers", providers);
                    builder.withDetail("availableProviders", available);
                    builder.withDetail("openCircuitBreakers", circuitBreakers.countOpen());
                    builder.withDetail("cacheSize", responseCache.size());
                    builder.withDetail("inFlightRequests", inFlightRequests.size());
                    builder.withDetail("activeSwarms", swarmManager.activeSwarmCount());

                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", String.valueOf(e.getMessage()))
                            .build());
                });
    }
}
