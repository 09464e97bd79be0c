package com.z254.autodev.swarm.resilience;

import com.z254.autodev.swarm.config.SwarmProperties;
import com.z254.autodev.swarm.error.ProviderErrorException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Bounds concurrent upstream calls per provider with a semaphore bulkhead.
 * A saturated provider fails immediately with a provider error that does not count against its breaker.
 */
@Component
public class ProviderBulkheads {

    private final BulkheadRegistry registry;

    public ProviderBulkheads(SwarmProperties properties) {
        BulkheadConfig config = BulkheadConfig.custom()
                .maxConcurrentCalls(properties.getInvocation().getMaxConcurrentCallsPerProvider())
                .maxWaitDuration(Duration.ZERO)
                .build();
        this.registry = BulkheadRegistry.of(config);
    }

    public <T> Mono<T> guard(String provider, Mono<T> call) {
        return call.transformDeferred(BulkheadOperator.of(registry.bulkhead(provider)))
                .onErrorMap(BulkheadFullException.class,
                        e -> new ProviderErrorException(provider, "too many concurrent calls", false, e));
    }

    public int availableCalls(String provider) {
        Bulkhead bulkhead = registry.bulkhead(provider);
        return bulkhead.getMetrics().getAvailableConcurrentCalls();
    }
}
