package com.z254.autodev.swarm.resilience;

import com.z254.autodev.swarm.capability.ModelCapabilityTable;
import com.z254.autodev.swarm.config.SwarmProperties;
import com.z254.autodev.swarm.domain.model.ComplexityVector;
import com.z254.autodev.swarm.error.AllProvidersUnavailableException;
import com.z254.autodev.swarm.error.InvocationTimeoutException;
import com.z254.autodev.swarm.error.ProviderErrorException;
import com.z254.autodev.swarm.error.SwarmException;
import com.z254.autodev.swarm.llm.CompletionRequest;
import com.z254.autodev.swarm.llm.CompletionResponse;
import com.z254.autodev.swarm.llm.ProviderInvoker;
import com.z254.autodev.swarm.llm.routing.InvocationConstraints;
import com.z254.autodev.swarm.llm.routing.ProviderSelector;
import com.z254.autodev.swarm.llm.routing.RequirementVector;
import com.z254.autodev.swarm.llm.routing.TaskRequirementAnalyzer;
import com.z254.autodev.swarm.metrics.MetricsCollector;
import com.z254.autodev.swarm.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Makes one logical call to an upstream provider while absorbing transient failures.
 * <p>
 * Per call: select the provider (skipping open breakers), serve from cache if possible, join an
 * identical in-flight call if one exists, otherwise call upstream through the breaker and the
 * provider bulkhead with a request timeout. A failed call moves on to the configured fallback
 * providers, each tried once.
 */
@Slf4j
@Component
public class ResilientInvocationClient {

    private final ProviderInvoker invoker;
    private final ModelCapabilityTable modelTable;
    private final CircuitBreakerRegistry breakers;
    private final ResponseCache cache;
    private final InFlightRequestRegistry inFlight;
    private final ProviderBulkheads bulkheads;
    private final CacheKeyGenerator keyGenerator;
    private final MetricsCollector metricsCollector;
    private final StructuredLogger structuredLogger;
    private final SwarmProperties.InvocationProperties config;
    private final Clock clock;

    public ResilientInvocationClient(ProviderInvoker invoker,
                                     ModelCapabilityTable modelTable,
                                     CircuitBreakerRegistry breakers,
                                     ResponseCache cache,
                                     InFlightRequestRegistry inFlight,
                                     ProviderBulkheads bulkheads,
                                     CacheKeyGenerator keyGenerator,
                                     MetricsCollector metricsCollector,
                                     StructuredLogger structuredLogger,
                                     SwarmProperties properties,
                                     Clock clock) {
        this.invoker = invoker;
        this.modelTable = modelTable;
        this.breakers = breakers;
        this.cache = cache;
        this.inFlight = inFlight;
        this.bulkheads = bulkheads;
        this.keyGenerator = keyGenerator;
        this.metricsCollector = metricsCollector;
        this.structuredLogger = structuredLogger;
        this.config = properties.getInvocation();
        this.clock = clock;
    }

    /**
     * Invoke an upstream provider.
     *
     * @return the response, or one of {@link ProviderErrorException}, {@link AllProvidersUnavailableException},
     * {@link InvocationTimeoutException} once every local remedy is exhausted
     */
    public Mono<CompletionResponse> invoke(InvocationRequest request) {
        return Mono.defer(() -> {
            CompletionRequest normalized = normalize(request);
            String primary = selectPrimaryProvider(request);
            List<String> chain = fallbackChain(primary);
            return attempt(chain, 0, normalized, request.getCacheTtl(), null, false);
        });
    }

    /**
     * Resolve the provider that would be tried first for a request. Does not call anything.
     *
     * @throws AllProvidersUnavailableException if every ranked provider has an open breaker
     */
    public String selectPrimaryProvider(InvocationRequest request) {
        String explicit = explicitProvider(request);
        if (explicit != null) {
            return explicit;
        }
        List<String> ranked = rankProviders(request.getTaskDescription(), request.getComplexity(),
                request.getConstraints());
        if (ranked.isEmpty()) {
            log.debug("No provider satisfies the constraints, using default {}", config.getDefaultProvider());
            return config.getDefaultProvider();
        }
        for (String provider : ranked) {
            if (breakers.isCallPermitted(provider)) {
                return provider;
            }
            log.debug("Skipping provider {} with open circuit breaker", provider);
        }
        throw new AllProvidersUnavailableException(ranked);
    }

    /**
     * Providers ordered by capability score for the given task, best first.
     */
    public List<String> rankProviders(String description, ComplexityVector complexity, InvocationConstraints constraints) {
        RequirementVector requirements = TaskRequirementAnalyzer.analyze(description,
                complexity != null ? complexity : ComplexityVector.neutral());
        return ProviderSelector.rank(modelTable.all(), requirements,
                constraints != null ? constraints : InvocationConstraints.none());
    }

    private String explicitProvider(InvocationRequest request) {
        String provider = request.getProvider();
        if (provider == null && request.getAgentType() != null) {
            provider = config.getAgentProviders().get(request.getAgentType());
        }
        if (provider != null) {
            // unknown providers are a configuration error
            modelTable.get(provider);
        }
        return provider;
    }

    private List<String> fallbackChain(String primary) {
        List<String> chain = new ArrayList<>();
        chain.add(primary);
        for (String fallback : config.getFallbackProviders()) {
            if (!chain.contains(fallback)) {
                chain.add(fallback);
            }
        }
        return chain;
    }

    private Mono<CompletionResponse> attempt(List<String> chain, int index, CompletionRequest request,
                                             Duration cacheTtl, Throwable firstError, boolean attempted) {
        if (index >= chain.size()) {
            if (attempted && firstError != null) {
                return Mono.error(firstError);
            }
            return Mono.error(new AllProvidersUnavailableException(chain));
        }
        String provider = chain.get(index);
        if (!breakers.isCallPermitted(provider)) {
            log.warn("Circuit breaker open for {}, trying next provider", provider);
            return attempt(chain, index + 1, request, cacheTtl, firstError, attempted);
        }
        return callProvider(provider, request, cacheTtl)
                .onErrorResume(this::isFallbackEligible, error -> {
                    boolean reachedProvider = !(error instanceof AllProvidersUnavailableException);
                    Throwable cause = firstError != null || !reachedProvider ? firstError : error;
                    if (index + 1 < chain.size()) {
                        log.warn("Provider {} failed ({}), falling back to {}", provider, error.getMessage(),
                                chain.get(index + 1));
                        structuredLogger.logFallback(provider, chain.get(index + 1), error.getMessage());
                    }
                    return attempt(chain, index + 1, request, cacheTtl, cause, attempted || reachedProvider);
                });
    }

    private boolean isFallbackEligible(Throwable error) {
        return error instanceof ProviderErrorException
                || error instanceof InvocationTimeoutException
                || error instanceof AllProvidersUnavailableException;
    }

    private Mono<CompletionResponse> callProvider(String provider, CompletionRequest request, Duration cacheTtl) {
        String key = keyGenerator.keyFor(provider, request);
        Optional<CompletionResponse> cached = cache.get(key);
        if (cached.isPresent()) {
            metricsCollector.recordCacheHit(provider);
            return Mono.just(cached.get().toBuilder().cached(true).build());
        }
        if (cache.isEnabled()) {
            metricsCollector.recordCacheMiss(provider);
        }
        return inFlight.deduplicate(key, () -> callUpstream(provider, key, request, cacheTtl));
    }

    private Mono<CompletionResponse> callUpstream(String provider, String key, CompletionRequest request,
                                                  Duration cacheTtl) {
        return Mono.defer(() -> {
            Optional<ProviderCircuitBreaker.Permit> acquired = breakers.get(provider).tryAcquirePermission();
            if (acquired.isEmpty()) {
                return Mono.error(new AllProvidersUnavailableException(List.of(provider)));
            }
            ProviderCircuitBreaker.Permit permit = acquired.get();
            long start = clock.millis();
            Duration timeout = config.getRequestTimeout();
            return bulkheads.guard(provider, Mono.defer(() -> invoker.call(provider, request)))
                    .switchIfEmpty(Mono.error(() -> new ProviderErrorException(provider, "empty response")))
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class,
                            e -> new InvocationTimeoutException("Call to " + provider, timeout))
                    .onErrorMap(e -> !(e instanceof SwarmException),
                            e -> new ProviderErrorException(provider, String.valueOf(e.getMessage()), e))
                    .doOnSuccess(response -> {
                        long latency = clock.millis() - start;
                        permit.onSuccess();
                        cache.put(key, response, cacheTtl);
                        metricsCollector.recordProviderCall(provider, latency, true);
                        structuredLogger.logProviderCall(provider, latency, response.getTotalTokens(), true);
                    })
                    .doOnError(error -> {
                        long latency = clock.millis() - start;
                        if (countsAsBreakerFailure(error)) {
                            permit.onFailure();
                        } else {
                            permit.release();
                        }
                        metricsCollector.recordProviderCall(provider, latency, false);
                        structuredLogger.logProviderCall(provider, latency, 0, false);
                    })
                    .doOnCancel(permit::release);
        });
    }

    private static boolean countsAsBreakerFailure(Throwable error) {
        if (error instanceof ProviderErrorException providerError) {
            return providerError.isBreakerFailure();
        }
        return error instanceof InvocationTimeoutException;
    }

    private CompletionRequest normalize(InvocationRequest request) {
        return CompletionRequest.builder()
                .messages(new ArrayList<>(request.getMessages()))
                .temperature(request.getTemperature() != null ? request.getTemperature() : config.getDefaultTemperature())
                .maxTokens(request.getMaxTokens() != null ? request.getMaxTokens() : config.getDefaultMaxTokens())
                .build();
    }
}
