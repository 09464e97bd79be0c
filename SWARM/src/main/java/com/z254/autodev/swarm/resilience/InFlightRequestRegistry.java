package com.z254.autodev.swarm.resilience;

import com.z254.autodev.swarm.error.InvocationCancelledException;
import com.z254.autodev.swarm.llm.CompletionResponse;
import com.z254.autodev.swarm.metrics.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Collapses concurrent identical requests into one upstream call.
 * <p>
 * The first subscriber for a key becomes the leader and runs the upstream call. Later subscribers
 * for the same key wait on the leader's outcome and receive the same value or the same error.
 * If the leader is cancelled, waiters are released with an {@link InvocationCancelledException}.
 */
@Slf4j
@Component
public class InFlightRequestRegistry {

    private final ConcurrentHashMap<String, InFlightRequest> inFlight = new ConcurrentHashMap<>();
    private final MetricsCollector metricsCollector;

    public InFlightRequestRegistry(MetricsCollector metricsCollector) {
        this.metricsCollector = metricsCollector;
    }

    public Mono<CompletionResponse> deduplicate(String key, Supplier<Mono<CompletionResponse>> upstream) {
        return Mono.defer(() -> {
            InFlightRequest request = new InFlightRequest();
            InFlightRequest existing = inFlight.putIfAbsent(key, request);
            if (existing != null) {
                int waiters = existing.waiters.incrementAndGet();
                metricsCollector.recordDedupJoin();
                log.debug("Joined in-flight request {} ({} waiters)", key, waiters);
                return existing.sink.asMono();
            }
            return upstream.get()
                    .doOnSuccess(response -> {
                        inFlight.remove(key, request);
                        if (response != null) {
                            request.sink.tryEmitValue(response);
                        } else {
                            request.sink.tryEmitEmpty();
                        }
                    })
                    .doOnError(error -> {
                        inFlight.remove(key, request);
                        request.sink.tryEmitError(error);
                    })
                    .doOnCancel(() -> {
                        inFlight.remove(key, request);
                        if (request.waiters.get() > 0) {
                            log.debug("In-flight request {} cancelled, releasing {} waiters", key, request.waiters.get());
                        }
                        request.sink.tryEmitError(new InvocationCancelledException("Deduplicated call " + key + " was cancelled"));
                    });
        });
    }

    public int size() {
        return inFlight.size();
    }

    public boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }

    private static final class InFlightRequest {
        private final Sinks.One<CompletionResponse> sink = Sinks.one();
        private final AtomicInteger waiters = new AtomicInteger();
    }
}
