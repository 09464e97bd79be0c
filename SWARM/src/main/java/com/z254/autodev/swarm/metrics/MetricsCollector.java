package com.z254.autodev.swarm.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Passive aggregator of latency, success and cache statistics per provider and per agent.
 * Mirrors the figures into Micrometer meters. Nothing in the engine reads these numbers back
 * to steer selection.
 */
@Slf4j
@Component
public class MetricsCollector {

    private final Map<String, OperationStats> providers = new ConcurrentHashMap<>();
    private final Map<String, OperationStats> agents = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter dedupJoinCounter;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.cacheHitCounter = Counter.builder("swarm.cache.hits")
                .description("Responses served from the response cache")
                .register(meterRegistry);
        this.cacheMissCounter = Counter.builder("swarm.cache.misses")
                .description("Cache lookups that required an upstream call")
                .register(meterRegistry);
        this.dedupJoinCounter = Counter.builder("swarm.dedup.joins")
                .description("Requests that joined an identical in-flight call")
                .register(meterRegistry);
    }

    public void recordProviderCall(String provider, long latencyMs, boolean success) {
        providers.computeIfAbsent(provider, key -> new OperationStats()).record(latencyMs, success);
        Timer.builder("swarm.provider.call.latency")
                .tag("provider", provider)
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .record(Duration.ofMillis(latencyMs));
    }

    public void recordCacheHit(String provider) {
        providers.computeIfAbsent(provider, key -> new OperationStats()).recordCacheHit();
        cacheHitCounter.increment();
    }

    public void recordCacheMiss(String provider) {
        providers.computeIfAbsent(provider, key -> new OperationStats()).recordCacheMiss();
        cacheMissCounter.increment();
    }

    public void recordDedupJoin() {
        dedupJoinCounter.increment();
    }

    public void recordAgentCall(String agentId, String agentType, long latencyMs, boolean success, boolean cached) {
        OperationStats stats = agents.computeIfAbsent(agentId, key -> new OperationStats());
        stats.record(latencyMs, success);
        if (cached) {
            stats.recordCacheHit();
        }
        Timer.builder("swarm.agent.call.latency")
                .tag("agentType", agentType)
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .record(Duration.ofMillis(latencyMs));
    }

    /**
     * Drop the per-agent figures of agents whose swarm has closed.
     */
    public void forgetAgents(Collection<String> agentIds) {
        agentIds.forEach(agents::remove);
    }

    public void recordTaskOutcome(String strategy, boolean success, long durationMs) {
        Counter.builder("swarm.tasks")
                .tag("strategy", strategy)
                .tag("outcome", success ? "completed" : "failed")
                .register(meterRegistry)
                .increment();
        Timer.builder("swarm.task.duration")
                .tag("strategy", strategy)
                .register(meterRegistry)
                .record(Duration.ofMillis(durationMs));
    }

    public Map<String, OperationStats.View> providerStats() {
        return views(providers);
    }

    public Map<String, OperationStats.View> agentStats() {
        return views(agents);
    }

    public OperationStats.View providerStats(String provider) {
        OperationStats stats = providers.get(provider);
        return stats != null ? stats.view() : new OperationStats().view();
    }

    public OperationStats.View agentStats(String agentId) {
        OperationStats stats = agents.get(agentId);
        return stats != null ? stats.view() : new OperationStats().view();
    }

    private static Map<String, OperationStats.View> views(Map<String, OperationStats> source) {
        Map<String, OperationStats.View> result = new TreeMap<>();
        source.forEach((key, stats) -> result.put(key, stats.view()));
        return result;
    }
}
