package com.z254.autodev.swarm.orchestration;

import com.z254.autodev.swarm.domain.model.CapabilityOverrides;
import com.z254.autodev.swarm.domain.model.Swarm;
import com.z254.autodev.swarm.domain.model.SwarmStrategy;
import com.z254.autodev.swarm.domain.model.SwarmTask;
import com.z254.autodev.swarm.domain.model.SwarmTopology;
import com.z254.autodev.swarm.memory.CoordinationHooks;
import com.z254.autodev.swarm.memory.CoordinationMemory;
import com.z254.autodev.swarm.memory.MemoryEntry;
import com.z254.autodev.swarm.metrics.MetricsCollector;
import com.z254.autodev.swarm.metrics.PerformanceReport;
import com.z254.autodev.swarm.resilience.CircuitBreakerRegistry;
import com.z254.autodev.swarm.resilience.InFlightRequestRegistry;
import com.z254.autodev.swarm.resilience.ResponseCache;
import com.z254.autodev.swarm.swarm.SwarmManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Default {@link SwarmEngine}: delegates to the swarm manager, the task orchestrator and the
 * coordination memory, and assembles diagnostics from the resilience layer.
 */
@Slf4j
@Service
public class SwarmEngineImpl implements SwarmEngine {

    private final SwarmManager swarmManager;
    private final TaskOrchestrator taskOrchestrator;
    private final TeamDiscussionService discussionService;
    private final CoordinationMemory memory;
    private final CoordinationHooks hooks;
    private final ResponseCache responseCache;
    private final CircuitBreakerRegistry circuitBreakers;
    private final InFlightRequestRegistry inFlightRequests;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    public SwarmEngineImpl(SwarmManager swarmManager,
                           TaskOrchestrator taskOrchestrator,
                           TeamDiscussionService discussionService,
                           CoordinationMemory memory,
                           CoordinationHooks hooks,
                           ResponseCache responseCache,
                           CircuitBreakerRegistry circuitBreakers,
                           InFlightRequestRegistry inFlightRequests,
                           MetricsCollector metricsCollector,
                           Clock clock) {
        this.swarmManager = swarmManager;
        this.taskOrchestrator = taskOrchestrator;
        this.discussionService = discussionService;
        this.memory = memory;
        this.hooks = hooks;
        this.responseCache = responseCache;
        this.circuitBreakers = circuitBreakers;
        this.inFlightRequests = inFlightRequests;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
    }

    @Override
    public Mono<String> createSwarm(SwarmTopology topology, int maxAgents, SwarmStrategy strategy) {
        return Mono.fromCallable(() -> swarmManager.createSwarm(topology, maxAgents, strategy));
    }

    @Override
    public Mono<String> spawnAgent(String swarmId, String agentType, CapabilityOverrides overrides) {
        return Mono.fromCallable(() -> swarmManager.spawnAgent(swarmId, agentType, overrides));
    }

    @Override
    public Mono<SwarmStatusReport> getSwarmStatus(String swarmId) {
        return Mono.fromCallable(() -> swarmManager.getStatus(swarmId))
                .flatMap(swarm -> taskOrchestrator.getSwarmTasks(swarmId)
                        .collectList()
                        .map(tasks -> SwarmStatusReport.builder()
                                .swarm(swarm)
                                .tasks(orderBySubmission(swarm, tasks))
                                .build()));
    }

    @Override
    public Flux<Swarm> listSwarms() {
        return Flux.defer(() -> Flux.fromIterable(swarmManager.listSwarms()));
    }

    @Override
    public Mono<Swarm> teardownSwarm(String swarmId) {
        return Mono.fromCallable(() -> swarmManager.teardownSwarm(swarmId));
    }

    @Override
    public Mono<String> orchestrate(OrchestrationRequest request) {
        return taskOrchestrator.orchestrate(request);
    }

    @Override
    public Mono<SwarmTask> getTaskStatus(String taskId) {
        return taskOrchestrator.getTaskStatus(taskId);
    }

    @Override
    public Mono<String> discuss(String topic, List<String> participants, Integer rounds) {
        return rounds != null
                ? discussionService.discuss(topic, participants, rounds)
                : discussionService.discuss(topic, participants);
    }

    @Override
    public Mono<MemoryEntry> storeMemory(String key, Object value, List<String> tags, Duration ttl) {
        return Mono.fromCallable(() -> {
            MemoryEntry entry = memory.store(key, value, tags, ttl);
            hooks.notify("Memory stored: " + key);
            return entry;
        });
    }

    @Override
    public Mono<MemoryEntry> retrieveMemory(String key) {
        return Mono.defer(() -> Mono.justOrEmpty(memory.retrieve(key)));
    }

    @Override
    public Mono<List<String>> listMemoryKeys() {
        return Mono.fromCallable(memory::listKeys);
    }

    @Override
    public Mono<Boolean> deleteMemory(String key) {
        return Mono.fromCallable(() -> memory.delete(key));
    }

    @Override
    public Mono<PerformanceReport> getPerformanceMetrics() {
        return Mono.fromCallable(() -> PerformanceReport.builder()
                .cache(responseCache.stats())
                .circuitBreakers(circuitBreakers.snapshots())
                .performance(PerformanceReport.Performance.builder()
                        .providers(metricsCollector.providerStats())
                        .agents(metricsCollector.agentStats())
                        .build())
                .inFlightRequests(inFlightRequests.size())
                .memory(memory.state())
                .generatedAt(clock.instant())
                .build());
    }

    private static List<SwarmTask> orderBySubmission(Swarm swarm, List<SwarmTask> tasks) {
        List<String> order = swarm.getTaskIds();
        return tasks.stream()
                .sorted((a, b) -> Integer.compare(order.indexOf(a.getId()), order.indexOf(b.getId())))
                .toList();
    }
}
