package com.z254.autodev.swarm.orchestration;

import com.z254.autodev.swarm.domain.model.CapabilityOverrides;
import com.z254.autodev.swarm.domain.model.Swarm;
import com.z254.autodev.swarm.domain.model.SwarmStrategy;
import com.z254.autodev.swarm.domain.model.SwarmTask;
import com.z254.autodev.swarm.domain.model.SwarmTopology;
import com.z254.autodev.swarm.memory.MemoryEntry;
import com.z254.autodev.swarm.metrics.PerformanceReport;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Call surface of the swarm engine.
 */
public interface SwarmEngine {

    // --------------------------------------------------------------------------------------------
    // Swarm Management
    // --------------------------------------------------------------------------------------------

    /**
     * Create a swarm.
     *
     * @return the swarm id
     */
    Mono<String> createSwarm(SwarmTopology topology, int maxAgents, SwarmStrategy strategy);

    /**
     * Spawn an agent of a registered type.
     *
     * @param overrides optional capability adjustments, may be null
     * @return the agent id
     */
    Mono<String> spawnAgent(String swarmId, String agentType, CapabilityOverrides overrides);

    /**
     * Swarm snapshot including its tasks.
     */
    Mono<SwarmStatusReport> getSwarmStatus(String swarmId);

    Flux<Swarm> listSwarms();

    /**
     * Stop accepting work and close the swarm once its agents are idle.
     */
    Mono<Swarm> teardownSwarm(String swarmId);

    // --------------------------------------------------------------------------------------------
    // Task Orchestration
    // --------------------------------------------------------------------------------------------

    /**
     * Orchestrate a task; completes once the task is COMPLETED or FAILED.
     *
     * @return the task id
     */
    Mono<String> orchestrate(OrchestrationRequest request);

    Mono<SwarmTask> getTaskStatus(String taskId);

    /**
     * Run a multi-round discussion between participant roles.
     *
     * @return Markdown transcript
     */
    Mono<String> discuss(String topic, List<String> participants, Integer rounds);

    // --------------------------------------------------------------------------------------------
    // Coordination Memory
    // --------------------------------------------------------------------------------------------

    Mono<MemoryEntry> storeMemory(String key, Object value, List<String> tags, Duration ttl);

    Mono<MemoryEntry> retrieveMemory(String key);

    Mono<List<String>> listMemoryKeys();

    Mono<Boolean> deleteMemory(String key);

    // --------------------------------------------------------------------------------------------
    // Diagnostics
    // --------------------------------------------------------------------------------------------

    Mono<PerformanceReport> getPerformanceMetrics();
}
