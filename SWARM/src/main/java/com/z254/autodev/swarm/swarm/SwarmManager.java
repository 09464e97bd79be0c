package com.z254.autodev.swarm.swarm;

import com.z254.autodev.swarm.capability.AgentCapabilityRegistry;
import com.z254.autodev.swarm.config.SwarmProperties;
import com.z254.autodev.swarm.domain.model.Agent;
import com.z254.autodev.swarm.domain.model.AgentCapability;
import com.z254.autodev.swarm.domain.model.AgentPerformance;
import com.z254.autodev.swarm.domain.model.AgentStatus;
import com.z254.autodev.swarm.domain.model.CapabilityOverrides;
import com.z254.autodev.swarm.domain.model.ComplexityVector;
import com.z254.autodev.swarm.domain.model.Swarm;
import com.z254.autodev.swarm.domain.model.SwarmMetrics;
import com.z254.autodev.swarm.domain.model.SwarmStatus;
import com.z254.autodev.swarm.domain.model.SwarmStrategy;
import com.z254.autodev.swarm.domain.model.SwarmTopology;
import com.z254.autodev.swarm.error.ResourceExhaustedException;
import com.z254.autodev.swarm.error.UnknownSwarmException;
import com.z254.autodev.swarm.memory.CoordinationHooks;
import com.z254.autodev.swarm.metrics.MetricsCollector;
import com.z254.autodev.swarm.observability.StructuredLogger;
import com.z254.autodev.swarm.orchestration.AgentSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Creates and tracks swarms and the agents spawned into them.
 * <p>
 * All state transitions are in-memory and synchronous. Each swarm has its own lock so that
 * unrelated swarms never contend. Callers only ever see deep copies of swarm state.
 */
@Slf4j
@Component
public class SwarmManager {

    private final Map<String, SwarmHandle> swarms = new ConcurrentHashMap<>();
    private final Object creationLock = new Object();
    private final AgentCapabilityRegistry capabilityRegistry;
    private final CoordinationHooks hooks;
    private final StructuredLogger structuredLogger;
    private final MetricsCollector metricsCollector;
    private final SwarmProperties.OrchestrationProperties config;
    private final Clock clock;

    public SwarmManager(AgentCapabilityRegistry capabilityRegistry,
                        CoordinationHooks hooks,
                        StructuredLogger structuredLogger,
                        MetricsCollector metricsCollector,
                        SwarmProperties properties,
                        Clock clock) {
        this.capabilityRegistry = capabilityRegistry;
        this.hooks = hooks;
        this.structuredLogger = structuredLogger;
        this.metricsCollector = metricsCollector;
        this.config = properties.getOrchestration();
        this.clock = clock;
    }

    /**
     * Create a swarm.
     *
     * @return the new swarm id
     * @throws ResourceExhaustedException if the swarm limit is reached or {@code maxAgents} is out of bounds
     */
    public String createSwarm(SwarmTopology topology, int maxAgents, SwarmStrategy strategy) {
        if (maxAgents < 1 || maxAgents > config.getMaxAgentsPerSwarm()) {
            throw new ResourceExhaustedException("maxAgents must be between 1 and "
                    + config.getMaxAgentsPerSwarm() + ": " + maxAgents);
        }
        String swarmId = "swarm_" + UUID.randomUUID();
        hooks.preTask(swarmId, "Initialize swarm with " + topology.name().toLowerCase() + " topology");

        Swarm swarm = Swarm.builder()
                .id(swarmId)
                .topology(topology)
                .maxAgents(maxAgents)
                .strategy(strategy != null ? strategy : SwarmStrategy.BALANCED)
                .status(SwarmStatus.ACTIVE)
                .metrics(new SwarmMetrics())
                .createdAt(clock.instant())
                .build();

        synchronized (creationLock) {
            if (swarms.size() >= config.getMaxSwarms()) {
                throw new ResourceExhaustedException("Swarm limit reached: " + config.getMaxSwarms());
            }
            swarms.put(swarmId, new SwarmHandle(swarm));
        }

        log.info("Created swarm {} (topology={}, maxAgents={}, strategy={})",
                swarmId, topology, maxAgents, swarm.getStrategy());
        structuredLogger.logSwarmCreated(swarmId, topology.name(), maxAgents, swarm.getStrategy().name());
        hooks.postTask(swarmId, "active");
        return swarmId;
    }

    /**
     * Spawn an agent of a registered type into an active swarm.
     *
     * @throws UnknownSwarmException                                     if the swarm does not exist
     * @throws com.z254.autodev.swarm.error.UnknownAgentTypeException if the type is not registered
     * @throws ResourceExhaustedException                                if the swarm is full or not active
     */
    public String spawnAgent(String swarmId, String agentType, CapabilityOverrides overrides) {
        SwarmHandle handle = handle(swarmId);
        AgentCapability capability = capabilityRegistry.get(agentType);
        String agentId = agentType + "_" + UUID.randomUUID();

        Agent agent = Agent.builder()
                .id(agentId)
                .type(agentType)
                .swarmId(swarmId)
                .specializationTags(overrides != null && overrides.getSpecializationTags() != null
                        ? new ArrayList<>(overrides.getSpecializationTags())
                        : new ArrayList<>(capability.getSpecializationTags()))
                .complexityHandling(overrides != null && overrides.getComplexityHandling() != null
                        ? overrides.getComplexityHandling()
                        : capability.getComplexityHandling())
                .coordinationLevel(overrides != null && overrides.getCoordinationLevel() != null
                        ? overrides.getCoordinationLevel()
                        : capability.getCoordinationLevel())
                .status(AgentStatus.IDLE)
                .performance(new AgentPerformance())
                .createdAt(clock.instant())
                .build();

        handle.withLock(swarm -> {
            if (!swarm.isActive()) {
                throw new ResourceExhaustedException("Swarm " + swarmId + " is " + swarm.getStatus()
                        + " and does not accept new agents");
            }
            if (swarm.getAgents().size() >= swarm.getMaxAgents()) {
                throw new ResourceExhaustedException("Swarm " + swarmId + " is at capacity ("
                        + swarm.getMaxAgents() + " agents)");
            }
            swarm.getAgents().put(agentId, agent);
            swarm.getMetrics().setTotalAgents(swarm.getAgents().size());
            return null;
        });

        log.info("Spawned agent {} of type {} in swarm {}", agentId, agentType, swarmId);
        structuredLogger.logAgentSpawned(swarmId, agentId, agentType);
        hooks.notify("Agent " + agentType + " spawned with ID " + agentId);
        return agentId;
    }

    public String spawnAgent(String swarmId, String agentType) {
        return spawnAgent(swarmId, agentType, null);
    }

    /**
     * Deep copy of the swarm's current state.
     */
    public Swarm getStatus(String swarmId) {
        return handle(swarmId).withLock(Swarm::copy);
    }

    public List<Swarm> listSwarms() {
        List<Swarm> result = new ArrayList<>();
        for (SwarmHandle handle : swarms.values()) {
            result.add(handle.withLock(Swarm::copy));
        }
        return result;
    }

    public boolean exists(String swarmId) {
        return swarmId != null && swarms.containsKey(swarmId);
    }

    /**
     * Record a task submission against the swarm.
     */
    public void attachTask(String swarmId, String taskId) {
        handle(swarmId).withLock(swarm -> swarm.getTaskIds().add(taskId));
    }

    /**
     * Select the best idle agents for a task and mark them busy in one step.
     *
     * @return copies of the reserved agents in selection order; empty when no agent is idle
     * @throws ResourceExhaustedException if the swarm no longer accepts tasks
     */
    public List<Agent> reserveAgents(String swarmId, String taskId, String description,
                                     ComplexityVector complexity, int maxAgents) {
        return handle(swarmId).withLock(swarm -> {
            if (!swarm.isActive()) {
                throw new ResourceExhaustedException("Swarm " + swarmId + " is " + swarm.getStatus()
                        + " and does not accept new tasks");
            }
            List<Agent> idle = new ArrayList<>();
            for (Agent agent : swarm.getAgents().values()) {
                if (agent.isIdle()) {
                    idle.add(agent);
                }
            }
            List<Agent> selected = AgentSelector.select(idle, description, complexity, maxAgents);
            List<Agent> reserved = new ArrayList<>(selected.size());
            for (Agent agent : selected) {
                agent.setStatus(AgentStatus.BUSY);
                agent.setCurrentTaskId(taskId);
                reserved.add(agent.copy());
            }
            return reserved;
        });
    }

    /**
     * Return agents to idle. A draining swarm whose agents are all idle is closed.
     */
    public void releaseAgents(String swarmId, Collection<String> agentIds) {
        SwarmHandle handle = swarms.get(swarmId);
        if (handle == null) {
            return;
        }
        boolean closed = handle.withLock(swarm -> {
            for (String agentId : agentIds) {
                Agent agent = swarm.getAgents().get(agentId);
                if (agent != null) {
                    agent.setStatus(AgentStatus.IDLE);
                    agent.setCurrentTaskId(null);
                }
            }
            return closeIfDrained(swarm);
        });
        if (closed) {
            remove(swarmId);
        }
    }

    /**
     * Fold one agent call outcome into the agent's running performance means.
     */
    public void recordAgentOutcome(String swarmId, String agentId, long responseTimeMs, boolean success) {
        SwarmHandle handle = swarms.get(swarmId);
        if (handle == null) {
            return;
        }
        handle.withLock(swarm -> {
            Agent agent = swarm.getAgents().get(agentId);
            if (agent != null) {
                agent.getPerformance().record(responseTimeMs, success);
            }
            return null;
        });
    }

    public void recordTaskOutcome(String swarmId, long durationMs, boolean success) {
        SwarmHandle handle = swarms.get(swarmId);
        if (handle == null) {
            return;
        }
        handle.withLock(swarm -> {
            swarm.getMetrics().recordTask(durationMs, success);
            return null;
        });
    }

    /**
     * Tear a swarm down. The swarm stops accepting agents and tasks immediately and is closed
     * once no agent is busy.
     *
     * @return snapshot of the swarm after the request, DRAINING or CLOSED
     */
    public Swarm teardownSwarm(String swarmId) {
        SwarmHandle handle = handle(swarmId);
        Swarm snapshot = handle.withLock(swarm -> {
            if (swarm.getStatus() == SwarmStatus.ACTIVE) {
                swarm.setStatus(SwarmStatus.DRAINING);
                log.info("Swarm {} draining", swarmId);
            }
            closeIfDrained(swarm);
            return swarm.copy();
        });
        if (snapshot.getStatus() == SwarmStatus.CLOSED) {
            remove(swarmId);
        }
        return snapshot;
    }

    public int activeSwarmCount() {
        return (int) swarms.values().stream()
                .filter(handle -> handle.withLock(Swarm::isActive))
                .count();
    }

    public int swarmCount() {
        return swarms.size();
    }

    private boolean closeIfDrained(Swarm swarm) {
        if (swarm.getStatus() == SwarmStatus.DRAINING && !swarm.hasBusyAgents()) {
            swarm.setStatus(SwarmStatus.CLOSED);
            return true;
        }
        return false;
    }

    private void remove(String swarmId) {
        SwarmHandle handle = swarms.remove(swarmId);
        if (handle == null) {
            return;
        }
        metricsCollector.forgetAgents(handle.withLock(swarm -> new ArrayList<>(swarm.getAgents().keySet())));
        log.info("Swarm {} closed", swarmId);
        structuredLogger.logSwarmClosed(swarmId);
        hooks.notify("Swarm " + swarmId + " closed");
    }

    private SwarmHandle handle(String swarmId) {
        SwarmHandle handle = swarmId != null ? swarms.get(swarmId) : null;
        if (handle == null) {
            throw new UnknownSwarmException(swarmId);
        }
        return handle;
    }

    private static final class SwarmHandle {
        private final Swarm swarm;
        private final ReentrantLock lock = new ReentrantLock();

        private SwarmHandle(Swarm swarm) {
            this.swarm = swarm;
        }

        private <T> T withLock(Function<Swarm, T> action) {
            lock.lock();
            try {
                return action.apply(swarm);
            } finally {
                lock.unlock();
            }
        }
    }
}
