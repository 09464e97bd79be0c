package com.z254.autodev.swarm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named group of agents sharing a topology, capacity and strategy.
 * Agents are kept in registration order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Swarm {

    private String id;
    private SwarmTopology topology;
    private int maxAgents;
    private SwarmStrategy strategy;

    @Builder.Default
    private Map<String, Agent> agents = new LinkedHashMap<>();

    @Builder.Default
    private SwarmStatus status = SwarmStatus.ACTIVE;

    @Builder.Default
    private SwarmMetrics metrics = new SwarmMetrics();

    /**
     * Ids of tasks submitted against this swarm, in submission order.
     */
    @Builder.Default
    private List<String> taskIds = new ArrayList<>();

    private Instant createdAt;

    public boolean isActive() {
        return status == SwarmStatus.ACTIVE;
    }

    public boolean hasBusyAgents() {
        return agents.values().stream().anyMatch(agent -> !agent.isIdle());
    }

    /**
     * Deep copy safe to hand out to callers.
     */
    public Swarm copy() {
        Map<String, Agent> agentCopies = new LinkedHashMap<>();
        agents.forEach((id, agent) -> agentCopies.put(id, agent.copy()));
        return Swarm.builder()
                .id(id)
                .topology(topology)
                .maxAgents(maxAgents)
                .strategy(strategy)
                .agents(agentCopies)
                .status(status)
                .metrics(metrics.copy())
                .taskIds(new ArrayList<>(taskIds))
                .createdAt(createdAt)
                .build();
    }
}
