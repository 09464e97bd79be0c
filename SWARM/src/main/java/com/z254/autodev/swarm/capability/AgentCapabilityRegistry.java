package com.z254.autodev.swarm.capability;

import com.z254.autodev.swarm.domain.model.AgentCapability;
import com.z254.autodev.swarm.error.UnknownAgentTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of agent types and their capability profiles.
 * Populated once at construction.
 */
@Component
@Slf4j
public class AgentCapabilityRegistry {

    private final Map<String, AgentCapability> capabilities;

    public AgentCapabilityRegistry() {
        this(defaultCapabilities());
    }

    public AgentCapabilityRegistry(List<AgentCapability> capabilityList) {
        Map<String, AgentCapability> table = new LinkedHashMap<>();
        for (AgentCapability capability : capabilityList) {
            table.put(capability.getName(), capability);
        }
        this.capabilities = Collections.unmodifiableMap(table);
        log.info("Registered {} agent types: {}", table.size(), table.keySet());
    }

    /**
     * Get the capability profile of an agent type.
     *
     * @param agentType the agent type name
     * @return the capability profile
     * @throws UnknownAgentTypeException if the type is not registered
     */
    public AgentCapability get(String agentType) {
        AgentCapability capability = agentType != null ? capabilities.get(agentType) : null;
        if (capability == null) {
            throw new UnknownAgentTypeException(agentType);
        }
        return capability;
    }

    public Optional<AgentCapability> find(String agentType) {
        return Optional.ofNullable(agentType != null ? capabilities.get(agentType) : null);
    }

    public boolean contains(String agentType) {
        return agentType != null && capabilities.containsKey(agentType);
    }

    public Collection<AgentCapability> all() {
        return capabilities.values();
    }

    static List<AgentCapability> defaultCapabilities() {
        return List.of(
                capability("researcher", 8.5, 7.0, "analysis", "investigation", "data_gathering"),
                capability("coder", 9.2, 8.5, "implementation", "debugging", "optimization"),
                capability("architect", 9.8, 9.5, "system_design", "architecture", "planning"),
                capability("tester", 8.0, 7.5, "testing", "quality_assurance", "validation"),
                capability("reviewer", 8.8, 8.0, "code_review", "security", "best_practices"),
                capability("optimizer", 9.0, 7.8, "performance", "efficiency", "bottleneck_analysis"),
                capability("coordinator", 7.5, 9.8, "orchestration", "communication", "workflow")
        );
    }

    private static AgentCapability capability(String name, double complexity, double coordination, String... tags) {
        return AgentCapability.builder()
                .name(name)
                .specializationTags(List.of(tags))
                .complexityHandling(complexity)
                .coordinationLevel(coordination)
                .build();
    }
}
