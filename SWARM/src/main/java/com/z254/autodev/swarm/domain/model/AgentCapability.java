package com.z254.autodev.swarm.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Static capability profile of an agent type.
 * Loaded once at startup and never mutated.
 */
@Value
@Builder
public class AgentCapability {

    /**
     * Agent type name, e.g. "coder" or "reviewer".
     */
    String name;

    /**
     * Specialization tags matched against task descriptions.
     */
    @Singular
    Set<String> specializationTags;

    /**
     * How well the agent copes with complex work (0 - 10).
     */
    double complexityHandling;

    /**
     * How well the agent coordinates with other agents (0 - 10).
     */
    double coordinationLevel;
}
