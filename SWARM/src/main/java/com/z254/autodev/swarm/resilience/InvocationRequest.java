package com.z254.autodev.swarm.resilience;

import com.z254.autodev.swarm.domain.model.ComplexityVector;
import com.z254.autodev.swarm.llm.ChatMessage;
import com.z254.autodev.swarm.llm.routing.InvocationConstraints;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One logical call through the resilient invocation client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvocationRequest {

    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();

    private Double temperature;
    private Integer maxTokens;

    /**
     * Explicit provider. When null the provider is taken from the agent type mapping or ranked by capability.
     */
    private String provider;

    /**
     * Agent type on whose behalf the call is made, if any.
     */
    private String agentType;

    /**
     * Description used to derive the requirement vector for provider ranking.
     */
    private String taskDescription;

    private ComplexityVector complexity;

    @Builder.Default
    private InvocationConstraints constraints = InvocationConstraints.none();

    /**
     * Base cache TTL for this call. Null uses the configured default.
     */
    private Duration cacheTtl;
}
