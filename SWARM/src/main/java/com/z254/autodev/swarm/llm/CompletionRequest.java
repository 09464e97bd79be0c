package com.z254.autodev.swarm.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request for a single chat completion from an upstream provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRequest {

    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();

    /**
     * Sampling temperature (0.0 - 2.0). Null uses the configured default.
     */
    private Double temperature;

    /**
     * Maximum tokens to generate. Null uses the configured default.
     */
    private Integer maxTokens;
}
