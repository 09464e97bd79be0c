package com.z254.autodev.swarm.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of an upstream chat completion.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CompletionResponse {

    private String id;

    /**
     * Provider (model id) that produced the response.
     */
    private String provider;

    private String content;

    private FinishReason finishReason;

    private Usage usage;

    /**
     * Upstream latency in milliseconds.
     */
    private long latencyMs;

    /**
     * True when served from the response cache.
     */
    private boolean cached;

    public enum FinishReason {
        STOP,           // Natural completion
        LENGTH,         // Hit max tokens
        CONTENT_FILTER,
        ERROR,
        OTHER;

        public static FinishReason fromWire(String value) {
            if (value == null) {
                return OTHER;
            }
            return switch (value.toLowerCase()) {
                case "stop", "end_turn" -> STOP;
                case "length", "max_tokens" -> LENGTH;
                case "content_filter" -> CONTENT_FILTER;
                case "error" -> ERROR;
                default -> OTHER;
            };
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {
        private int promptTokens;
        private int completionTokens;
        private int totalTokens;
    }

    public int getTotalTokens() {
        return usage != null ? usage.getTotalTokens() : 0;
    }

    public boolean isNormalCompletion() {
        return finishReason == FinishReason.STOP;
    }
}
