package com.z254.autodev.swarm.llm;

import reactor.core.publisher.Mono;

/**
 * Transport boundary to upstream model providers.
 * Implementations own credentials, endpoints and HTTP concerns; everything above them is transport-agnostic.
 */
public interface ProviderInvoker {

    /**
     * Perform one upstream chat completion.
     *
     * @param provider provider (model) id, e.g. "anthropic/claude-3.5-sonnet"
     * @param request  the completion request
     * @return the response, or an error signal carrying a {@code ProviderErrorException}
     */
    Mono<CompletionResponse> call(String provider, CompletionRequest request);
}
