package com.z254.autodev.swarm.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.autodev.swarm.config.SwarmProperties;
import com.z254.autodev.swarm.error.ProviderErrorException;
import com.z254.autodev.swarm.llm.ChatMessage;
import com.z254.autodev.swarm.llm.CompletionRequest;
import com.z254.autodev.swarm.llm.CompletionResponse;
import com.z254.autodev.swarm.llm.ProviderInvoker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link ProviderInvoker} backed by the OpenRouter chat completions API.
 * Every model id in the capability table is routed through the same endpoint.
 */
@Slf4j
@Component
public class OpenRouterProviderInvoker implements ProviderInvoker {

    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final WebClient webClient;
    private final SwarmProperties.OpenRouterProperties config;
    private final Clock clock;

    public OpenRouterProviderInvoker(WebClient.Builder webClientBuilder, SwarmProperties properties, Clock clock) {
        this.config = properties.getOpenrouter();
        this.clock = clock;
        this.webClient = webClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("HTTP-Referer", config.getReferer())
                .defaultHeader("X-Title", config.getTitle())
                .build();
        if (!StringUtils.hasText(config.getApiKey())) {
            log.warn("No OpenRouter API key configured, upstream calls will be rejected");
        }
    }

    @Override
    public Mono<CompletionResponse> call(String provider, CompletionRequest request) {
        if (!StringUtils.hasText(config.getApiKey())) {
            return Mono.error(new ProviderErrorException(provider, "OpenRouter API key is not configured", false, null));
        }
        long startTime = clock.millis();

        return webClient.post()
                .uri(CHAT_COMPLETIONS_PATH)
                .bodyValue(buildRequestBody(provider, request))
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(JsonNode.class);
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> Mono.error(new ProviderErrorException(provider,
                                    "HTTP " + response.statusCode().value() + " - " + body)));
                })
                .map(json -> parseResponse(provider, json, startTime))
                .doOnSuccess(response -> log.debug("OpenRouter completion from {}: {}ms, {} tokens",
                        provider, response.getLatencyMs(), response.getTotalTokens()))
                .doOnError(e -> log.error("OpenRouter completion error for {}: {}", provider, e.getMessage()));
    }

    private Map<String, Object> buildRequestBody(String provider, CompletionRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", provider);
        body.put("messages", convertMessages(request.getMessages()));
        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            body.put("max_tokens", request.getMaxTokens());
        }
        return body;
    }

    private List<Map<String, String>> convertMessages(List<ChatMessage> messages) {
        return messages.stream()
                .map(m -> Map.of("role", m.getRole(), "content", m.getContent() != null ? m.getContent() : ""))
                .collect(Collectors.toList());
    }

    private CompletionResponse parseResponse(String provider, JsonNode json, long startTime) {
        // OpenRouter reports some upstream failures inside a 200 body
        if (json.hasNonNull("error")) {
            JsonNode error = json.get("error");
            String message = error.hasNonNull("message") ? error.get("message").asText() : error.toString();
            throw new ProviderErrorException(provider, message);
        }
        JsonNode choices = json.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ProviderErrorException(provider, "response carried no choices");
        }
        JsonNode choice = choices.get(0);
        JsonNode message = choice.path("message");
        String content = message.hasNonNull("content") ? message.get("content").asText() : null;

        CompletionResponse.Usage usage = null;
        if (json.hasNonNull("usage")) {
            JsonNode usageNode = json.get("usage");
            usage = CompletionResponse.Usage.builder()
                    .promptTokens(usageNode.path("prompt_tokens").asInt())
                    .completionTokens(usageNode.path("completion_tokens").asInt())
                    .totalTokens(usageNode.path("total_tokens").asInt())
                    .build();
        }

        return CompletionResponse.builder()
                .id(json.path("id").asText(null))
                .provider(provider)
                .content(content)
                .finishReason(CompletionResponse.FinishReason.fromWire(
                        choice.hasNonNull("finish_reason") ? choice.get("finish_reason").asText() : null))
                .usage(usage)
                .latencyMs(clock.millis() - startTime)
                .build();
    }
}
