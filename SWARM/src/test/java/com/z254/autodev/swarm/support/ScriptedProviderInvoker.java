package com.z254.autodev.swarm.support;

import com.z254.autodev.swarm.error.ProviderErrorException;
import com.z254.autodev.swarm.llm.CompletionRequest;
import com.z254.autodev.swarm.llm.CompletionResponse;
import com.z254.autodev.swarm.llm.ProviderInvoker;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Provider invoker whose behaviour is scripted per provider. Unscripted providers echo
 * the last user message back with a normal completion.
 */
public class ScriptedProviderInvoker implements ProviderInvoker {

    private final Map<String, BiFunction<String, CompletionRequest, Mono<CompletionResponse>>> scripts =
            new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final List<Call> history = new CopyOnWriteArrayList<>();

    public ScriptedProviderInvoker respond(String provider,
                                           BiFunction<String, CompletionRequest, Mono<CompletionResponse>> script) {
        scripts.put(provider, script);
        return this;
    }

    public ScriptedProviderInvoker fail(String provider) {
        return respond(provider, (p, request) -> Mono.error(new ProviderErrorException(p, "HTTP 500 - upstream down")));
    }

    public ScriptedProviderInvoker reply(String provider, String content) {
        return respond(provider, (p, request) -> Mono.just(ok(p, content)));
    }

    @Override
    public Mono<CompletionResponse> call(String provider, CompletionRequest request) {
        return Mono.defer(() -> {
            calls.computeIfAbsent(provider, key -> new AtomicInteger()).incrementAndGet();
            history.add(new Call(provider, request));
            BiFunction<String, CompletionRequest, Mono<CompletionResponse>> script = scripts.get(provider);
            if (script != null) {
                return script.apply(provider, request);
            }
            String lastUser = request.getMessages().get(request.getMessages().size() - 1).getContent();
            return Mono.just(ok(provider, "echo: " + lastUser));
        });
    }

    public int callCount(String provider) {
        AtomicInteger count = calls.get(provider);
        return count != null ? count.get() : 0;
    }

    public int totalCalls() {
        return history.size();
    }

    public List<Call> history() {
        return List.copyOf(history);
    }

    public static CompletionResponse ok(String provider, String content) {
        return CompletionResponse.builder()
                .id("cmpl-" + Math.abs(content.hashCode()))
                .provider(provider)
                .content(content)
                .finishReason(CompletionResponse.FinishReason.STOP)
                .usage(CompletionResponse.Usage.builder()
                        .promptTokens(10)
                        .completionTokens(20)
                        .totalTokens(30)
                        .build())
                .build();
    }

    public record Call(String provider, CompletionRequest request) {
    }
}
