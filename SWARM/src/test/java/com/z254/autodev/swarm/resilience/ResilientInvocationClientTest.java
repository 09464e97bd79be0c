package com.z254.autodev.swarm.resilience;

import com.z254.autodev.swarm.domain.model.ComplexityVector;
import com.z254.autodev.swarm.error.AllProvidersUnavailableException;
import com.z254.autodev.swarm.error.InvocationTimeoutException;
import com.z254.autodev.swarm.error.ProviderErrorException;
import com.z254.autodev.swarm.error.UnknownProviderException;
import com.z254.autodev.swarm.llm.ChatMessage;
import com.z254.autodev.swarm.llm.CompletionResponse;
import com.z254.autodev.swarm.llm.routing.InvocationConstraints;
import com.z254.autodev.swarm.support.ScriptedProviderInvoker;
import com.z254.autodev.swarm.support.SwarmTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ResilientInvocationClient}.
 */
class ResilientInvocationClientTest {

    private static final String SONNET = "anthropic/claude-3.5-sonnet";
    private static final String HAIKU = "anthropic/claude-3-haiku";
    private static final String GPT35 = "openai/gpt-3.5-turbo";

    private SwarmTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SwarmTestFixture();
        fixture.properties.getInvocation().setRequestTimeout(Duration.ofSeconds(2));
    }

    private ResilientInvocationClient client() {
        return fixture.build().client;
    }

    private static InvocationRequest request(String provider, String prompt) {
        return InvocationRequest.builder()
                .messages(List.of(ChatMessage.user(prompt)))
                .provider(provider)
                .build();
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        @Test
        void identicalRequestIsServedFromCache() {
            ResilientInvocationClient client = client();

            StepVerifier.create(client.invoke(request(SONNET, "hello")))
                    .assertNext(response -> assertThat(response.isCached()).isFalse())
                    .verifyComplete();
            StepVerifier.create(client.invoke(request(SONNET, "  hello  ")))
                    .assertNext(response -> {
                        assertThat(response.isCached()).isTrue();
                        assertThat(response.getContent()).isEqualTo("echo: hello");
                    })
                    .verifyComplete();

            assertThat(fixture.invoker.callCount(SONNET)).isEqualTo(1);
            assertThat(fixture.metricsCollector.providerStats(SONNET).getCacheHits()).isEqualTo(1);
        }

        @Test
        void expiredEntryCostsExactlyOneMoreUpstreamCall() {
            ResilientInvocationClient client = client();
            Duration storedFor = fixture.properties.getCache().getBaseTtl().multipliedBy(2);

            client.invoke(request(SONNET, "hello")).block();
            client.invoke(request(SONNET, "hello")).block();
            assertThat(fixture.invoker.callCount(SONNET)).isEqualTo(1);

            fixture.clock.advance(storedFor.plusSeconds(1));

            StepVerifier.create(client.invoke(request(SONNET, "hello")))
                    .assertNext(response -> assertThat(response.isCached()).isFalse())
                    .verifyComplete();
            assertThat(fixture.invoker.callCount(SONNET)).isEqualTo(2);

            client.invoke(request(SONNET, "hello")).block();
            assertThat(fixture.invoker.callCount(SONNET)).isEqualTo(2);
        }

        @Test
        void differentTemperatureMissesCache() {
            ResilientInvocationClient client = client();
            InvocationRequest warm = request(SONNET, "hello");
            InvocationRequest cold = request(SONNET, "hello");
            cold.setTemperature(0.1);

            client.invoke(warm).block();
            client.invoke(cold).block();

            assertThat(fixture.invoker.callCount(SONNET)).isEqualTo(2);
        }

        @Test
        void truncatedResponseIsNotCached() {
            fixture.invoker.respond(SONNET, (p, r) -> Mono.just(ScriptedProviderInvoker.ok(p, "cut").toBuilder()
                    .finishReason(CompletionResponse.FinishReason.LENGTH)
                    .build()));
            ResilientInvocationClient client = client();

            client.invoke(request(SONNET, "long answer")).block();
            client.invoke(request(SONNET, "long answer")).block();

            assertThat(fixture.invoker.callCount(SONNET)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("deduplication")
    class Deduplication {

        @Test
        void concurrentIdenticalCallsShareOneUpstreamCall() {
            Sinks.One<CompletionResponse> upstream = Sinks.one();
            fixture.invoker.respond(SONNET, (p, r) -> upstream.asMono());
            ResilientInvocationClient client = client();

            Mono<CompletionResponse> first = client.invoke(request(SONNET, "same")).cache();
            Mono<CompletionResponse> second = client.invoke(request(SONNET, "same")).cache();
            first.subscribe();
            second.subscribe();

            assertThat(fixture.inFlight.size()).isEqualTo(1);
            upstream.tryEmitValue(ScriptedProviderInvoker.ok(SONNET, "shared"));

            StepVerifier.create(first).assertNext(r -> assertThat(r.getContent()).isEqualTo("shared")).verifyComplete();
            StepVerifier.create(second).assertNext(r -> assertThat(r.getContent()).isEqualTo("shared")).verifyComplete();
            assertThat(fixture.invoker.callCount(SONNET)).isEqualTo(1);
            assertThat(fixture.inFlight.size()).isZero();
            assertThat(fixture.meterRegistry.get("swarm.dedup.joins").counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("circuit breaking and fallback")
    class Fallback {

        @Test
        void fallsBackToConfiguredProvider() {
            fixture.properties.getInvocation().setFallbackProviders(List.of(HAIKU));
            fixture.invoker.fail(SONNET).reply(HAIKU, "from haiku");
            ResilientInvocationClient client = client();

            StepVerifier.create(client.invoke(request(SONNET, "task")))
                    .assertNext(response -> {
                        assertThat(response.getContent()).isEqualTo("from haiku");
                        assertThat(response.getProvider()).isEqualTo(HAIKU);
                    })
                    .verifyComplete();
        }

        @Test
        void surfacesFirstProviderErrorWhenChainIsExhausted() {
            fixture.properties.getInvocation().setFallbackProviders(List.of(HAIKU));
            fixture.invoker.fail(SONNET).fail(HAIKU);
            ResilientInvocationClient client = client();

            StepVerifier.create(client.invoke(request(SONNET, "task")))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ProviderErrorException.class);
                        assertThat(((ProviderErrorException) error).getProvider()).isEqualTo(SONNET);
                    })
                    .verify();
        }

        @Test
        void fourthCallFailsFastWithoutContactingOpenProvider() {
            fixture.invoker.fail(SONNET);
            ResilientInvocationClient client = client();

            for (int i = 0; i < 3; i++) {
                StepVerifier.create(client.invoke(request(SONNET, "attempt " + i)))
                        .expectError(ProviderErrorException.class)
                        .verify();
            }

            StepVerifier.create(client.invoke(request(SONNET, "attempt 3")))
                    .expectError(AllProvidersUnavailableException.class)
                    .verify();
            assertThat(fixture.invoker.callCount(SONNET)).isEqualTo(3);
            assertThat(fixture.breakers.get(SONNET).getState()).isEqualTo(CircuitState.OPEN);
        }

        @Test
        void fourthCallGoesStraightToFallbackWhenPrimaryIsOpen() {
            fixture.properties.getInvocation().setFallbackProviders(List.of(GPT35));
            fixture.invoker.fail(SONNET).reply(GPT35, "fallback");
            ResilientInvocationClient client = client();

            for (int i = 0; i < 3; i++) {
                client.invoke(request(SONNET, "attempt " + i)).block();
            }
            assertThat(fixture.breakers.get(SONNET).getState()).isEqualTo(CircuitState.OPEN);

            StepVerifier.create(client.invoke(request(SONNET, "attempt 3")))
                    .assertNext(response -> assertThat(response.getContent()).isEqualTo("fallback"))
                    .verifyComplete();
            assertThat(fixture.invoker.callCount(SONNET)).isEqualTo(3);
            assertThat(fixture.invoker.callCount(GPT35)).isEqualTo(4);
        }

        @Test
        void openProviderIsRetriedAfterCoolDown() {
            fixture.invoker.fail(SONNET);
            ResilientInvocationClient client = client();
            for (int i = 0; i < 3; i++) {
                client.invoke(request(SONNET, "attempt " + i)).onErrorResume(e -> Mono.empty()).block();
            }

            fixture.invoker.reply(SONNET, "recovered");
            fixture.clock.advance(Duration.ofSeconds(60));

            StepVerifier.create(client.invoke(request(SONNET, "trial")))
                    .assertNext(response -> assertThat(response.getContent()).isEqualTo("recovered"))
                    .verifyComplete();
            assertThat(fixture.breakers.get(SONNET).getState()).isEqualTo(CircuitState.CLOSED);
        }

        @Test
        void slowProviderTimesOutAndCountsAsFailure() {
            fixture.properties.getInvocation().setRequestTimeout(Duration.ofMillis(100));
            fixture.invoker.respond(SONNET, (p, r) -> Mono.never());
            ResilientInvocationClient client = client();

            StepVerifier.create(client.invoke(request(SONNET, "slow")))
                    .expectError(InvocationTimeoutException.class)
                    .verify(Duration.ofSeconds(5));
            assertThat(fixture.breakers.get(SONNET).snapshot().getFailures()).isEqualTo(1);
        }

        @Test
        void localFailureLeavesBreakerAloneButIsRecordedAsFailedRequest() {
            fixture.invoker.respond(SONNET, (p, r) ->
                    Mono.error(new ProviderErrorException(p, "missing API key", false, null)));
            ResilientInvocationClient client = client();

            StepVerifier.create(client.invoke(request(SONNET, "no key")))
                    .expectError(ProviderErrorException.class)
                    .verify();

            assertThat(fixture.breakers.get(SONNET).snapshot().getFailures()).isZero();
            assertThat(fixture.metricsCollector.providerStats(SONNET).getCount()).isEqualTo(1);
            assertThat(fixture.metricsCollector.providerStats(SONNET).getFailures()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("provider selection")
    class Selection {

        @Test
        void unknownExplicitProviderIsConfigurationError() {
            ResilientInvocationClient client = client();

            assertThatThrownBy(() -> client.selectPrimaryProvider(request("acme/unknown", "x")))
                    .isInstanceOf(UnknownProviderException.class);
            StepVerifier.create(client.invoke(request("acme/unknown", "x")))
                    .expectError(UnknownProviderException.class)
                    .verify();
            assertThat(fixture.invoker.totalCalls()).isZero();
        }

        @Test
        void agentTypeMappingChoosesProvider() {
            fixture.properties.getInvocation().getAgentProviders().put("tester", GPT35);
            ResilientInvocationClient client = client();
            InvocationRequest request = request(null, "write tests");
            request.setAgentType("tester");

            assertThat(client.selectPrimaryProvider(request)).isEqualTo(GPT35);
        }

        @Test
        void rankedSelectionSkipsOpenBreakers() {
            ResilientInvocationClient client = client();
            ComplexityVector complexity = ComplexityVector.of(0.9, 0.4, 0.1, 0.3);
            InvocationRequest request = InvocationRequest.builder()
                    .messages(List.of(ChatMessage.user("implement and debug the parser")))
                    .taskDescription("implement and debug the parser")
                    .complexity(complexity)
                    .build();
            List<String> ranked = client.rankProviders(request.getTaskDescription(), complexity,
                    InvocationConstraints.none());

            assertThat(client.selectPrimaryProvider(request)).isEqualTo(ranked.get(0));

            ProviderCircuitBreaker best = fixture.breakers.get(ranked.get(0));
            best.onFailure();
            best.onFailure();
            best.onFailure();

            assertThat(client.selectPrimaryProvider(request)).isEqualTo(ranked.get(1));
        }

        @Test
        void everyProviderFilteredOutUsesDefault() {
            ResilientInvocationClient client = client();
            InvocationRequest request = InvocationRequest.builder()
                    .messages(List.of(ChatMessage.user("x")))
                    .constraints(InvocationConstraints.builder().maxCost(1.0).build())
                    .build();

            assertThat(client.selectPrimaryProvider(request)).isEqualTo(SONNET);
        }

        @Test
        void excludedProvidersAreNotRanked() {
            ResilientInvocationClient client = client();
            InvocationConstraints constraints = InvocationConstraints.builder()
                    .excludeProviders(Set.of(SONNET, HAIKU))
                    .build();

            assertThat(client.rankProviders("code", ComplexityVector.neutral(), constraints))
                    .hasSize(4)
                    .doesNotContain(SONNET, HAIKU);
        }
    }
}
