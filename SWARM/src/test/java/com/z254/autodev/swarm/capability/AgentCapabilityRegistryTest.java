package com.z254.autodev.swarm.capability;

import com.z254.autodev.swarm.domain.model.AgentCapability;
import com.z254.autodev.swarm.domain.model.ModelCapabilities;
import com.z254.autodev.swarm.error.UnknownAgentTypeException;
import com.z254.autodev.swarm.error.UnknownProviderException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentCapabilityRegistryTest {

    private final AgentCapabilityRegistry registry = new AgentCapabilityRegistry();
    private final ModelCapabilityTable models = new ModelCapabilityTable();

    @Test
    void registersTheSevenBuiltInAgentTypes() {
        assertThat(registry.all()).extracting(AgentCapability::getName)
                .containsExactly("researcher", "coder", "architect", "tester", "reviewer", "optimizer", "coordinator");

        AgentCapability coder = registry.get("coder");
        assertThat(coder.getComplexityHandling()).isEqualTo(9.2);
        assertThat(coder.getCoordinationLevel()).isEqualTo(8.5);
        assertThat(coder.getSpecializationTags()).containsExactly("implementation", "debugging", "optimization");
    }

    @Test
    void unknownAgentTypeIsRejected() {
        assertThatThrownBy(() -> registry.get("poet")).isInstanceOf(UnknownAgentTypeException.class);
        assertThatThrownBy(() -> registry.get(null)).isInstanceOf(UnknownAgentTypeException.class);
        assertThat(registry.find("poet")).isEmpty();
        assertThat(registry.contains("tester")).isTrue();
    }

    @Test
    void customRegistryKeepsGivenOrder() {
        AgentCapabilityRegistry custom = new AgentCapabilityRegistry(List.of(
                AgentCapability.builder().name("b").specializationTags(List.of()).build(),
                AgentCapability.builder().name("a").specializationTags(List.of()).build()));

        assertThat(custom.all()).extracting(AgentCapability::getName).containsExactly("b", "a");
    }

    @Test
    void modelTableKeepsTableOrderAndScores() {
        assertThat(models.all()).extracting(ModelCapabilities::getProvider).containsExactly(
                "anthropic/claude-3.5-sonnet",
                "anthropic/claude-3-haiku",
                "openai/gpt-4-turbo",
                "openai/gpt-3.5-turbo",
                "google/palm-2-codechat-bison",
                "meta-llama/codellama-34b-instruct");

        ModelCapabilities haiku = models.get("anthropic/claude-3-haiku");
        assertThat(haiku.getSpeed()).isEqualTo(9.5);
        assertThat(haiku.getCost()).isEqualTo(9.0);
    }

    @Test
    void unknownProviderIsRejected() {
        assertThatThrownBy(() -> models.get("acme/unknown")).isInstanceOf(UnknownProviderException.class);
        assertThat(models.contains("openai/gpt-4-turbo")).isTrue();
        assertThat(models.contains(null)).isFalse();
    }
}
