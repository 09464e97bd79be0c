package com.z254.autodev.swarm.swarm;

import com.z254.autodev.swarm.domain.model.Agent;
import com.z254.autodev.swarm.domain.model.AgentStatus;
import com.z254.autodev.swarm.domain.model.CapabilityOverrides;
import com.z254.autodev.swarm.domain.model.ComplexityVector;
import com.z254.autodev.swarm.domain.model.Swarm;
import com.z254.autodev.swarm.domain.model.SwarmStatus;
import com.z254.autodev.swarm.domain.model.SwarmStrategy;
import com.z254.autodev.swarm.domain.model.SwarmTopology;
import com.z254.autodev.swarm.error.ResourceExhaustedException;
import com.z254.autodev.swarm.error.UnknownAgentTypeException;
import com.z254.autodev.swarm.error.UnknownSwarmException;
import com.z254.autodev.swarm.support.SwarmTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SwarmManager}.
 */
class SwarmManagerTest {

    private SwarmTestFixture fixture;
    private SwarmManager manager;

    @BeforeEach
    void setUp() {
        fixture = new SwarmTestFixture();
        fixture.properties.getOrchestration().setMaxSwarms(2);
        fixture.build();
        manager = fixture.swarmManager;
    }

    @Nested
    @DisplayName("createSwarm")
    class CreateSwarm {

        @Test
        void createsActiveEmptySwarm() {
            String swarmId = manager.createSwarm(SwarmTopology.MESH, 4, SwarmStrategy.SPECIALIZED);

            Swarm swarm = manager.getStatus(swarmId);
            assertThat(swarmId).startsWith("swarm_");
            assertThat(swarm.getStatus()).isEqualTo(SwarmStatus.ACTIVE);
            assertThat(swarm.getTopology()).isEqualTo(SwarmTopology.MESH);
            assertThat(swarm.getStrategy()).isEqualTo(SwarmStrategy.SPECIALIZED);
            assertThat(swarm.getAgents()).isEmpty();
            assertThat(fixture.memory.retrieve("task:" + swarmId)).isPresent();
        }

        @Test
        void rejectsBeyondSwarmLimit() {
            manager.createSwarm(SwarmTopology.MESH, 2, null);
            manager.createSwarm(SwarmTopology.RING, 2, null);

            assertThatThrownBy(() -> manager.createSwarm(SwarmTopology.STAR, 2, null))
                    .isInstanceOf(ResourceExhaustedException.class);
        }

        @Test
        void rejectsCapacityAbovePerSwarmLimit() {
            assertThatThrownBy(() -> manager.createSwarm(SwarmTopology.MESH, 13, null))
                    .isInstanceOf(ResourceExhaustedException.class);
        }
    }

    @Nested
    @DisplayName("spawnAgent")
    class SpawnAgent {

        @Test
        void spawnsWithRegisteredProfile() {
            String swarmId = manager.createSwarm(SwarmTopology.HIERARCHICAL, 3, null);

            String agentId = manager.spawnAgent(swarmId, "coder");

            Agent agent = manager.getStatus(swarmId).getAgents().get(agentId);
            assertThat(agentId).startsWith("coder_");
            assertThat(agent.getStatus()).isEqualTo(AgentStatus.IDLE);
            assertThat(agent.getSpecializationTags()).containsExactly("implementation", "debugging", "optimization");
            assertThat(agent.getComplexityHandling()).isEqualTo(9.2);
            assertThat(manager.getStatus(swarmId).getMetrics().getTotalAgents()).isEqualTo(1);
        }

        @Test
        void appliesOverrides() {
            String swarmId = manager.createSwarm(SwarmTopology.HIERARCHICAL, 3, null);

            String agentId = manager.spawnAgent(swarmId, "tester", CapabilityOverrides.builder()
                    .specializationTags(List.of("fuzzing"))
                    .coordinationLevel(1.0)
                    .build());

            Agent agent = manager.getStatus(swarmId).getAgents().get(agentId);
            assertThat(agent.getSpecializationTags()).containsExactly("fuzzing");
            assertThat(agent.getCoordinationLevel()).isEqualTo(1.0);
            assertThat(agent.getComplexityHandling()).isEqualTo(8.0);
        }

        @Test
        void rejectsUnknownTypeAndSwarm() {
            String swarmId = manager.createSwarm(SwarmTopology.MESH, 3, null);

            assertThatThrownBy(() -> manager.spawnAgent(swarmId, "wizard"))
                    .isInstanceOf(UnknownAgentTypeException.class);
            assertThatThrownBy(() -> manager.spawnAgent("swarm_missing", "coder"))
                    .isInstanceOf(UnknownSwarmException.class);
        }

        @Test
        void rejectsBeyondCapacity() {
            String swarmId = manager.createSwarm(SwarmTopology.STAR, 1, null);
            manager.spawnAgent(swarmId, "coder");

            assertThatThrownBy(() -> manager.spawnAgent(swarmId, "reviewer"))
                    .isInstanceOf(ResourceExhaustedException.class);
        }
    }

    @Nested
    @DisplayName("reservation and teardown")
    class Lifecycle {

        @Test
        void reservedAgentsAreBusyUntilReleased() {
            String swarmId = manager.createSwarm(SwarmTopology.MESH, 3, null);
            String coder = manager.spawnAgent(swarmId, "coder");
            manager.spawnAgent(swarmId, "reviewer");

            List<Agent> reserved = manager.reserveAgents(swarmId, "task_1", "implementation work",
                    ComplexityVector.neutral(), 1);

            assertThat(reserved).extracting(Agent::getId).containsExactly(coder);
            assertThat(manager.getStatus(swarmId).getAgents().get(coder).getStatus()).isEqualTo(AgentStatus.BUSY);
            assertThat(manager.reserveAgents(swarmId, "task_2", "implementation work",
                    ComplexityVector.neutral(), 3)).hasSize(1);

            manager.releaseAgents(swarmId, List.of(coder));

            assertThat(manager.getStatus(swarmId).getAgents().get(coder).getStatus()).isEqualTo(AgentStatus.IDLE);
        }

        @Test
        void teardownOfIdleSwarmClosesImmediately() {
            String swarmId = manager.createSwarm(SwarmTopology.MESH, 3, null);
            manager.spawnAgent(swarmId, "coder");

            Swarm snapshot = manager.teardownSwarm(swarmId);

            assertThat(snapshot.getStatus()).isEqualTo(SwarmStatus.CLOSED);
            assertThat(manager.exists(swarmId)).isFalse();
            assertThatThrownBy(() -> manager.getStatus(swarmId)).isInstanceOf(UnknownSwarmException.class);
        }

        @Test
        void teardownWithBusyAgentDrainsThenCloses() {
            String swarmId = manager.createSwarm(SwarmTopology.MESH, 3, null);
            String coder = manager.spawnAgent(swarmId, "coder");
            manager.reserveAgents(swarmId, "task_1", "x", ComplexityVector.neutral(), 1);

            Swarm snapshot = manager.teardownSwarm(swarmId);

            assertThat(snapshot.getStatus()).isEqualTo(SwarmStatus.DRAINING);
            assertThatThrownBy(() -> manager.spawnAgent(swarmId, "tester"))
                    .isInstanceOf(ResourceExhaustedException.class);
            assertThatThrownBy(() -> manager.reserveAgents(swarmId, "task_2", "x", ComplexityVector.neutral(), 1))
                    .isInstanceOf(ResourceExhaustedException.class);
            assertThat(manager.activeSwarmCount()).isZero();

            manager.releaseAgents(swarmId, List.of(coder));

            assertThat(manager.exists(swarmId)).isFalse();
        }

        @Test
        void closedSwarmDropsItsAgentCallStatistics() {
            String closing = manager.createSwarm(SwarmTopology.MESH, 3, null);
            String kept = manager.createSwarm(SwarmTopology.MESH, 3, null);
            String closingCoder = manager.spawnAgent(closing, "coder");
            String keptCoder = manager.spawnAgent(kept, "coder");
            fixture.metricsCollector.recordAgentCall(closingCoder, "coder", 50, true, false);
            fixture.metricsCollector.recordAgentCall(keptCoder, "coder", 70, true, false);

            manager.teardownSwarm(closing);

            assertThat(fixture.metricsCollector.agentStats()).containsOnlyKeys(keptCoder);
        }

        @Test
        void performanceIsRunningMean() {
            String swarmId = manager.createSwarm(SwarmTopology.MESH, 3, null);
            String coder = manager.spawnAgent(swarmId, "coder");

            manager.recordAgentOutcome(swarmId, coder, 100, true);
            manager.recordAgentOutcome(swarmId, coder, 300, false);

            Agent agent = manager.getStatus(swarmId).getAgents().get(coder);
            assertThat(agent.getPerformance().getTasksCompleted()).isEqualTo(2);
            assertThat(agent.getPerformance().getAverageTime()).isEqualTo(200.0);
            assertThat(agent.getPerformance().getSuccessRate()).isEqualTo(0.5);
        }
    }
}
