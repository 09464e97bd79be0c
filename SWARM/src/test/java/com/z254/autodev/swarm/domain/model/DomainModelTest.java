package com.z254.autodev.swarm.domain.model;

import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainModelTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void complexityComponentsMustLieInUnitInterval() {
        assertThatThrownBy(() -> ComplexityVector.of(1.1, 0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("computational");
        assertThatThrownBy(() -> ComplexityVector.of(0, 0, -0.1, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("creative");
        assertThatThrownBy(() -> ComplexityVector.of(0, Double.NaN, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(ComplexityVector.of(0.8, 0.8, 0.2, 0.5).mean()).isCloseTo(0.575, Offset.offset(1e-9));
        assertThat(ComplexityVector.neutral().mean()).isEqualTo(0.5);
    }

    @Test
    void agentPerformanceKeepsArithmeticMeans() {
        AgentPerformance performance = new AgentPerformance();

        performance.record(100, true);
        performance.record(300, false);
        performance.record(200, true);

        assertThat(performance.getTasksCompleted()).isEqualTo(3);
        assertThat(performance.getAverageTime()).isCloseTo(200.0, Offset.offset(1e-9));
        assertThat(performance.getSuccessRate()).isCloseTo(2.0 / 3.0, Offset.offset(1e-9));
    }

    @Test
    void swarmMetricsCountOutcomes() {
        SwarmMetrics metrics = new SwarmMetrics();

        metrics.recordTask(100, true);
        metrics.recordTask(300, false);

        assertThat(metrics.getTasksCompleted()).isEqualTo(1);
        assertThat(metrics.getTasksFailed()).isEqualTo(1);
        assertThat(metrics.getAverageResponseTime()).isEqualTo(200.0);
    }

    @Test
    void firstTerminalOutcomeWins() {
        SwarmTask task = SwarmTask.builder().id("task_1").status(TaskStatus.PENDING).build();
        task.markExecuting(List.of("coder_1"), ExecutionStrategy.PARALLEL, NOW);
        AgentResult result = AgentResult.builder().agentId("coder_1").output("done").build();

        assertThat(task.finish(TaskOutcome.completed(List.of(result)), NOW.plusSeconds(1))).isTrue();
        assertThat(task.finish(TaskOutcome.failed("TIMEOUT", "late", List.of(), null), NOW.plusSeconds(2)))
                .isFalse();

        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getResults()).containsExactly(result);
        assertThat(task.getErrorType()).isNull();
        assertThat(task.getCompletedAt()).isEqualTo(NOW.plusSeconds(1));
    }

    @Test
    void failedTaskKeepsPartialResultsSeparately() {
        SwarmTask task = SwarmTask.builder().id("task_2").status(TaskStatus.PENDING).build();
        AgentResult partial = AgentResult.builder().agentId("coder_1").output("half").build();

        task.finish(TaskOutcome.failed("TASK_EXECUTION_FAILED", "boom", List.of(partial), null), NOW);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getResults()).isEmpty();
        assertThat(task.getPartialResults()).containsExactly(partial);
        assertThat(task.getErrorMessage()).isEqualTo("boom");
    }

    @Test
    void taskCopyIsIndependent() {
        SwarmTask task = SwarmTask.builder().id("task_3").status(TaskStatus.PENDING).build();
        SwarmTask copy = task.copy();

        task.audit("submitted");

        assertThat(copy.getAuditLog()).isEmpty();
        assertThat(task.getAuditLog()).containsExactly("submitted");
    }
}
