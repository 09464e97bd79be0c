package com.z254.autodev.swarm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A task orchestrated across the agents of a swarm.
 * Once COMPLETED or FAILED the task no longer changes, apart from its audit log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwarmTask {

    private String id;
    private String swarmId;
    private String description;
    private TaskPriority priority;
    private ComplexityVector complexity;

    /**
     * Provider explicitly requested for every agent call, or null.
     */
    private String provider;

    /**
     * Upper bound on the number of agents assigned.
     */
    private int maxAgents;

    /**
     * Strategy requested by the caller.
     */
    private ExecutionStrategy requestedStrategy;

    /**
     * Strategy actually used once ADAPTIVE has been resolved.
     */
    private ExecutionStrategy effectiveStrategy;

    @Builder.Default
    private List<String> assignedAgents = new ArrayList<>();

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    @Builder.Default
    private List<AgentResult> results = new ArrayList<>();

    /**
     * Results that finished before a failure. Diagnostic only; a failed task has no results.
     */
    @Builder.Default
    private List<AgentResult> partialResults = new ArrayList<>();

    private String errorType;
    private String errorMessage;

    @Builder.Default
    private List<String> auditLog = new ArrayList<>();

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public synchronized void markExecuting(List<String> agentIds, ExecutionStrategy resolved, Instant now) {
        requireNotTerminal();
        this.assignedAgents = new ArrayList<>(agentIds);
        this.effectiveStrategy = resolved;
        this.status = TaskStatus.EXECUTING;
        this.startedAt = now;
    }

    /**
     * Applies a terminal outcome. Only the first outcome is kept.
     *
     * @return false when the task was already terminal
     */
    public synchronized boolean finish(TaskOutcome outcome, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        this.completedAt = now;
        if (outcome.isCompleted()) {
            this.results = new ArrayList<>(outcome.getResults());
            this.status = TaskStatus.COMPLETED;
        } else {
            this.partialResults = new ArrayList<>(outcome.getResults());
            this.status = TaskStatus.FAILED;
            this.errorType = outcome.getErrorType();
            this.errorMessage = outcome.getErrorMessage();
        }
        return true;
    }

    public synchronized void audit(String entry) {
        auditLog.add(entry);
    }

    public synchronized SwarmTask copy() {
        return SwarmTask.builder()
                .id(id)
                .swarmId(swarmId)
                .description(description)
                .priority(priority != null ? priority.copy() : null)
                .complexity(complexity)
                .provider(provider)
                .maxAgents(maxAgents)
                .requestedStrategy(requestedStrategy)
                .effectiveStrategy(effectiveStrategy)
                .assignedAgents(new ArrayList<>(assignedAgents))
                .status(status)
                .results(new ArrayList<>(results))
                .partialResults(new ArrayList<>(partialResults))
                .errorType(errorType)
                .errorMessage(errorMessage)
                .auditLog(new ArrayList<>(auditLog))
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }

    private void requireNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Task " + id + " is already " + status);
        }
    }
}
