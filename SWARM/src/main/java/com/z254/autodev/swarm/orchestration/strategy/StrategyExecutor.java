package com.z254.autodev.swarm.orchestration.strategy;

import com.z254.autodev.swarm.domain.model.AgentResult;
import com.z254.autodev.swarm.domain.model.ExecutionStrategy;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Drives the agents of an execution plan.
 * Execution is fail-fast: the first failing step fails the whole plan, and results finished
 * before it stay available through {@link ExecutionPlan#completedResults()}.
 */
public interface StrategyExecutor {

    ExecutionStrategy getStrategy();

    /**
     * @return all results in step order, or the first step failure
     */
    Mono<List<AgentResult>> execute(ExecutionPlan plan, AgentStepRunner runner);
}
