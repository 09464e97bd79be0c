package com.z254.autodev.swarm.orchestration.strategy;

import com.z254.autodev.swarm.domain.model.Agent;
import com.z254.autodev.swarm.domain.model.AgentResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs a single agent step of a plan.
 */
@FunctionalInterface
public interface AgentStepRunner {

    /**
     * @param agent        the agent to run
     * @param step         position of the agent in the plan
     * @param priorResults outputs of earlier steps to pass on as context; empty for independent steps
     */
    Mono<AgentResult> run(Agent agent, int step, List<AgentResult> priorResults);
}
