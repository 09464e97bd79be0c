package com.z254.autodev.swarm.orchestration.strategy;

import com.z254.autodev.swarm.domain.model.Agent;
import com.z254.autodev.swarm.domain.model.AgentResult;
import com.z254.autodev.swarm.domain.model.ExecutionStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * All agents receive the task at once; their calls run concurrently and are joined.
 * A failure cancels the calls still outstanding.
 */
@Slf4j
@Component
public class ParallelStrategyExecutor implements StrategyExecutor {

    @Override
    public ExecutionStrategy getStrategy() {
        return ExecutionStrategy.PARALLEL;
    }

    @Override
    public Mono<List<AgentResult>> execute(ExecutionPlan plan, AgentStepRunner runner) {
        List<Agent> agents = plan.getAgents();
        log.debug("Executing task {} in parallel across {} agents", plan.getTask().getId(), agents.size());
        return Flux.range(0, agents.size())
                .flatMapSequential(step -> runner.run(agents.get(step), step, List.of())
                        .doOnNext(plan::recordResult), Math.max(1, agents.size()))
                .collectList();
    }
}
