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
 * Agents run one at a time. Step N is issued only after step N-1 has returned, and receives
 * the outputs of every earlier step as context.
 */
@Slf4j
@Component
public class SequentialStrategyExecutor implements StrategyExecutor {

    @Override
    public ExecutionStrategy getStrategy() {
        return ExecutionStrategy.SEQUENTIAL;
    }

    @Override
    public Mono<List<AgentResult>> execute(ExecutionPlan plan, AgentStepRunner runner) {
        List<Agent> agents = plan.getAgents();
        log.debug("Executing task {} sequentially across {} agents", plan.getTask().getId(), agents.size());
        return Flux.range(0, agents.size())
                .concatMap(step -> Mono.defer(() -> runner.run(agents.get(step), step, plan.completedResults()))
                        .doOnNext(plan::recordResult))
                .collectList();
    }
}
