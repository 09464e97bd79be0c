package com.z254.autodev.swarm.orchestration;

import com.z254.autodev.swarm.domain.model.Agent;
import com.z254.autodev.swarm.domain.model.AgentResult;
import com.z254.autodev.swarm.domain.model.SwarmTask;
import com.z254.autodev.swarm.llm.routing.InvocationConstraints;
import com.z254.autodev.swarm.metrics.MetricsCollector;
import com.z254.autodev.swarm.resilience.InvocationRequest;
import com.z254.autodev.swarm.resilience.ResilientInvocationClient;
import com.z254.autodev.swarm.swarm.SwarmManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Runs one agent step of a task through the resilient invocation client and records the
 * agent's performance.
 */
@Slf4j
@Component
public class AgentCallExecutor {

    private final ResilientInvocationClient invocationClient;
    private final SwarmManager swarmManager;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    public AgentCallExecutor(ResilientInvocationClient invocationClient,
                             SwarmManager swarmManager,
                             MetricsCollector metricsCollector,
                             Clock clock) {
        this.invocationClient = invocationClient;
        this.swarmManager = swarmManager;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
    }

    public Mono<AgentResult> execute(SwarmTask task, Agent agent, int step, List<AgentResult> priorResults) {
        return Mono.defer(() -> {
            long start = clock.millis();
            InvocationRequest request = InvocationRequest.builder()
                    .messages(AgentPrompts.messages(agent.getType(), task.getDescription(), priorResults))
                    .provider(task.getProvider())
                    .agentType(agent.getType())
                    .taskDescription(task.getDescription())
                    .complexity(task.getComplexity())
                    .constraints(InvocationConstraints.forAgents())
                    .build();
            log.debug("Task {} step {}: invoking agent {}", task.getId(), step, agent.getId());

            return invocationClient.invoke(request)
                    .map(response -> {
                        long elapsed = clock.millis() - start;
                        swarmManager.recordAgentOutcome(agent.getSwarmId(), agent.getId(), elapsed, true);
                        metricsCollector.recordAgentCall(agent.getId(), agent.getType(), elapsed, true,
                                response.isCached());
                        return AgentResult.builder()
                                .agentId(agent.getId())
                                .agentType(agent.getType())
                                .step(step)
                                .output(response.getContent())
                                .provider(response.getProvider())
                                .responseTimeMs(elapsed)
                                .tokensUsed(response.getTotalTokens())
                                .cached(response.isCached())
                                .timestamp(clock.instant())
                                .build();
                    })
                    .doOnError(error -> {
                        long elapsed = clock.millis() - start;
                        swarmManager.recordAgentOutcome(agent.getSwarmId(), agent.getId(), elapsed, false);
                        metricsCollector.recordAgentCall(agent.getId(), agent.getType(), elapsed, false, false);
                        log.warn("Task {} step {}: agent {} failed: {}", task.getId(), step, agent.getId(),
                                error.getMessage());
                    });
        });
    }
}
