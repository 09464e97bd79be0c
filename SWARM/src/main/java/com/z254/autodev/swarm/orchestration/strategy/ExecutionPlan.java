package com.z254.autodev.swarm.orchestration.strategy;

import com.z254.autodev.swarm.domain.model.Agent;
import com.z254.autodev.swarm.domain.model.AgentResult;
import com.z254.autodev.swarm.domain.model.SwarmTask;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Agents assigned to a task in selection order, plus the results finished so far.
 */
public class ExecutionPlan {

    @Getter
    private final SwarmTask task;

    @Getter
    private final List<Agent> agents;

    private final List<AgentResult> completed = new ArrayList<>();

    public ExecutionPlan(SwarmTask task, List<Agent> agents) {
        this.task = task;
        this.agents = List.copyOf(agents);
    }

    public synchronized void recordResult(AgentResult result) {
        completed.add(result);
    }

    /**
     * Results finished so far, ordered by step.
     */
    public synchronized List<AgentResult> completedResults() {
        List<AgentResult> snapshot = new ArrayList<>(completed);
        snapshot.sort(Comparator.comparingInt(AgentResult::getStep));
        return snapshot;
    }
}
