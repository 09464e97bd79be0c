package com.z254.autodev.swarm.orchestration;

import com.z254.autodev.swarm.domain.model.Agent;
import com.z254.autodev.swarm.domain.model.ComplexityVector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Capability-based agent scoring. Pure functions only.
 */
public final class AgentSelector {

    static final double TAG_MATCH_SCORE = 2.0;
    static final double COORDINATION_WEIGHT = 0.3;

    private AgentSelector() {
    }

    /**
     * {@code 2.0 per specialization tag found in the description
     * + complexityHandling * mean(complexity) + coordinationLevel * 0.3}.
     * A tag matches when the lower-cased description contains it with underscores read as spaces.
     */
    public static double score(Agent agent, String description, ComplexityVector complexity) {
        String text = description != null ? description.toLowerCase(Locale.ROOT) : "";
        double score = 0.0;
        for (String tag : agent.getSpecializationTags()) {
            if (text.contains(tag.toLowerCase(Locale.ROOT).replace('_', ' '))) {
                score += TAG_MATCH_SCORE;
            }
        }
        score += agent.getComplexityHandling() * complexity.mean();
        score += agent.getCoordinationLevel() * COORDINATION_WEIGHT;
        return score;
    }

    /**
     * Highest scoring candidates, at most {@code maxAgents}. Candidates must be given in
     * registration order; equal scores keep that order.
     */
    public static List<Agent> select(List<Agent> candidates, String description, ComplexityVector complexity,
                                     int maxAgents) {
        List<ScoredAgent> scored = new ArrayList<>(candidates.size());
        for (Agent agent : candidates) {
            scored.add(new ScoredAgent(agent, score(agent, description, complexity)));
        }
        // List.sort is stable
        scored.sort(Comparator.comparingDouble(ScoredAgent::score).reversed());
        List<Agent> selected = new ArrayList<>();
        for (ScoredAgent candidate : scored) {
            if (selected.size() >= maxAgents) {
                break;
            }
            selected.add(candidate.agent());
        }
        return selected;
    }

    private record ScoredAgent(Agent agent, double score) {
    }
}
