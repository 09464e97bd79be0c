package com.z254.autodev.swarm.llm.routing;

import com.z254.autodev.swarm.domain.model.ModelCapabilities;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores and ranks providers for a requirement vector. Pure functions only.
 */
public final class ProviderSelector {

    static final double PRIORITY_WEIGHT = 0.3;
    static final double BASE_WEIGHT = 0.1;

    private ProviderSelector() {
    }

    /**
     * {@code requirements . capabilities + speed * speedWeight + cost * costWeight}.
     */
    public static double score(ModelCapabilities model, RequirementVector requirements, InvocationConstraints constraints) {
        double speedWeight = constraints.isPrioritizeSpeed() ? PRIORITY_WEIGHT : BASE_WEIGHT;
        double costWeight = constraints.isOptimizeCost() ? PRIORITY_WEIGHT : BASE_WEIGHT;
        double performance = requirements.getReasoning() * model.getReasoning()
                + requirements.getCoding() * model.getCoding()
                + requirements.getAnalysis() * model.getAnalysis()
                + requirements.getCreativity() * model.getCreativity();
        return performance + model.getSpeed() * speedWeight + model.getCost() * costWeight;
    }

    public static boolean isEligible(ModelCapabilities model, InvocationConstraints constraints) {
        if (constraints.getExcludeProviders() != null && constraints.getExcludeProviders().contains(model.getProvider())) {
            return false;
        }
        if (constraints.getMaxCost() != null && model.getCost() > constraints.getMaxCost()) {
            return false;
        }
        return constraints.getMinSpeed() == null || model.getSpeed() >= constraints.getMinSpeed();
    }

    /**
     * Eligible providers ordered by descending score. Equal scores keep table order.
     *
     * @return provider ids, empty when every provider is filtered out
     */
    public static List<String> rank(List<ModelCapabilities> models, RequirementVector requirements,
                                    InvocationConstraints constraints) {
        List<ScoredProvider> scored = new ArrayList<>();
        for (ModelCapabilities model : models) {
            if (isEligible(model, constraints)) {
                scored.add(new ScoredProvider(model.getProvider(), score(model, requirements, constraints)));
            }
        }
        // List.sort is stable
        scored.sort(Comparator.comparingDouble(ScoredProvider::score).reversed());
        List<String> ranked = new ArrayList<>(scored.size());
        for (ScoredProvider provider : scored) {
            ranked.add(provider.provider());
        }
        return ranked;
    }

    private record ScoredProvider(String provider, double score) {
    }
}
