package com.z254.autodev.swarm.llm.routing;

import com.z254.autodev.swarm.domain.model.ComplexityVector;

import java.util.List;
import java.util.Locale;

/**
 * Derives a requirement vector from a task description and its complexity.
 * Each axis is the mean of a keyword hit ratio and the matching complexity component.
 */
public final class TaskRequirementAnalyzer {

    static final List<String> REASONING_TERMS = List.of("analyze", "logic", "reason", "deduce", "infer", "conclude");
    static final List<String> CODING_TERMS = List.of("code", "implement", "program", "debug", "refactor", "optimize");
    static final List<String> ANALYSIS_TERMS = List.of("review", "examine", "assess", "evaluate", "study", "investigate");
    static final List<String> CREATIVITY_TERMS = List.of("design", "create", "generate", "invent", "brainstorm", "imagine");

    private TaskRequirementAnalyzer() {
    }

    public static RequirementVector analyze(String description, ComplexityVector complexity) {
        String text = description != null ? description.toLowerCase(Locale.ROOT) : "";
        return new RequirementVector(
                (hitRatio(text, REASONING_TERMS) + complexity.getLogical()) / 2.0,
                (hitRatio(text, CODING_TERMS) + complexity.getComputational()) / 2.0,
                (hitRatio(text, ANALYSIS_TERMS) + complexity.getDomainSpecific()) / 2.0,
                (hitRatio(text, CREATIVITY_TERMS) + complexity.getCreative()) / 2.0);
    }

    static double hitRatio(String text, List<String> terms) {
        long hits = terms.stream().filter(text::contains).count();
        return (double) hits / terms.size();
    }
}
