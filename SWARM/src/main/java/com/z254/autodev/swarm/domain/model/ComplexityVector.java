package com.z254.autodev.swarm.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Four-dimensional description of the demands a task places on agents.
 * Every component lies in [0, 1].
 */
@Value
public class ComplexityVector {

    double computational;
    double logical;
    double creative;
    double domainSpecific;

    @Builder
    @Jacksonized
    public ComplexityVector(double computational, double logical, double creative, double domainSpecific) {
        this.computational = requireUnit("computational", computational);
        this.logical = requireUnit("logical", logical);
        this.creative = requireUnit("creative", creative);
        this.domainSpecific = requireUnit("domainSpecific", domainSpecific);
    }

    public static ComplexityVector of(double computational, double logical, double creative, double domainSpecific) {
        return new ComplexityVector(computational, logical, creative, domainSpecific);
    }

    /**
     * Neutral vector used when the caller supplies none.
     */
    public static ComplexityVector neutral() {
        return new ComplexityVector(0.5, 0.5, 0.5, 0.5);
    }

    public double mean() {
        return (computational + logical + creative + domainSpecific) / 4.0;
    }

    private static double requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " complexity must be within [0, 1]: " + value);
        }
        return value;
    }
}
