package com.z254.autodev.swarm.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Qualitative scores (0 - 10) of an upstream model provider.
 * A higher {@code cost} score means a cheaper provider.
 */
@Value
@Builder
public class ModelCapabilities {
    String provider;
    double reasoning;
    double coding;
    double analysis;
    double creativity;
    double speed;
    double cost;
}
