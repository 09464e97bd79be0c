package com.z254.autodev.swarm.llm.routing;

import lombok.Value;

/**
 * Demands of a task along the four provider capability axes, each in [0, 1].
 */
@Value
public class RequirementVector {
    double reasoning;
    double coding;
    double analysis;
    double creativity;
}
