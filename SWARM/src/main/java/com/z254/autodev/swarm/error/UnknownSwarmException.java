package com.z254.autodev.swarm.error;

import lombok.Getter;

@Getter
public class UnknownSwarmException extends SwarmException {

    private final String swarmId;

    public UnknownSwarmException(String swarmId) {
        super("UNKNOWN_SWARM", "Swarm not found: " + swarmId);
        this.swarmId = swarmId;
    }

    @Override
    public boolean isConfigurationError() {
        return true;
    }
}
