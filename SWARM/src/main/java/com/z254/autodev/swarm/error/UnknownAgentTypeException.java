package com.z254.autodev.swarm.error;

import lombok.Getter;

@Getter
public class UnknownAgentTypeException extends SwarmException {

    private final String agentType;

    public UnknownAgentTypeException(String agentType) {
        super("UNKNOWN_AGENT_TYPE", "Unknown agent type: " + agentType);
        this.agentType = agentType;
    }

    @Override
    public boolean isConfigurationError() {
        return true;
    }
}
