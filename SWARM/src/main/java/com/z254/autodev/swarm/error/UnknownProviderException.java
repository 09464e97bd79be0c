package com.z254.autodev.swarm.error;

import lombok.Getter;

/**
 * A provider id that is not present in the model capability table.
 */
@Getter
public class UnknownProviderException extends SwarmException {

    private final String provider;

    public UnknownProviderException(String provider) {
        super("UNKNOWN_PROVIDER", "Unknown provider: " + provider);
        this.provider = provider;
    }

    @Override
    public boolean isConfigurationError() {
        return true;
    }
}
