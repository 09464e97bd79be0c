package com.z254.autodev.swarm.error;

import lombok.Getter;

/**
 * The upstream provider returned an error or could not be reached.
 */
@Getter
public class ProviderErrorException extends SwarmException {

    private final String provider;

    /**
     * False when the call never reached the provider, e.g. local concurrency saturation.
     * Such errors are eligible for fallback but do not trip the circuit breaker.
     */
    private final boolean breakerFailure;

    public ProviderErrorException(String provider, String message) {
        this(provider, message, true, null);
    }

    public ProviderErrorException(String provider, String message, Throwable cause) {
        this(provider, message, true, cause);
    }

    public ProviderErrorException(String provider, String message, boolean breakerFailure, Throwable cause) {
        super("PROVIDER_ERROR", "Provider " + provider + " failed: " + message, cause);
        this.provider = provider;
        this.breakerFailure = breakerFailure;
    }
}
