package com.z254.autodev.swarm.error;

import lombok.Getter;

import java.util.List;

/**
 * Every candidate provider has an open circuit breaker or has already failed.
 */
@Getter
public class AllProvidersUnavailableException extends SwarmException {

    private final List<String> providers;

    public AllProvidersUnavailableException(List<String> providers) {
        super("ALL_PROVIDERS_UNAVAILABLE", "No provider available among " + providers);
        this.providers = List.copyOf(providers);
    }
}
