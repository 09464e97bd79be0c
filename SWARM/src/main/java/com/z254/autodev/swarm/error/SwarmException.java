package com.z254.autodev.swarm.error;

import lombok.Getter;

/**
 * Base class of every failure raised by the engine.
 */
@Getter
public abstract class SwarmException extends RuntimeException {

    /**
     * Stable machine-readable error code, e.g. {@code UNKNOWN_SWARM}.
     */
    private final String errorCode;

    protected SwarmException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SwarmException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Configuration errors indicate caller misuse and are never retried or absorbed by fallback.
     */
    public boolean isConfigurationError() {
        return false;
    }
}
