package com.z254.autodev.swarm.error;

import java.time.Duration;

public class InvocationTimeoutException extends SwarmException {

    public InvocationTimeoutException(String what, Duration timeout) {
        super("TIMEOUT", what + " did not complete within " + timeout.toMillis() + "ms");
    }

    public InvocationTimeoutException(String message) {
        super("TIMEOUT", message);
    }
}
