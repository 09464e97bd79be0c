package com.z254.autodev.swarm.error;

/**
 * Delivered to deduplication waiters when the call they joined was cancelled.
 */
public class InvocationCancelledException extends SwarmException {

    public InvocationCancelledException(String message) {
        super("CANCELLED", message);
    }
}
