package com.z254.autodev.swarm.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Terminal outcome of a task: either the full result list or a failure cause
 * together with whatever results finished before the failure.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TaskOutcome {

    public enum Kind {
        COMPLETED,
        FAILED
    }

    private final Kind kind;
    private final List<AgentResult> results;
    private final String errorType;
    private final String errorMessage;

    /**
     * Failure that produced the outcome. Not part of the task record.
     */
    @ToString.Exclude
    private final Throwable cause;

    public static TaskOutcome completed(List<AgentResult> results) {
        return new TaskOutcome(Kind.COMPLETED, List.copyOf(results), null, null, null);
    }

    public static TaskOutcome failed(String errorType, String errorMessage, List<AgentResult> partialResults,
                                     Throwable cause) {
        return new TaskOutcome(Kind.FAILED, List.copyOf(partialResults), errorType, errorMessage, cause);
    }

    public boolean isCompleted() {
        return kind == Kind.COMPLETED;
    }
}
