package com.z254.autodev.swarm.error;

import com.z254.autodev.swarm.domain.model.AgentResult;
import lombok.Getter;

import java.util.List;

/**
 * A task failed. Wraps the first sub-failure and carries the results that finished before it.
 */
@Getter
public class TaskExecutionFailedException extends SwarmException {

    private final String taskId;
    private final List<AgentResult> partialResults;

    public TaskExecutionFailedException(String taskId, String message) {
        this(taskId, message, null, List.of());
    }

    public TaskExecutionFailedException(String taskId, String message, Throwable cause, List<AgentResult> partialResults) {
        super("TASK_EXECUTION_FAILED", "Task " + taskId + " failed: " + message, cause);
        this.taskId = taskId;
        this.partialResults = List.copyOf(partialResults);
    }
}
