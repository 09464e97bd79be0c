package com.z254.autodev.swarm.error;

import lombok.Getter;

@Getter
public class TaskNotFoundException extends SwarmException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("TASK_NOT_FOUND", "Task not found: " + taskId);
        this.taskId = taskId;
    }

    @Override
    public boolean isConfigurationError() {
        return true;
    }
}
