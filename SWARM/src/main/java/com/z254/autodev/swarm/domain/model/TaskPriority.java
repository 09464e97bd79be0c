package com.z254.autodev.swarm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Priority of a task: level, optional deadline and the ids of tasks it depends on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPriority {

    @Builder.Default
    private PriorityLevel level = PriorityLevel.MEDIUM;

    /**
     * Optional point in time after which the task is failed with a timeout.
     */
    private Instant deadline;

    /**
     * Tasks that must have completed before this one runs.
     */
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    public static TaskPriority of(PriorityLevel level) {
        return TaskPriority.builder().level(level).build();
    }

    public TaskPriority copy() {
        return TaskPriority.builder()
                .level(level)
                .deadline(deadline)
                .dependencies(dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>())
                .build();
    }
}
