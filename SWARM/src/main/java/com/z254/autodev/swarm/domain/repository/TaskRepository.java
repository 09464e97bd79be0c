package com.z254.autodev.swarm.domain.repository;

import com.z254.autodev.swarm.domain.model.SwarmTask;
import com.z254.autodev.swarm.domain.model.TaskStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository interface for orchestrated tasks.
 */
public interface TaskRepository {

    /**
     * Save a task.
     */
    Mono<SwarmTask> save(SwarmTask task);

    /**
     * Find a task by ID.
     */
    Mono<SwarmTask> findById(String taskId);

    /**
     * Find tasks submitted against a swarm, in submission order.
     */
    Flux<SwarmTask> findBySwarmId(String swarmId);

    /**
     * Find tasks by status.
     */
    Flux<SwarmTask> findByStatus(TaskStatus status);

    Flux<SwarmTask> findAll();

    Mono<Long> count();
}
