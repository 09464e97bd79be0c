package com.z254.autodev.swarm.domain.repository.impl;

import com.z254.autodev.swarm.domain.model.SwarmTask;
import com.z254.autodev.swarm.domain.model.TaskStatus;
import com.z254.autodev.swarm.domain.repository.TaskRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TaskRepository. Tasks live for the lifetime of the process.
 */
@Repository
public class InMemoryTaskRepository implements TaskRepository {

    private final Map<String, SwarmTask> tasks = new ConcurrentHashMap<>();

    @Override
    public Mono<SwarmTask> save(SwarmTask task) {
        if (task.getId() == null) {
            task.setId("task_" + UUID.randomUUID());
        }
        tasks.put(task.getId(), task);
        return Mono.just(task);
    }

    @Override
    public Mono<SwarmTask> findById(String taskId) {
        return Mono.justOrEmpty(taskId != null ? tasks.get(taskId) : null);
    }

    @Override
    public Flux<SwarmTask> findBySwarmId(String swarmId) {
        return Flux.fromIterable(tasks.values())
                .filter(task -> swarmId.equals(task.getSwarmId()))
                .sort(Comparator.comparing(SwarmTask::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())));
    }

    @Override
    public Flux<SwarmTask> findByStatus(TaskStatus status) {
        return Flux.fromIterable(tasks.values())
                .filter(task -> status == task.getStatus());
    }

    @Override
    public Flux<SwarmTask> findAll() {
        return Flux.fromIterable(tasks.values());
    }

    @Override
    public Mono<Long> count() {
        return Mono.just((long) tasks.size());
    }
}
