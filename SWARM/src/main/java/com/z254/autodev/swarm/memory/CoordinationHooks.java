package com.z254.autodev.swarm.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lifecycle hooks around swarm creation, agent spawn and task orchestration.
 * Every hook leaves a record in coordination memory.
 */
@Slf4j
@Component
public class CoordinationHooks {

    public static final String TASK_KEY_PREFIX = "task:";
    public static final String NOTIFICATION_KEY_PREFIX = "notification:";

    private final CoordinationMemory memory;
    private final Clock clock;
    private final AtomicLong notificationSequence = new AtomicLong();

    public CoordinationHooks(CoordinationMemory memory, Clock clock) {
        this.memory = memory;
        this.clock = clock;
    }

    /**
     * Record that work identified by {@code taskId} is starting.
     */
    public void preTask(String taskId, String description) {
        log.debug("Pre-task hook: {} - {}", taskId, description);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("description", description);
        record.put("status", "initiated");
        record.put("startedAt", clock.instant().toString());
        memory.store(TASK_KEY_PREFIX + taskId, record, List.of("hook", "task"), null);
    }

    /**
     * Record that work identified by {@code taskId} has finished with the given status.
     */
    @SuppressWarnings("unchecked")
    public void postTask(String taskId, String status) {
        log.debug("Post-task hook: {} -> {}", taskId, status);
        String key = TASK_KEY_PREFIX + taskId;
        Map<String, Object> record = memory.retrieve(key)
                .filter(entry -> entry.getValue() instanceof Map)
                .map(entry -> new LinkedHashMap<>((Map<String, Object>) entry.getValue()))
                .orElseGet(LinkedHashMap::new);
        record.put("status", status);
        record.put("completedAt", clock.instant().toString());
        memory.store(key, record, List.of("hook", "task"), null);
    }

    public void notify(String message) {
        log.debug("Notification: {}", message);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("message", message);
        record.put("timestamp", clock.instant().toString());
        memory.store(NOTIFICATION_KEY_PREFIX + notificationSequence.incrementAndGet(), record,
                List.of("hook", "notification"), null);
    }
}
