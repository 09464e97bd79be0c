package com.z254.autodev.swarm.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits machine-parseable JSON event lines for swarm, task and provider lifecycle events.
 */
@Component
@Slf4j
public class StructuredLogger {

    public static final String MDC_TASK_ID = "taskId";
    public static final String MDC_SWARM_ID = "swarmId";
    public static final String MDC_AGENT_ID = "agentId";
    public static final String MDC_PROVIDER_ID = "providerId";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StructuredLogger(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void logSwarmCreated(String swarmId, String topology, int maxAgents, String strategy) {
        withContext(null, swarmId, null, null, () -> logEvent("swarm_created", Map.of(
                "swarmId", swarmId,
                "topology", topology,
                "maxAgents", maxAgents,
                "strategy", strategy)));
    }

    public void logAgentSpawned(String swarmId, String agentId, String agentType) {
        withContext(null, swarmId, agentId, null, () -> logEvent("agent_spawned", Map.of(
                "swarmId", swarmId,
                "agentId", agentId,
                "agentType", agentType)));
    }

    public void logSwarmClosed(String swarmId) {
        withContext(null, swarmId, null, null, () -> logEvent("swarm_closed", Map.of("swarmId", swarmId)));
    }

    public void logTaskStarted(String taskId, String swarmId, String strategy, int agentCount) {
        withContext(taskId, swarmId, null, null, () -> logEvent("task_started", Map.of(
                "taskId", taskId,
                "swarmId", swarmId,
                "strategy", strategy,
                "agents", agentCount)));
    }

    public void logTaskCompleted(String taskId, String swarmId, long durationMs, int resultCount) {
        withContext(taskId, swarmId, null, null, () -> logEvent("task_completed", Map.of(
                "taskId", taskId,
                "durationMs", durationMs,
                "results", resultCount)));
    }

    public void logTaskFailed(String taskId, String swarmId, String errorCode, String errorMessage, int partialResults) {
        withContext(taskId, swarmId, null, null, () -> logEvent("task_failed", Map.of(
                "taskId", taskId,
                "errorCode", errorCode,
                "errorMessage", errorMessage != null ? errorMessage : "Unknown error",
                "partialResults", partialResults)));
    }

    public void logProviderCall(String providerId, long durationMs, int tokens, boolean success) {
        withContext(null, null, null, providerId, () -> logEvent("provider_call", Map.of(
                "providerId", providerId,
                "durationMs", durationMs,
                "tokens", tokens,
                "success", success)));
    }

    public void logFallback(String fromProvider, String toProvider, String reason) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("from", fromProvider);
        data.put("to", toProvider);
        if (reason != null) {
            data.put("reason", reason);
        }
        withContext(null, null, null, fromProvider, () -> logEvent("provider_fallback", data));
    }

    private void withContext(String taskId, String swarmId, String agentId, String providerId, Runnable action) {
        putIfPresent(MDC_TASK_ID, taskId);
        putIfPresent(MDC_SWARM_ID, swarmId);
        putIfPresent(MDC_AGENT_ID, agentId);
        putIfPresent(MDC_PROVIDER_ID, providerId);
        try {
            action.run();
        } finally {
            MDC.remove(MDC_TASK_ID);
            MDC.remove(MDC_SWARM_ID);
            MDC.remove(MDC_AGENT_ID);
            MDC.remove(MDC_PROVIDER_ID);
        }
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", eventType);
        event.put("timestamp", clock.instant().toString());
        event.put("service", "swarm");
        event.putAll(data);

        try {
            log.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
