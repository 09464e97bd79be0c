package com.z254.autodev.swarm.metrics;

import com.z254.autodev.swarm.memory.CoordinationMemory;
import com.z254.autodev.swarm.resilience.CircuitBreakerSnapshot;
import com.z254.autodev.swarm.resilience.ResponseCache;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only diagnostic snapshot of the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceReport {

    private ResponseCache.CacheStats cache;
    private Map<String, CircuitBreakerSnapshot> circuitBreakers;
    private Performance performance;
    private int inFlightRequests;
    private CoordinationMemory.MemoryState memory;
    private Instant generatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Performance {
        private Map<String, OperationStats.View> providers;
        private Map<String, OperationStats.View> agents;
    }
}
