package com.z254.autodev.swarm.metrics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Accumulated statistics of one provider or agent.
 */
public class OperationStats {

    private long count;
    private long successes;
    private long failures;
    private long totalLatencyMs;
    private long minLatencyMs = Long.MAX_VALUE;
    private long maxLatencyMs;
    private long cacheHits;
    private long cacheMisses;

    public synchronized void record(long latencyMs, boolean success) {
        count++;
        if (success) {
            successes++;
        } else {
            failures++;
        }
        totalLatencyMs += latencyMs;
        minLatencyMs = Math.min(minLatencyMs, latencyMs);
        maxLatencyMs = Math.max(maxLatencyMs, latencyMs);
    }

    public synchronized void recordCacheHit() {
        cacheHits++;
    }

    public synchronized void recordCacheMiss() {
        cacheMisses++;
    }

    public synchronized View view() {
        long lookups = cacheHits + cacheMisses;
        return View.builder()
                .count(count)
                .successes(successes)
                .failures(failures)
                .successRate(count == 0 ? 0.0 : (double) successes / count)
                .averageLatencyMs(count == 0 ? 0.0 : (double) totalLatencyMs / count)
                .minLatencyMs(count == 0 ? 0 : minLatencyMs)
                .maxLatencyMs(maxLatencyMs)
                .totalLatencyMs(totalLatencyMs)
                .cacheHits(cacheHits)
                .cacheHitRate(lookups == 0 ? 0.0 : (double) cacheHits / lookups)
                .build();
    }

    /**
     * Read-only view of the statistics.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class View {
        private long count;
        private long successes;
        private long failures;
        private double successRate;
        private double averageLatencyMs;
        private long minLatencyMs;
        private long maxLatencyMs;
        private long totalLatencyMs;
        private long cacheHits;
        private double cacheHitRate;
    }
}
