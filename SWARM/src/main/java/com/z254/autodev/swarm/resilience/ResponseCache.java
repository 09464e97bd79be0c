package com.z254.autodev.swarm.resilience;

import com.z254.autodev.swarm.config.SwarmProperties;
import com.z254.autodev.swarm.llm.CompletionResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded response cache with per-entry TTL.
 * <p>
 * Expired entries are removed lazily on read and by a periodic sweep.
 * When the bound is exceeded the oldest inserted entries are evicted first.
 * Only normally completed responses are stored.
 */
@Slf4j
@Component
public class ResponseCache {

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Queue<InsertionMark> insertionOrder = new ConcurrentLinkedQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final SwarmProperties.CacheProperties config;
    private final Clock clock;

    public ResponseCache(SwarmProperties properties, Clock clock) {
        this.config = properties.getCache();
        this.clock = clock;
        log.info("Initialized response cache: baseTtl={}, maxEntries={}", config.getBaseTtl(), config.getMaxEntries());
    }

    /**
     * TTL for a response: doubled for normal completions, halved for truncated ones.
     */
    public static Duration ttlFor(CompletionResponse.FinishReason finishReason, Duration baseTtl) {
        if (finishReason == CompletionResponse.FinishReason.STOP) {
            return baseTtl.multipliedBy(2);
        }
        if (finishReason == CompletionResponse.FinishReason.LENGTH) {
            return baseTtl.dividedBy(2);
        }
        return baseTtl;
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public Optional<CompletionResponse> get(String key) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }
        entry.recordHit();
        hits.incrementAndGet();
        log.debug("Cache hit for key {} ({} hits)", key, entry.getHits());
        return Optional.of(entry.getResponse());
    }

    /**
     * Store a response under the TTL derived from its finish reason.
     *
     * @param baseTtl base TTL, or null for the configured default
     * @return false when the response was not cacheable
     */
    public boolean put(String key, CompletionResponse response, Duration baseTtl) {
        if (!config.isEnabled() || response == null || !response.isNormalCompletion()) {
            return false;
        }
        Duration ttl = ttlFor(response.getFinishReason(), baseTtl != null ? baseTtl : config.getBaseTtl());
        long seq = sequence.incrementAndGet();
        entries.put(key, new CacheEntry(key, response, clock.instant(), ttl, seq));
        insertionOrder.add(new InsertionMark(key, seq));
        evictOverflow();
        return true;
    }

    public void invalidate(String key) {
        entries.remove(key);
    }

    public void clear() {
        entries.clear();
        insertionOrder.clear();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Periodic removal of expired entries.
     */
    @Scheduled(fixedDelayString = "#{@swarmProperties.cache.sweepInterval.toMillis()}")
    public void sweepExpired() {
        removeExpired();
    }

    /**
     * @return number of expired entries removed
     */
    public int removeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (CacheEntry entry : entries.values()) {
            if (entry.isExpired(now) && entries.remove(entry.getKey(), entry)) {
                removed++;
            }
        }
        insertionOrder.removeIf(mark -> !isCurrent(mark));
        if (removed > 0) {
            log.debug("Cache sweep removed {} expired entries, {} remaining", removed, entries.size());
        }
        return removed;
    }

    public CacheStats stats() {
        long hitCount = hits.get();
        long missCount = misses.get();
        long total = hitCount + missCount;
        return CacheStats.builder()
                .size(entries.size())
                .maxEntries(config.getMaxEntries())
                .hits(hitCount)
                .misses(missCount)
                .evictions(evictions.get())
                .hitRate(total == 0 ? 0.0 : (double) hitCount / total)
                .build();
    }

    private void evictOverflow() {
        while (entries.size() > config.getMaxEntries()) {
            InsertionMark oldest = insertionOrder.poll();
            if (oldest == null) {
                return;
            }
            CacheEntry entry = entries.get(oldest.key());
            if (entry != null && entry.getSequence() == oldest.sequence() && entries.remove(oldest.key(), entry)) {
                evictions.incrementAndGet();
            }
        }
    }

    private boolean isCurrent(InsertionMark mark) {
        CacheEntry entry = entries.get(mark.key());
        return entry != null && entry.getSequence() == mark.sequence();
    }

    private record InsertionMark(String key, long sequence) {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CacheStats {
        private int size;
        private int maxEntries;
        private long hits;
        private long misses;
        private long evictions;
        private double hitRate;
    }
}
