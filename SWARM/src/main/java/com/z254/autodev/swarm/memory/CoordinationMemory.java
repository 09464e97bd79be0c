package com.z254.autodev.swarm.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.z254.autodev.swarm.config.SwarmProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Bounded key-value store shared by swarms for coordination state.
 * Each entry expires after its own TTL.
 */
@Slf4j
@Component
public class CoordinationMemory {

    private final Cache<String, MemoryEntry> entries;
    private final SwarmProperties.MemoryProperties config;
    private final Clock clock;

    public CoordinationMemory(SwarmProperties properties, Clock clock) {
        this.config = properties.getMemory();
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(config.getMaxEntries())
                .expireAfter(new EntryExpiry())
                .ticker(() -> toNanos(clock))
                .executor(Runnable::run)
                .recordStats()
                .build();
        log.info("Initialized coordination memory: maxEntries={}, defaultTtl={}",
                config.getMaxEntries(), config.getDefaultTtl());
    }

    /**
     * Store a value.
     *
     * @param ttl time to live, or null for the configured default
     */
    public MemoryEntry store(String key, Object value, List<String> tags, Duration ttl) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Memory key must not be blank");
        }
        Duration effectiveTtl = ttl != null && !ttl.isNegative() && !ttl.isZero() ? ttl : config.getDefaultTtl();
        MemoryEntry entry = MemoryEntry.builder()
                .key(key)
                .value(value)
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .storedAt(clock.instant())
                .ttl(effectiveTtl)
                .build();
        entries.put(key, entry);
        log.debug("Stored memory entry {} (ttl={})", key, effectiveTtl);
        return entry;
    }

    public MemoryEntry store(String key, Object value) {
        return store(key, value, null, null);
    }

    public Optional<MemoryEntry> retrieve(String key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    public List<String> listKeys() {
        return new ArrayList<>(new TreeSet<>(entries.asMap().keySet()));
    }

    public boolean delete(String key) {
        return entries.asMap().remove(key) != null;
    }

    public MemoryState state() {
        entries.cleanUp();
        return MemoryState.builder()
                .entries(entries.estimatedSize())
                .maxEntries(config.getMaxEntries())
                .hitRate(entries.stats().hitRate())
                .evictions(entries.stats().evictionCount())
                .build();
    }

    private static long toNanos(Clock clock) {
        return clock.millis() * 1_000_000L;
    }

    private static final class EntryExpiry implements Expiry<String, MemoryEntry> {

        @Override
        public long expireAfterCreate(String key, MemoryEntry entry, long currentTime) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, MemoryEntry entry, long currentTime, long currentDuration) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, MemoryEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemoryState {
        private long entries;
        private int maxEntries;
        private double hitRate;
        private long evictions;
    }
}
