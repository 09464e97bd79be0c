package com.z254.autodev.swarm.resilience;

import com.z254.autodev.swarm.llm.CompletionResponse;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A cached provider response. Never served past {@code insertedAt + ttl}.
 */
@Getter
public class CacheEntry {

    private final String key;
    private final CompletionResponse response;
    private final Instant insertedAt;
    private final Duration ttl;
    private final long sequence;
    private final AtomicLong hits = new AtomicLong();

    public CacheEntry(String key, CompletionResponse response, Instant insertedAt, Duration ttl, long sequence) {
        this.key = key;
        this.response = response;
        this.insertedAt = insertedAt;
        this.ttl = ttl;
        this.sequence = sequence;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(insertedAt.plus(ttl));
    }

    public long recordHit() {
        return hits.incrementAndGet();
    }

    public long getHits() {
        return hits.get();
    }
}
