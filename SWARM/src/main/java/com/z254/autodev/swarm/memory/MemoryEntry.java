package com.z254.autodev.swarm.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A value shared between agents and swarms through coordination memory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryEntry {

    private String key;
    private Object value;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private Instant storedAt;
    private Duration ttl;

    public Instant getExpiresAt() {
        return storedAt != null && ttl != null ? storedAt.plus(ttl) : null;
    }
}
