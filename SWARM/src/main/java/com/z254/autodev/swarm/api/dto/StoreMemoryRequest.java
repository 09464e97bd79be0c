package com.z254.autodev.swarm.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for writing a coordination memory entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreMemoryRequest {

    @NotBlank(message = "Key is required")
    private String key;

    private Object value;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Positive
    private Long ttlSeconds;
}
