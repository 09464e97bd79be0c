package com.z254.autodev.swarm.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for a multi-round team discussion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscussionRequest {

    @NotBlank(message = "Topic is required")
    private String topic;

    @NotEmpty(message = "At least one participant is required")
    private List<@NotBlank String> participants;

    @Min(1)
    @Max(10)
    private Integer rounds;
}
