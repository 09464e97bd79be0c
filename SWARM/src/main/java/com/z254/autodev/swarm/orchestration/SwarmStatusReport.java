package com.z254.autodev.swarm.orchestration;

import com.z254.autodev.swarm.domain.model.Swarm;
import com.z254.autodev.swarm.domain.model.SwarmTask;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Swarm snapshot together with the tasks submitted against it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwarmStatusReport {

    private Swarm swarm;

    @Builder.Default
    private List<SwarmTask> tasks = new ArrayList<>();
}
