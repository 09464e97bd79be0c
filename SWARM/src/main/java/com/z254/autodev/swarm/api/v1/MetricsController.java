package com.z254.autodev.swarm.api.v1;

import com.z254.autodev.swarm.metrics.PerformanceReport;
import com.z254.autodev.swarm.orchestration.SwarmEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Metrics", description = "Engine performance diagnostics")
public class MetricsController {

    private final SwarmEngine engine;

    public MetricsController(SwarmEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    @Operation(summary = "Performance report",
            description = "Cache, circuit breaker, provider and agent statistics plus memory state")
    public Mono<PerformanceReport> getPerformanceMetrics() {
        return engine.getPerformanceMetrics();
    }
}
