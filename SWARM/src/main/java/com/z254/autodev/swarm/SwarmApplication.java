package com.z254.autodev.swarm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SWARM - adaptive multi-agent task orchestration engine.
 *
 * <p>SWARM provides:
 * <ul>
 *   <li>Swarm Manager - swarms of typed agents with topology, strategy and capacity</li>
 *   <li>Task Orchestrator - capability-scored agent selection and parallel/sequential execution</li>
 *   <li>Resilient Invocation Client - provider ranking, response caching, request deduplication,
 *       per-provider circuit breaking and fallback chains</li>
 *   <li>Metrics Collector - latency, success and cache statistics per provider and agent</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class SwarmApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwarmApplication.class, args);
    }
}
