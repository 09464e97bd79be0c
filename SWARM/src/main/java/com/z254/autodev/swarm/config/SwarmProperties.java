package com.z254.autodev.swarm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the SWARM engine.
 */
@Data
@Component
@ConfigurationProperties(prefix = "swarm")
public class SwarmProperties {

    private InvocationProperties invocation = new InvocationProperties();
    private CacheProperties cache = new CacheProperties();
    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
    private OrchestrationProperties orchestration = new OrchestrationProperties();
    private MemoryProperties memory = new MemoryProperties();
    private OpenRouterProperties openrouter = new OpenRouterProperties();

    @Data
    public static class InvocationProperties {
        private String defaultProvider = "anthropic/claude-3.5-sonnet";

        /**
         * Providers tried in order when the selected provider fails.
         */
        private List<String> fallbackProviders = new ArrayList<>();

        private Duration requestTimeout = Duration.ofSeconds(30);
        private int maxConcurrentCallsPerProvider = 10;
        private double defaultTemperature = 0.7;
        private int defaultMaxTokens = 4000;

        /**
         * Default provider per agent type. Agent types without an entry are routed by capability scoring.
         */
        private Map<String, String> agentProviders = new LinkedHashMap<>();
    }

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private Duration baseTtl = Duration.ofMinutes(5);
        private int maxEntries = 500;
        private Duration sweepInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class CircuitBreakerProperties {
        private int failureThreshold = 3;
        private Duration coolDown = Duration.ofSeconds(60);
    }

    @Data
    public static class OrchestrationProperties {
        /**
         * Mean complexity above which adaptive execution becomes sequential.
         */
        private double adaptiveThreshold = 0.7;
        private int defaultMaxAgents = 3;
        private Duration taskTimeout = Duration.ofMinutes(5);
        private int maxSwarms = 32;
        private int maxAgentsPerSwarm = 12;
        private int discussionRounds = 3;
    }

    @Data
    public static class MemoryProperties {
        private int maxEntries = 10000;
        private Duration defaultTtl = Duration.ofHours(24);
    }

    @Data
    public static class OpenRouterProperties {
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKey;
        private String referer = "https://autodev-ai.github.io";
        private String title = "AutoDev-AI Swarm";
    }
}
