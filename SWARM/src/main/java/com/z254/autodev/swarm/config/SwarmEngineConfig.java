package com.z254.autodev.swarm.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans for the engine.
 */
@Configuration
public class SwarmEngineConfig {

    /**
     * Clock used for TTLs, breaker cool-downs, deadlines and latency measurement.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock swarmClock() {
        return Clock.systemUTC();
    }
}
