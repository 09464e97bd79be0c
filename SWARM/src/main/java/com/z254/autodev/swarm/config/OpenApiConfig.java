package com.z254.autodev.swarm.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the SWARM service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI swarmOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SWARM API")
                        .description("""
                                SWARM - adaptive multi-agent task orchestration.

                                ## Features
                                - **Swarms**: typed agents grouped by topology and strategy
                                - **Orchestration**: capability-scored agent selection with parallel or sequential execution
                                - **Resilient invocation**: provider ranking, caching, deduplication and circuit breaking
                                - **Coordination memory**: shared key/value store with TTLs
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
