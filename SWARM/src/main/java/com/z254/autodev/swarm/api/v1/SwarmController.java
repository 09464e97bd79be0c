package com.z254.autodev.swarm.api.v1;

import com.z254.autodev.swarm.api.dto.CreateSwarmRequest;
import com.z254.autodev.swarm.api.dto.OrchestrateTaskRequest;
import com.z254.autodev.swarm.api.dto.SpawnAgentRequest;
import com.z254.autodev.swarm.domain.model.Swarm;
import com.z254.autodev.swarm.domain.model.SwarmTask;
import com.z254.autodev.swarm.orchestration.SwarmEngine;
import com.z254.autodev.swarm.orchestration.SwarmStatusReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST controller for swarm lifecycle, agent spawning and task orchestration.
 */
@RestController
@RequestMapping("/api/v1/swarms")
@Tag(name = "Swarms", description = "Swarm lifecycle and task orchestration")
@Slf4j
public class SwarmController {

    private final SwarmEngine engine;

    public SwarmController(SwarmEngine engine) {
        this.engine = engine;
    }

    // --------------------------------------------------------------------------------------------
    // Swarm Lifecycle
    // --------------------------------------------------------------------------------------------

    @PostMapping
    @Operation(summary = "Create swarm", description = "Create a swarm with a topology, capacity and strategy")
    @ApiResponse(responseCode = "201", description = "Swarm created")
    @ApiResponse(responseCode = "400", description = "Invalid swarm configuration")
    @ApiResponse(responseCode = "409", description = "Swarm limit reached")
    public Mono<ResponseEntity<Map<String, String>>> createSwarm(@Valid @RequestBody CreateSwarmRequest request) {
        log.info("Creating {} swarm with {} agents", request.getTopology(), request.getMaxAgents());

        return engine.createSwarm(request.getTopology(), request.getMaxAgents(), request.getStrategy())
                .map(id -> ResponseEntity.status(HttpStatus.CREATED).body(Map.of("swarmId", id)));
    }

    @GetMapping
    @Operation(summary = "List swarms", description = "List all open swarms")
    @ApiResponse(responseCode = "200", description = "Swarms retrieved")
    public Flux<Swarm> listSwarms() {
        return engine.listSwarms();
    }

    @GetMapping("/{swarmId}")
    @Operation(summary = "Get swarm status", description = "Swarm snapshot including agents, metrics and tasks")
    @ApiResponse(responseCode = "200", description = "Swarm found")
    @ApiResponse(responseCode = "404", description = "Swarm not found")
    public Mono<ResponseEntity<SwarmStatusReport>> getSwarmStatus(
            @Parameter(description = "Swarm ID") @PathVariable String swarmId) {

        return engine.getSwarmStatus(swarmId)
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{swarmId}")
    @Operation(summary = "Tear down swarm", description = "Drain the swarm and close it once its agents are idle")
    @ApiResponse(responseCode = "200", description = "Swarm draining or closed")
    @ApiResponse(responseCode = "404", description = "Swarm not found")
    public Mono<ResponseEntity<Swarm>> teardownSwarm(
            @Parameter(description = "Swarm ID") @PathVariable String swarmId) {

        log.info("Tearing down swarm: {}", swarmId);

        return engine.teardownSwarm(swarmId)
                .map(ResponseEntity::ok);
    }

    // --------------------------------------------------------------------------------------------
    // Agents
    // --------------------------------------------------------------------------------------------

    @PostMapping("/{swarmId}/agents")
    @Operation(summary = "Spawn agent", description = "Spawn an agent of a registered type into the swarm")
    @ApiResponse(responseCode = "201", description = "Agent spawned")
    @ApiResponse(responseCode = "404", description = "Swarm or agent type not found")
    @ApiResponse(responseCode = "409", description = "Swarm is full or not active")
    public Mono<ResponseEntity<Map<String, String>>> spawnAgent(
            @Parameter(description = "Swarm ID") @PathVariable String swarmId,
            @Valid @RequestBody SpawnAgentRequest request) {

        return engine.spawnAgent(swarmId, request.getAgentType(), request.toOverrides())
                .map(id -> ResponseEntity.status(HttpStatus.CREATED).body(Map.of("agentId", id)));
    }

    // --------------------------------------------------------------------------------------------
    // Tasks
    // --------------------------------------------------------------------------------------------

    @PostMapping("/{swarmId}/tasks")
    @Operation(summary = "Orchestrate task",
            description = "Run a task across the swarm and return it once it has completed or failed")
    @ApiResponse(responseCode = "200", description = "Task finished, see its status")
    @ApiResponse(responseCode = "400", description = "Invalid task")
    @ApiResponse(responseCode = "404", description = "Swarm not found")
    @ApiResponse(responseCode = "409", description = "Swarm is not accepting work")
    public Mono<ResponseEntity<SwarmTask>> orchestrate(
            @Parameter(description = "Swarm ID") @PathVariable String swarmId,
            @Valid @RequestBody OrchestrateTaskRequest request) {

        log.info("Orchestrating task on swarm {}", swarmId);

        return engine.orchestrate(request.toRequest(swarmId))
                .flatMap(engine::getTaskStatus)
                .map(ResponseEntity::ok);
    }
}
