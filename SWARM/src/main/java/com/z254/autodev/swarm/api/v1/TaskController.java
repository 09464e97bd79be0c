package com.z254.autodev.swarm.api.v1;

import com.z254.autodev.swarm.api.dto.DiscussionRequest;
import com.z254.autodev.swarm.domain.model.SwarmTask;
import com.z254.autodev.swarm.orchestration.SwarmEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * REST controller for task status and team discussions.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Tasks", description = "Task status and team discussions")
public class TaskController {

    private final SwarmEngine engine;

    public TaskController(SwarmEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/tasks/{taskId}")
    @Operation(summary = "Get task status")
    @ApiResponse(responseCode = "200", description = "Task found")
    @ApiResponse(responseCode = "404", description = "Task not found")
    public Mono<ResponseEntity<SwarmTask>> getTaskStatus(
            @Parameter(description = "Task ID") @PathVariable String taskId) {
        return engine.getTaskStatus(taskId)
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/discussions", produces = MediaType.TEXT_MARKDOWN_VALUE)
    @Operation(summary = "Run team discussion", description = "Multi-round discussion returned as a Markdown transcript")
    @ApiResponse(responseCode = "200", description = "Transcript")
    @ApiResponse(responseCode = "400", description = "Invalid discussion request")
    public Mono<ResponseEntity<String>> discuss(@Valid @RequestBody DiscussionRequest request) {
        return engine.discuss(request.getTopic(), request.getParticipants(), request.getRounds())
                .map(ResponseEntity::ok);
    }
}
