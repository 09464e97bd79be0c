package com.z254.autodev.swarm.api.v1;

import com.z254.autodev.swarm.api.dto.StoreMemoryRequest;
import com.z254.autodev.swarm.memory.MemoryEntry;
import com.z254.autodev.swarm.orchestration.SwarmEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * REST controller for the shared coordination memory.
 */
@RestController
@RequestMapping("/api/v1/memory")
@Tag(name = "Memory", description = "Shared coordination memory")
public class MemoryController {

    private final SwarmEngine engine;

    public MemoryController(SwarmEngine engine) {
        this.engine = engine;
    }

    @PutMapping
    @Operation(summary = "Store entry")
    @ApiResponse(responseCode = "200", description = "Entry stored")
    public Mono<ResponseEntity<MemoryEntry>> store(@Valid @RequestBody StoreMemoryRequest request) {
        Duration ttl = request.getTtlSeconds() != null ? Duration.ofSeconds(request.getTtlSeconds()) : null;
        return engine.storeMemory(request.getKey(), request.getValue(), request.getTags(), ttl)
                .map(ResponseEntity::ok);
    }

    @GetMapping
    @Operation(summary = "List keys")
    public Mono<List<String>> listKeys() {
        return engine.listMemoryKeys();
    }

    @GetMapping("/{key}")
    @Operation(summary = "Retrieve entry")
    @ApiResponse(responseCode = "200", description = "Entry found")
    @ApiResponse(responseCode = "404", description = "No live entry under this key")
    public Mono<ResponseEntity<MemoryEntry>> retrieve(@Parameter(description = "Entry key") @PathVariable String key) {
        return engine.retrieveMemory(key)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{key}")
    @Operation(summary = "Delete entry")
    @ApiResponse(responseCode = "204", description = "Entry deleted")
    @ApiResponse(responseCode = "404", description = "No entry under this key")
    public Mono<ResponseEntity<Void>> delete(@Parameter(description = "Entry key") @PathVariable String key) {
        return engine.deleteMemory(key)
                .map(deleted -> deleted
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }
}
