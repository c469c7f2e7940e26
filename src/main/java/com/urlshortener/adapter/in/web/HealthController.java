package com.urlshortener.adapter.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness only: never probes the counter, store or cache.
 * Dependency health is reported by {@code /actuator/health}.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "Liveness checks")
public class HealthController {

    @GetMapping("/health")
    @Operation(summary = "Liveness check")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "up"));
    }

    @GetMapping("/ping")
    @Operation(summary = "Smoke test endpoint")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("message", "pong"));
    }
}
