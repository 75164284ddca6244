package com.elevance.cloudmock.controller;

import com.elevance.cloudmock.config.MockModeReporter;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Health check endpoint. Registered whether or not mock mode is on.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final MockModeReporter mockModeReporter;

    @Value("${cloudmock.version:1.0.0}")
    private String version;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "Cloud Mock API",
                "version", version,
                "mockMode", mockModeReporter.isMockMode(),
                "timestamp", Instant.now().toString()
        ));
    }
}
