package com.example.ajml.api.v1;

import com.example.ajml.config.CompilerProperties;
import com.example.ajml.service.SampleProjectRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check endpoint.
 * <p>
 * GET /api/v1/health returns 200 with status, service name, the accepted {@code ajml_version} values
 * and the number of bundled samples that were loaded.
 * </p>
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final CompilerProperties properties;
    private final SampleProjectRegistry samples;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.trace("Health check");
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "ajml-compiler",
                "ajmlVersions", properties.supportedVersions().stream().sorted().toList(),
                "samples", samples.names().size()));
    }
}
