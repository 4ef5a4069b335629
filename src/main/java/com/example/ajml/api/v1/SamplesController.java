package com.example.ajml.api.v1;

import com.example.ajml.api.v1.dto.CompileResponse;
import com.example.ajml.api.v1.dto.SampleListResponse;
import com.example.ajml.service.CompilationService;
import com.example.ajml.service.SampleProjectRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the sample projects bundled on the classpath.
 */
@RestController
@RequestMapping("/api/v1/samples")
@RequiredArgsConstructor
@Slf4j
public class SamplesController {

    private final SampleProjectRegistry registry;
    private final CompilationService service;

    @GetMapping
    public ResponseEntity<SampleListResponse> list() {
        log.debug("Listing sample projects");
        return ResponseEntity.ok(new SampleListResponse(registry.names()));
    }

    @GetMapping("/{name}/compile")
    public ResponseEntity<CompileResponse> compile(@PathVariable String name) {
        log.info("Compiling sample name={}", name);
        return ResponseEntity.ok(CompileResponse.from(service.compileSample(name)));
    }
}
