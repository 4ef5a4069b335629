package com.example.ajml.api.v1;

import com.example.ajml.api.v1.dto.CompileRequest;
import com.example.ajml.api.v1.dto.CompileResponse;
import com.example.ajml.api.v1.dto.ValidateResponse;
import com.example.ajml.service.CompilationService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for compiling and validating submitted projects.
 * <p>
 * POST {@code /api/v1/compile} returns the generated modules, POST {@code /api/v1/validate} runs the
 * checks only. A fatal diagnostic yields 400 with the diagnostic in the body.
 * </p>
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class CompileController {

    private final CompilationService service;

    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody CompileRequest request) {
        log.info("Compile request agentCount={} hasProject={}", request.agents().size(), request.project() != null);
        return ResponseEntity.ok(CompileResponse.from(service.compile(request.toSources())));
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidateResponse> validate(@Valid @RequestBody CompileRequest request) {
        log.info("Validate request agentCount={} hasProject={}", request.agents().size(), request.project() != null);
        return ResponseEntity.ok(ValidateResponse.from(service.validate(request.toSources())));
    }
}
