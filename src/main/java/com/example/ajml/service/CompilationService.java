package com.example.ajml.service;

import com.example.ajml.compiler.CompilationResult;
import com.example.ajml.compiler.ProjectCompiler;
import com.example.ajml.compiler.ProjectSources;
import com.example.ajml.validation.CompilationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Compiles submitted or bundled projects and logs the outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompilationService {

    private final ProjectCompiler compiler;
    private final SampleProjectRegistry samples;

    /**
     * @throws CompilationException on the first fatal diagnostic
     */
    public CompilationResult compile(ProjectSources sources) {
        log.info("Compiling project agents={} scripts={}", sources.agents().size(), sources.scripts().size());
        CompilationResult result = run(() -> compiler.compile(sources));
        log.info("Compiled project name={} modules={} warnings={}", result.project().name(),
                result.generated().size(), result.warnings().size());
        return result;
    }

    /**
     * @throws CompilationException on the first fatal diagnostic
     */
    public CompilationResult validate(ProjectSources sources) {
        log.info("Validating project agents={}", sources.agents().size());
        CompilationResult result = run(() -> compiler.validate(sources));
        log.info("Validated project name={} warnings={}", result.project().name(), result.warnings().size());
        return result;
    }

    /**
     * @throws com.example.ajml.api.SampleNotFoundException if no sample has that name
     */
    public CompilationResult compileSample(String name) {
        log.info("Compiling sample project {}", name);
        return compile(samples.get(name));
    }

    private CompilationResult run(CompilationStep step) {
        try {
            return step.run();
        } catch (CompilationException e) {
            log.warn("Compilation rejected code={} file={} line={}: {}", e.getCode().code(),
                    e.getDiagnostic().file(), e.getDiagnostic().line(), e.getDiagnostic().message());
            throw e;
        }
    }

    @FunctionalInterface
    private interface CompilationStep {
        CompilationResult run();
    }
}
