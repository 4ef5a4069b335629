package com.example.ajml.compiler;

import com.example.ajml.codegen.AgentCodeGenerator;
import com.example.ajml.codegen.GeneratedAgent;
import com.example.ajml.domain.Agent;
import com.example.ajml.domain.Project;
import com.example.ajml.markup.MarkupElement;
import com.example.ajml.markup.MarkupReader;
import com.example.ajml.markup.MarkupSyntaxException;
import com.example.ajml.validation.AgentDocumentValidator;
import com.example.ajml.validation.AgentValidationResult;
import com.example.ajml.validation.CompilationException;
import com.example.ajml.validation.CrossDocumentResolver;
import com.example.ajml.validation.Diagnostic;
import com.example.ajml.validation.DiagnosticCode;
import com.example.ajml.validation.ProjectDocumentValidator;
import com.example.ajml.validation.ScriptLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles a whole project: project document, every agent document in file-name order, the
 * cross-document checks and, for {@link #compile}, code generation.
 * <p>
 * Stops at the first fatal diagnostic with a {@link CompilationException}; warnings are returned in
 * the {@link CompilationResult}.
 * </p>
 */
public class ProjectCompiler {

    private static final Logger log = LoggerFactory.getLogger(ProjectCompiler.class);

    private final Set<String> supportedVersions;
    private final AgentCodeGenerator generator;

    public ProjectCompiler(Set<String> supportedVersions, AgentCodeGenerator generator) {
        this.supportedVersions = Set.copyOf(Objects.requireNonNull(supportedVersions, "supportedVersions"));
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    /** Runs every check without generating code. */
    public CompilationResult validate(ProjectSources sources) {
        Objects.requireNonNull(sources, "sources");
        if (sources.project() == null) {
            throw new CompilationException(DiagnosticCode.MISSING_PROJECT,
                    "Missing `" + ProjectDocumentValidator.PROJECT_FILE + "` in project directory.",
                    ProjectDocumentValidator.PROJECT_FILE);
        }
        SourceDocument projectDocument = sources.project();
        Project project = ProjectDocumentValidator.validate(parse(projectDocument), projectDocument.fileName(),
                supportedVersions);
        log.debug("Validated project name={} agents={}", project.name(), sources.agents().size());

        ScriptLocator scripts = ScriptLocator.of(sources.scripts());
        List<Agent> agents = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        for (SourceDocument document : sources.agentsInFileOrder()) {
            AgentValidationResult result = AgentDocumentValidator.validate(parse(document), document.fileName(), scripts);
            log.debug("Validated agent={} file={} warnings={}", result.agent().name(), document.fileName(),
                    result.warnings().size());
            agents.add(result.agent());
            warnings.addAll(result.warnings());
        }
        CrossDocumentResolver.resolve(agents);
        return new CompilationResult(project, agents, List.of(), warnings);
    }

    /** Validates the project and generates one module per agent. */
    public CompilationResult compile(ProjectSources sources) {
        CompilationResult validated = validate(sources);
        List<GeneratedAgent> generated = validated.agents().stream()
                .map(agent -> generator.generate(agent, validated.project()))
                .toList();
        return new CompilationResult(validated.project(), validated.agents(), generated, validated.warnings());
    }

    private static MarkupElement parse(SourceDocument document) {
        try {
            return MarkupReader.read(document.content());
        } catch (MarkupSyntaxException e) {
            throw new CompilationException(DiagnosticCode.MALFORMED_DOCUMENT,
                    "Document is not well-formed: " + e.getMessage(), document.fileName(), e.getLine());
        }
    }
}
