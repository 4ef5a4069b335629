package com.example.ajml.validation;

import com.example.ajml.domain.EnvVar;
import com.example.ajml.domain.LlmConfig;
import com.example.ajml.domain.LlmProvider;
import com.example.ajml.domain.Project;
import com.example.ajml.domain.ServerConfig;
import com.example.ajml.markup.MarkupElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link Project} from a parsed {@code _project.ajml}.
 */
public final class ProjectDocumentValidator {

    public static final String PROJECT_FILE = "_project.ajml";

    private ProjectDocumentValidator() {
    }

    /**
     * @param supportedVersions accepted values of {@code ajml_version}
     */
    public static Project validate(MarkupElement root, String file, Set<String> supportedVersions) {
        if (!"project".equals(root.tag())) {
            throw new CompilationException(DiagnosticCode.ROOT_MISMATCH,
                    "Root element must be `<project>` for " + PROJECT_FILE + ".", file, root.line());
        }
        String name = root.attribute("name", "");
        if (name.isEmpty()) {
            throw new CompilationException(DiagnosticCode.ROOT_MISMATCH,
                    "Root element `<project>` must have a `name` attribute.", file, root.line());
        }
        String version = root.attribute("ajml_version", "");
        if (version.isEmpty()) {
            throw new CompilationException(DiagnosticCode.INVALID_LANGUAGE_VERSION,
                    "Missing `ajml_version` in " + PROJECT_FILE + ".", file, root.line());
        }
        if (!supportedVersions.contains(version)) {
            throw new CompilationException(DiagnosticCode.INVALID_LANGUAGE_VERSION,
                    "Invalid `ajml_version` '" + version + "' in " + PROJECT_FILE + ". Supported versions: "
                            + String.join(", ", supportedVersions.stream().sorted().toList()) + ".",
                    file, root.line());
        }

        LlmConfig llm = LlmConfig.unset();
        ServerConfig server = ServerConfig.defaults();
        List<EnvVar> envVars = new ArrayList<>();

        MarkupElement config = root.child("config").orElse(null);
        if (config != null) {
            MarkupElement llmElement = config.child("llm").orElse(null);
            if (llmElement != null) {
                llm = llmConfig(llmElement, file);
            }
            MarkupElement serverElement = config.child("server").orElse(null);
            if (serverElement != null) {
                server = serverConfig(serverElement, file);
            }
            config.child("env").ifPresent(env -> env.children("var").forEach(var -> envVars.add(new EnvVar(
                    var.attribute("name", ""),
                    var.flag("required", false),
                    var.attribute("default")))));
        }

        return new Project(name, version, llm, server, envVars, file);
    }

    /** Reads a {@code <llm>} element; shared with agent-level overrides. Unknown providers raise E401. */
    static LlmConfig llmConfig(MarkupElement element, String file) {
        String provider = element.attribute("provider", "");
        if (!provider.isEmpty() && LlmProvider.fromToken(provider).isEmpty()) {
            throw new CompilationException(DiagnosticCode.UNKNOWN_PROVIDER,
                    "Unknown LLM provider `" + provider + "`. Must be one of: "
                            + String.join(", ", LlmProvider.sortedTokens()) + ".", file, element.line());
        }
        return new LlmConfig(provider, element.attribute("model", ""),
                AttributeValues.intValue(element, "max_retries", LlmConfig.DEFAULT_MAX_RETRIES, file));
    }

    private static ServerConfig serverConfig(MarkupElement element, String file) {
        String authEnv = element.attribute("auth_env", "");
        String docsPublic = element.attribute("docs_public");
        return new ServerConfig(
                element.attribute("cors_origins", "*"),
                authEnv,
                docsPublic != null ? "true".equalsIgnoreCase(docsPublic) : authEnv.isEmpty(),
                element.attribute("host", ServerConfig.DEFAULT_HOST),
                AttributeValues.intValue(element, "port", ServerConfig.DEFAULT_PORT, file));
    }
}
