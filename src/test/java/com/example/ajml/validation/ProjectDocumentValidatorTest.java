package com.example.ajml.validation;

import com.example.ajml.domain.EnvVar;
import com.example.ajml.domain.LlmConfig;
import com.example.ajml.domain.Project;
import com.example.ajml.domain.ServerConfig;
import com.example.ajml.markup.MarkupReader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ProjectDocumentValidator")
class ProjectDocumentValidatorTest {

    private static final Set<String> VERSIONS = Set.of("2.0");

    private static Project validate(String document) {
        return ProjectDocumentValidator.validate(MarkupReader.read(document), ProjectDocumentValidator.PROJECT_FILE, VERSIONS);
    }

    @Nested
    @DisplayName("valid project")
    class ValidProject {

        @Test
        @DisplayName("reads the LLM defaults")
        void llmDefaults() {
            Project project = validate("""
                    <project name="demo" ajml_version="2.0">
                        <config><llm provider="openai" model="gpt-4o" /></config>
                    </project>
                    """);
            assertEquals("demo", project.name());
            assertEquals(new LlmConfig("openai", "gpt-4o", LlmConfig.DEFAULT_MAX_RETRIES), project.llm());
            assertEquals(ServerConfig.defaults(), project.server());
        }

        @Test
        @DisplayName("reads server settings; docs stay private when auth is configured")
        void serverSettings() {
            Project project = validate("""
                    <project name="demo" ajml_version="2.0">
                        <config>
                            <server cors_origins="https://example.com" auth_env="MY_KEY" port="9000" />
                        </config>
                    </project>
                    """);
            ServerConfig server = project.server();
            assertEquals("https://example.com", server.corsOrigins());
            assertEquals("MY_KEY", server.authEnv());
            assertFalse(server.docsPublic());
            assertEquals(9000, server.port());
            assertEquals(ServerConfig.DEFAULT_HOST, server.host());
        }

        @Test
        @DisplayName("an explicit docs_public wins over the auth default")
        void explicitDocsPublic() {
            Project project = validate("""
                    <project name="demo" ajml_version="2.0">
                        <config><server auth_env="MY_KEY" docs_public="true" /></config>
                    </project>
                    """);
            assertTrue(project.server().docsPublic());
        }

        @Test
        @DisplayName("reads environment variables in order")
        void envVars() {
            Project project = validate("""
                    <project name="demo" ajml_version="2.0">
                        <config>
                            <env>
                                <var name="API_KEY" required="true" />
                                <var name="LOG_LEVEL" default="INFO" />
                            </env>
                        </config>
                    </project>
                    """);
            assertThat(project.envVars()).containsExactly(
                    new EnvVar("API_KEY", true, null),
                    new EnvVar("LOG_LEVEL", false, "INFO"));
        }
    }

    @Nested
    @DisplayName("invalid project")
    class InvalidProject {

        @Test
        @DisplayName("E001 when the root is <agent>")
        void wrongRoot() {
            CompilationException ex = assertThrows(CompilationException.class, () -> validate("<agent name=\"a\" />"));
            assertEquals(DiagnosticCode.ROOT_MISMATCH, ex.getCode());
        }

        @Test
        @DisplayName("E001 when the name is missing")
        void missingName() {
            CompilationException ex = assertThrows(CompilationException.class,
                    () -> validate("<project ajml_version=\"2.0\" />"));
            assertEquals(DiagnosticCode.ROOT_MISMATCH, ex.getCode());
        }

        @Test
        @DisplayName("E004 for an unsupported version, listing the supported ones")
        void unsupportedVersion() {
            CompilationException ex = assertThrows(CompilationException.class,
                    () -> validate("<project name=\"p\" ajml_version=\"1.0\" />"));
            assertEquals(DiagnosticCode.INVALID_LANGUAGE_VERSION, ex.getCode());
            assertThat(ex.getDiagnostic().message()).contains("'1.0'").contains("2.0");
        }

        @Test
        @DisplayName("E004 when the version is missing")
        void missingVersion() {
            CompilationException ex = assertThrows(CompilationException.class,
                    () -> validate("<project name=\"p\" />"));
            assertEquals(DiagnosticCode.INVALID_LANGUAGE_VERSION, ex.getCode());
        }

        @Test
        @DisplayName("E401 for an unknown provider")
        void unknownProvider() {
            CompilationException ex = assertThrows(CompilationException.class, () -> validate("""
                    <project name="p" ajml_version="2.0">
                        <config><llm provider="invalid_provider" model="x" /></config>
                    </project>
                    """));
            assertEquals(DiagnosticCode.UNKNOWN_PROVIDER, ex.getCode());
            assertThat(ex.getDiagnostic().message()).contains("anthropic").contains("openai");
        }
    }
}
