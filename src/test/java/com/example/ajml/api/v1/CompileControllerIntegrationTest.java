package com.example.ajml.api.v1;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(CompileControllerIntegrationTest.RestTestConfig.class)
@DisplayName("Compile API")
class CompileControllerIntegrationTest {

    @TestConfiguration
    static class RestTestConfig {
        @Bean
        public RestTemplate restTemplate() {
            RestTemplate rest = new RestTemplate();
            rest.setErrorHandler(new org.springframework.web.client.ResponseErrorHandler() {
                @Override
                public boolean hasError(ClientHttpResponse response) {
                    return false;
                }

                @Override
                public void handleError(java.net.URI url, HttpMethod method, ClientHttpResponse response) throws java.io.IOException {
                }
            });
            return rest;
        }
    }

    @LocalServerPort
    private int port;

    @Autowired
    private RestTemplate restTemplate;

    private static final String PROJECT = """
            <?xml version="1.0" encoding="UTF-8"?>
            <project name="demo" ajml_version="2.0">
                <config><llm provider="openai" model="gpt-4o" /></config>
            </project>
            """;

    private static final String GREETER = """
            <?xml version="1.0" encoding="UTF-8"?>
            <agent name="greeter">
                <state>
                    <field name="user_name" type="string" required="true" />
                    <field name="result" type="string" default="" />
                </state>
                <graph>
                    <node id="greet" type="llm"><system_prompt>Greet ${user_name}</system_prompt></node>
                    <node id="left" type="llm"><system_prompt>Left</system_prompt></node>
                    <node id="right" type="llm"><system_prompt>Right</system_prompt></node>
                    <edge source="__START__" target="greet" />
                    <edge source="greet" target="left" />
                    <edge source="greet" target="right" />
                    <edge source="left" target="__END__" />
                    <edge source="right" target="__END__" />
                </graph>
            </agent>
            """;

    private String url(String path) {
        return "http://localhost:" + port + "/api/v1" + path;
    }

    private ResponseEntity<Map<String, Object>> post(String path, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(url(path), HttpMethod.POST, new HttpEntity<>(body, headers),
                new ParameterizedTypeReference<>() {});
    }

    private static Map<String, Object> document(String fileName, String content) {
        return Map.of("fileName", fileName, "content", content);
    }

    @Nested
    @DisplayName("compile")
    class Compile {

        @Test
        @DisplayName("POST compile returns the generated module and warnings")
        @SuppressWarnings("unchecked")
        void compiles() {
            ResponseEntity<Map<String, Object>> resp = post("/compile", Map.of(
                    "project", document("_project.ajml", PROJECT),
                    "agents", List.of(document("greeter.ajml", GREETER))));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            Map<String, Object> body = resp.getBody();
            assertThat(body).isNotNull();
            assertThat(body.get("projectName")).isEqualTo("demo");
            List<Map<String, Object>> modules = (List<Map<String, Object>>) body.get("modules");
            assertThat(modules).hasSize(1);
            assertThat(modules.get(0).get("fileName")).isEqualTo("compiled_greeter.py");
            assertThat((String) modules.get(0).get("source")).contains("graph = graph_builder.compile()");
            List<Map<String, Object>> warnings = (List<Map<String, Object>>) body.get("warnings");
            assertThat(warnings).hasSize(2);
            assertThat(warnings).allSatisfy(w -> {
                assertThat(w.get("code")).isEqualTo("W301");
                assertThat(w.get("severity")).isEqualTo("WARNING");
            });
        }

        @Test
        @DisplayName("POST validate returns agent names without source")
        void validates() {
            ResponseEntity<Map<String, Object>> resp = post("/validate", Map.of(
                    "project", document("_project.ajml", PROJECT),
                    "agents", List.of(document("greeter.ajml", GREETER))));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).isNotNull();
            assertThat(resp.getBody().get("agentNames")).asInstanceOf(InstanceOfAssertFactories.LIST).containsExactly("greeter");
            assertThat(resp.getBody()).doesNotContainKey("modules");
        }
    }

    @Nested
    @DisplayName("error handling")
    class ErrorHandling {

        @Test
        @DisplayName("missing project returns 400 with the E003 diagnostic")
        @SuppressWarnings("unchecked")
        void missingProject() {
            ResponseEntity<Map<String, Object>> resp = post("/compile", Map.of(
                    "agents", List.of(document("greeter.ajml", GREETER))));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).isNotNull();
            assertThat(resp.getBody().get("message")).isEqualTo("Compilation failed");
            Map<String, Object> diagnostic = (Map<String, Object>) resp.getBody().get("diagnostic");
            assertThat(diagnostic.get("code")).isEqualTo("E003");
            assertThat(diagnostic.get("severity")).isEqualTo("ERROR");
        }

        @Test
        @DisplayName("a graph error returns 400 with file and line")
        @SuppressWarnings("unchecked")
        void graphError() {
            String broken = GREETER.replace("<edge source=\"right\" target=\"__END__\" />", "");
            ResponseEntity<Map<String, Object>> resp = post("/compile", Map.of(
                    "project", document("_project.ajml", PROJECT),
                    "agents", List.of(document("greeter.ajml", broken))));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            Map<String, Object> diagnostic = (Map<String, Object>) resp.getBody().get("diagnostic");
            assertThat(diagnostic.get("code")).isEqualTo("E313");
            assertThat(diagnostic.get("category")).isEqualTo("GRAPH");
            assertThat(diagnostic.get("file")).isEqualTo("greeter.ajml");
            assertThat(diagnostic.get("line")).isNotNull();
        }

        @Test
        @DisplayName("an empty agent list returns 400 with field errors")
        void emptyAgents() {
            ResponseEntity<Map<String, Object>> resp = post("/compile", Map.of(
                    "project", document("_project.ajml", PROJECT),
                    "agents", List.of()));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).isNotNull();
            assertThat(resp.getBody().get("errors")).asInstanceOf(InstanceOfAssertFactories.LIST).isNotEmpty();
        }

        @Test
        @DisplayName("a body that is not JSON returns 400")
        void unreadableBody() {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(url("/compile"), HttpMethod.POST,
                    new HttpEntity<>("{ not json", headers), new ParameterizedTypeReference<>() {});
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }
    }

    @Test
    @DisplayName("GET health returns UP with the accepted language versions and loaded samples")
    void health() {
        ResponseEntity<Map<String, Object>> resp = restTemplate.exchange(url("/health"), HttpMethod.GET, null,
                new ParameterizedTypeReference<>() {});
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody())
                .containsEntry("status", "UP")
                .containsEntry("service", "ajml-compiler")
                .containsEntry("ajmlVersions", List.of("2.0"))
                .containsEntry("samples", 2);
    }
}
