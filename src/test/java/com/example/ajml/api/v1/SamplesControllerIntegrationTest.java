package com.example.ajml.api.v1;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(SamplesControllerIntegrationTest.SampleTestConfig.class)
@DisplayName("Sample projects integration")
class SamplesControllerIntegrationTest {

    @TestConfiguration
    static class SampleTestConfig {
        @Bean
        RestTemplate restTemplate() {
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

    private String baseUrl() {
        return "http://localhost:" + port + "/api/v1/samples";
    }

    private ResponseEntity<Map<String, Object>> get(String url) {
        return restTemplate.exchange(url, HttpMethod.GET, null, new ParameterizedTypeReference<>() {});
    }

    @Test
    @DisplayName("lists the bundled samples")
    void listsSamples() {
        ResponseEntity<Map<String, Object>> resp = get(baseUrl());
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().get("samples")).asInstanceOf(InstanceOfAssertFactories.LIST).contains("hello_world", "weather_research");
    }

    @Test
    @DisplayName("every bundled sample compiles")
    @SuppressWarnings("unchecked")
    void everySampleCompiles() {
        List<String> samples = (List<String>) get(baseUrl()).getBody().get("samples");
        for (String sample : samples) {
            ResponseEntity<Map<String, Object>> resp = get(baseUrl() + "/" + sample + "/compile");
            assertThat(resp.getStatusCode()).as(sample).isEqualTo(HttpStatus.OK);
            assertThat((List<Object>) resp.getBody().get("modules")).as(sample).isNotEmpty();
        }
    }

    @Test
    @DisplayName("the weather sample covers every node kind")
    @SuppressWarnings("unchecked")
    void weatherSample() {
        ResponseEntity<Map<String, Object>> resp = get(baseUrl() + "/weather_research/compile");
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, String> sources = ((List<Map<String, Object>>) resp.getBody().get("modules")).stream()
                .collect(Collectors.toMap(m -> (String) m.get("agentName"), m -> (String) m.get("source")));

        assertThat(sources).containsOnlyKeys("researcher", "summarizer");
        assertThat(sources.get("researcher"))
                .contains("from compiled_summarizer import graph as summarizer_graph")
                .contains("from langgraph.constants import Send")
                .contains("analyst_tools = ToolNode(")
                .contains("def route_judge(state: AgentState):")
                .contains("verdict: Literal[");
        assertThat(sources.get("summarizer")).contains("llm = ChatAnthropic(model=\"claude-haiku-4-5\", max_retries=1)");
    }

    @Test
    @DisplayName("an unknown sample returns 404")
    void unknownSample() {
        ResponseEntity<Map<String, Object>> resp = get(baseUrl() + "/nope/compile");
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().get("message")).isEqualTo("Sample project not found: nope");
    }
}
