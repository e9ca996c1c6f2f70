package com.certextract.infrastructure.ai.ollama;

import com.certextract.infrastructure.ai.LlmCallResult;
import com.certextract.infrastructure.resilience.ExtractionTransportException;
import com.certextract.infrastructure.resilience.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OllamaClientTest {

    private static final String BASE_URL = "http://localhost:11434";
    private static final String TAGS = """
            {"models":[{"name":"llava:13b"},{"name":"llama3.1:8b"},{"name":"mistral:latest"}]}
            """;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        clock = MutableClock.atEpoch();
    }

    private OllamaClient client(String textModel, String visionModel) {
        return new OllamaClient(restTemplate, clock, BASE_URL, textModel, visionModel);
    }

    @Test
    void resolves_configured_models_by_prefix() {
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "/api/tags"))
                .andRespond(withSuccess(TAGS, MediaType.APPLICATION_JSON));
        OllamaClient client = client("llama3.1", "");

        assertThat(client.resolveTextModel()).contains("llama3.1:8b");
        assertThat(client.resolveVisionModel()).contains("llava:13b");
        server.verify();
    }

    @Test
    void falls_back_to_any_non_vision_model() {
        server.expect(requestTo(BASE_URL + "/api/tags")).andRespond(withSuccess(TAGS, MediaType.APPLICATION_JSON));

        assertThat(client("qwen2", "").resolveTextModel()).contains("llama3.1:8b");
    }

    @Test
    void model_list_is_cached_then_refreshed() {
        server.expect(ExpectedCount.twice(), requestTo(BASE_URL + "/api/tags"))
                .andRespond(withSuccess(TAGS, MediaType.APPLICATION_JSON));
        OllamaClient client = client("llama3.1", "");

        client.installedModels();
        client.installedModels();
        clock.advance(Duration.ofMinutes(5));
        client.installedModels();

        server.verify();
    }

    @Test
    void unreachable_server_means_not_configured() {
        server.expect(requestTo(BASE_URL + "/api/tags")).andRespond(withServerError());

        assertThat(client("llama3.1", "").resolveTextModel()).isEmpty();
    }

    @Test
    void blank_base_url_never_calls_out() {
        OllamaClient client = new OllamaClient(restTemplate, clock, "", "llama3.1", "");

        assertThat(client.installedModels()).isEmpty();
        server.verify();
    }

    @Test
    void generate_posts_a_json_mode_request() {
        server.expect(requestTo(BASE_URL + "/api/generate"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("llava:13b"))
                .andExpect(jsonPath("$.format").value("json"))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.images[0]").value("aGVsbG8="))
                .andRespond(withSuccess("""
                        {"response":"{\\"certificateNumber\\":\\"X1\\"}","prompt_eval_count":120,"eval_count":30}
                        """, MediaType.APPLICATION_JSON));

        LlmCallResult result = client("llama3.1", "").generate("llava:13b", "system", "prompt", List.of("aGVsbG8="));

        assertThat(result.content()).isEqualTo("{\"certificateNumber\":\"X1\"}");
        assertThat(result.promptTokens()).isEqualTo(120);
        assertThat(result.completionTokens()).isEqualTo(30);
    }

    @Test
    void generate_failure_is_a_transport_error() {
        server.expect(requestTo(BASE_URL + "/api/generate")).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> client("llama3.1", "").generate("llama3.1:8b", "s", "p", List.of()))
                .isInstanceOf(ExtractionTransportException.class)
                .hasMessageContaining("llama3.1:8b");
    }
}
