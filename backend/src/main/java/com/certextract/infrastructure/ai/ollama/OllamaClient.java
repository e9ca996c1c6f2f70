package com.certextract.infrastructure.ai.ollama;

import com.certextract.infrastructure.ai.LlmCallResult;
import com.certextract.infrastructure.resilience.ExtractionTransportException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Local Ollama server used as the fallback model provider. The installed model list is probed
 * lazily and cached, so {@code isConfigured()} checks stay cheap and never throw.
 */
@Slf4j
@Component
public class OllamaClient {

    private static final List<String> VISION_MODEL_MARKERS = List.of("llava", "bakllava", "moondream", "vision");
    private static final Duration MODEL_LIST_TTL = Duration.ofMinutes(5);

    private record ModelListing(List<String> models, long fetchedAtMillis) {}

    private final RestTemplate restTemplate;
    private final Clock clock;
    private final String baseUrl;
    private final String textModel;
    private final String visionModel;
    private final AtomicReference<ModelListing> listing = new AtomicReference<>();

    public OllamaClient(RestTemplate restTemplate,
                        Clock clock,
                        @Value("${ollama.base-url:}") String baseUrl,
                        @Value("${ollama.model:llama3.1}") String textModel,
                        @Value("${ollama.vision-model:}") String visionModel) {
        this.restTemplate = restTemplate;
        this.clock = clock;
        this.baseUrl = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
        this.textModel = textModel;
        this.visionModel = visionModel;
    }

    public Optional<String> resolveTextModel() {
        List<String> models = installedModels();
        if (models.isEmpty()) return Optional.empty();
        return findInstalled(models, textModel)
                .or(() -> models.stream().filter(m -> !isVisionModel(m)).findFirst());
    }

    public Optional<String> resolveVisionModel() {
        List<String> models = installedModels();
        if (models.isEmpty()) return Optional.empty();
        return findInstalled(models, visionModel)
                .or(() -> models.stream().filter(OllamaClient::isVisionModel).findFirst());
    }

    public LlmCallResult generate(String model, String systemPrompt, String prompt, List<String> base64Images) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("system", systemPrompt);
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("format", "json");
        body.put("options", Map.of("temperature", 0));
        if (base64Images != null && !base64Images.isEmpty()) {
            body.put("images", base64Images);
        }

        try {
            JsonNode response = restTemplate.postForObject(baseUrl + "/api/generate", body, JsonNode.class);
            if (response == null) {
                throw new ExtractionTransportException("Empty response from Ollama");
            }
            return new LlmCallResult(
                    response.path("response").asText(""),
                    response.path("prompt_eval_count").asLong(0),
                    response.path("eval_count").asLong(0));
        } catch (RestClientException e) {
            throw new ExtractionTransportException("Ollama call failed [" + model + "]: " + e.getMessage(), e);
        }
    }

    List<String> installedModels() {
        if (baseUrl.isBlank()) return List.of();
        ModelListing cached = listing.get();
        long now = clock.millis();
        if (cached != null && now - cached.fetchedAtMillis() < MODEL_LIST_TTL.toMillis()) {
            return cached.models();
        }

        List<String> models = new ArrayList<>();
        try {
            JsonNode tags = restTemplate.getForObject(baseUrl + "/api/tags", JsonNode.class);
            if (tags != null) {
                for (JsonNode model : tags.path("models")) {
                    String name = model.path("name").asText(null);
                    if (name != null) models.add(name);
                }
            }
            log.info("[Ollama] {} model(s) available at {}", models.size(), baseUrl);
        } catch (RestClientException e) {
            log.info("[Ollama] Server not reachable at {}: {}", baseUrl, e.getMessage());
        }
        List<String> result = List.copyOf(models);
        listing.set(new ModelListing(result, now));
        return result;
    }

    private static Optional<String> findInstalled(List<String> models, String wanted) {
        if (wanted == null || wanted.isBlank()) return Optional.empty();
        return models.stream()
                .filter(m -> m.equals(wanted) || m.startsWith(wanted + ":"))
                .findFirst();
    }

    private static boolean isVisionModel(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return VISION_MODEL_MARKERS.stream().anyMatch(lower::contains);
    }
}
