package com.certextract.infrastructure.ai.ollama;

import com.certextract.domain.extraction.model.AdapterInput;
import com.certextract.domain.extraction.model.AdapterResult;
import com.certextract.domain.extraction.model.ExtractionTier;
import com.certextract.domain.extraction.model.ProviderResponse;
import com.certextract.domain.extraction.service.ExtractionAdapter;
import com.certextract.infrastructure.ai.ExtractionPromptBuilder;
import com.certextract.infrastructure.ai.LlmCallResult;
import com.certextract.infrastructure.extraction.mapping.ProviderResponseParser;
import com.certextract.infrastructure.resilience.ResiliencePool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Tier-1.5 fallback when no hosted text model is configured. Local inference costs nothing.
 */
@Component
@RequiredArgsConstructor
public class OllamaTextExtractionAdapter implements ExtractionAdapter {

    public static final String CIRCUIT = "ollama";

    private final OllamaClient ollamaClient;
    private final ExtractionPromptBuilder promptBuilder;
    private final ProviderResponseParser responseParser;
    private final ResiliencePool resiliencePool;

    @Override
    public String name() {
        return "ollama-text";
    }

    @Override
    public ExtractionTier tier() {
        return ExtractionTier.TIER_1_5;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isConfigured() {
        return ollamaClient.resolveTextModel().isPresent();
    }

    @Override
    public AdapterResult extract(AdapterInput input) {
        if (!input.hasText()) {
            return AdapterResult.nothingFound("No text to send to the local model");
        }
        String model = ollamaClient.resolveTextModel()
                .orElseThrow(() -> new IllegalStateException("No local text model installed"));
        String prompt = promptBuilder.textUserMessage(input.text(), input.certificateType());

        LlmCallResult call = resiliencePool.execute(CIRCUIT,
                () -> ollamaClient.generate(model, promptBuilder.systemPrompt(), prompt, List.of()));

        ProviderResponse response = responseParser.parse(call.content());
        if (response instanceof ProviderResponse.MalformedResponse malformed) {
            return AdapterResult.failure(response, BigDecimal.ZERO, "Malformed response: " + malformed.reason());
        }
        return AdapterResult.success(response, null, BigDecimal.ZERO);
    }
}
