package com.certextract.infrastructure.ai.openai;

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Tier-1.5: hosted text model over the extracted text layer. Confidence is left to the
 * mapping layer's completeness score.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiTextExtractionAdapter implements ExtractionAdapter {

    public static final String CIRCUIT = "openai-text";

    private final OpenAiExtractionClient client;
    private final ExtractionPromptBuilder promptBuilder;
    private final ProviderResponseParser responseParser;
    private final ResiliencePool resiliencePool;

    @Value("${openai.text.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.text.max-tokens:2000}")
    private int maxTokens;

    @Value("${openai.text.input-cost-per-1k:0.00015}")
    private BigDecimal inputCostPer1k;

    @Value("${openai.text.output-cost-per-1k:0.0006}")
    private BigDecimal outputCostPer1k;

    @Override
    public String name() {
        return "openai-text";
    }

    @Override
    public ExtractionTier tier() {
        return ExtractionTier.TIER_1_5;
    }

    @Override
    public boolean isConfigured() {
        return client.isAvailable();
    }

    @Override
    public AdapterResult extract(AdapterInput input) {
        if (!input.hasText()) {
            return AdapterResult.nothingFound("No text to send to the text model");
        }

        String userMessage = promptBuilder.textUserMessage(input.text(), input.certificateType());
        LlmCallResult call = resiliencePool.execute(CIRCUIT,
                () -> client.complete(model, promptBuilder.systemPrompt(), userMessage, maxTokens));

        BigDecimal cost = call.cost(inputCostPer1k, outputCostPer1k);
        ProviderResponse response = responseParser.parse(call.content());
        if (response instanceof ProviderResponse.MalformedResponse malformed) {
            log.warn("[OpenAI] Text model returned malformed output: {}", malformed.reason());
            return AdapterResult.failure(response, cost, "Malformed response: " + malformed.reason());
        }
        return AdapterResult.success(response, null, cost);
    }
}
