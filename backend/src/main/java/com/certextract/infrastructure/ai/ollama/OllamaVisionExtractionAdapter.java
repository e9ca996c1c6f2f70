package com.certextract.infrastructure.ai.ollama;

import com.certextract.domain.extraction.model.AdapterInput;
import com.certextract.domain.extraction.model.AdapterResult;
import com.certextract.domain.extraction.model.ExtractionTier;
import com.certextract.domain.extraction.model.ProviderResponse;
import com.certextract.domain.extraction.service.ExtractionAdapter;
import com.certextract.infrastructure.ai.ExtractionPromptBuilder;
import com.certextract.infrastructure.ai.LlmCallResult;
import com.certextract.infrastructure.ai.VisionPages;
import com.certextract.infrastructure.extraction.mapping.ExtractedDataMapper;
import com.certextract.infrastructure.extraction.mapping.ProviderResponseParser;
import com.certextract.infrastructure.resilience.ResiliencePool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Tier-3 fallback. Only configured when a vision-capable local model is installed.
 */
@Component
@RequiredArgsConstructor
public class OllamaVisionExtractionAdapter implements ExtractionAdapter {

    private final OllamaClient ollamaClient;
    private final ExtractionPromptBuilder promptBuilder;
    private final ProviderResponseParser responseParser;
    private final ExtractedDataMapper dataMapper;
    private final VisionPages visionPages;
    private final ResiliencePool resiliencePool;

    @Override
    public String name() {
        return "ollama-vision";
    }

    @Override
    public ExtractionTier tier() {
        return ExtractionTier.TIER_3;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isConfigured() {
        return ollamaClient.resolveVisionModel().isPresent();
    }

    @Override
    public AdapterResult extract(AdapterInput input) {
        VisionPages.Prepared pages = visionPages.prepare(input);
        if (pages.images().isEmpty()) {
            return AdapterResult.nothingFound("No page images could be prepared for " + input.filename());
        }
        String model = ollamaClient.resolveVisionModel()
                .orElseThrow(() -> new IllegalStateException("No local vision model installed"));
        List<String> images = pages.images().stream().map(VisionPages.PageImage::base64).toList();

        LlmCallResult call = resiliencePool.execute(OllamaTextExtractionAdapter.CIRCUIT,
                () -> ollamaClient.generate(model, promptBuilder.systemPrompt(),
                        promptBuilder.visionInstruction(input.certificateType()), images));

        ProviderResponse response = responseParser.parse(call.content());
        if (response instanceof ProviderResponse.MalformedResponse malformed) {
            return AdapterResult.failure(response, BigDecimal.ZERO, "Malformed response: " + malformed.reason());
        }
        double completeness = dataMapper.calculateConfidence(dataMapper.map(response, input.certificateType()));
        return AdapterResult.success(response, Math.min(pages.confidenceCeiling(), completeness), BigDecimal.ZERO);
    }
}
