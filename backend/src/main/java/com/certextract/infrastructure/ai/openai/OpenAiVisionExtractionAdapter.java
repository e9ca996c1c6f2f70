package com.certextract.infrastructure.ai.openai;

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
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionContentPartImage;
import com.openai.models.chat.completions.ChatCompletionContentPartText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Tier-3: hosted vision model over the page images. Reports the modality's empirical
 * confidence ceiling, lowered to the completeness of what was actually extracted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiVisionExtractionAdapter implements ExtractionAdapter {

    public static final String CIRCUIT = "openai-vision";

    private final OpenAiExtractionClient client;
    private final ExtractionPromptBuilder promptBuilder;
    private final ProviderResponseParser responseParser;
    private final ExtractedDataMapper dataMapper;
    private final VisionPages visionPages;
    private final ResiliencePool resiliencePool;

    @Value("${openai.vision.model:gpt-4o}")
    private String model;

    @Value("${openai.vision.max-tokens:4000}")
    private int maxTokens;

    @Value("${openai.vision.input-cost-per-1k:0.0025}")
    private BigDecimal inputCostPer1k;

    @Value("${openai.vision.output-cost-per-1k:0.01}")
    private BigDecimal outputCostPer1k;

    @Override
    public String name() {
        return "openai-vision";
    }

    @Override
    public ExtractionTier tier() {
        return ExtractionTier.TIER_3;
    }

    @Override
    public boolean isConfigured() {
        return client.isAvailable();
    }

    @Override
    public AdapterResult extract(AdapterInput input) {
        VisionPages.Prepared pages = visionPages.prepare(input);
        if (pages.images().isEmpty()) {
            return AdapterResult.nothingFound("No page images could be prepared for " + input.filename());
        }

        List<ChatCompletionContentPart> parts = new ArrayList<>();
        parts.add(ChatCompletionContentPart.ofText(ChatCompletionContentPartText.builder()
                .text(promptBuilder.visionInstruction(input.certificateType()))
                .build()));
        for (VisionPages.PageImage image : pages.images()) {
            parts.add(ChatCompletionContentPart.ofImageUrl(ChatCompletionContentPartImage.builder()
                    .imageUrl(ChatCompletionContentPartImage.ImageUrl.builder().url(image.dataUrl()).build())
                    .build()));
        }

        LlmCallResult call = resiliencePool.execute(CIRCUIT,
                () -> client.completeWithParts(model, promptBuilder.systemPrompt(), parts, maxTokens));

        BigDecimal cost = call.cost(inputCostPer1k, outputCostPer1k);
        ProviderResponse response = responseParser.parse(call.content());
        if (response instanceof ProviderResponse.MalformedResponse malformed) {
            log.warn("[OpenAI] Vision model returned malformed output: {}", malformed.reason());
            return AdapterResult.failure(response, cost, "Malformed response: " + malformed.reason());
        }

        double completeness = dataMapper.calculateConfidence(dataMapper.map(response, input.certificateType()));
        return AdapterResult.success(response, Math.min(pages.confidenceCeiling(), completeness), cost);
    }
}
