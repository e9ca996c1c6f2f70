package com.certextract.infrastructure.ai.ollama;

import com.certextract.domain.extraction.model.AdapterInput;
import com.certextract.domain.extraction.model.AdapterResult;
import com.certextract.domain.extraction.model.DocumentClassification;
import com.certextract.domain.extraction.model.DocumentFormat;
import com.certextract.domain.extraction.model.FormatAnalysis;
import com.certextract.infrastructure.ai.ExtractionPromptBuilder;
import com.certextract.infrastructure.ai.LlmCallResult;
import com.certextract.infrastructure.ai.VisionPages;
import com.certextract.infrastructure.extraction.format.PdfPageRenderer;
import com.certextract.infrastructure.extraction.mapping.ExtractedDataMapper;
import com.certextract.infrastructure.extraction.mapping.ProviderResponseParser;
import com.certextract.infrastructure.resilience.MutableClock;
import com.certextract.infrastructure.resilience.ResiliencePool;
import com.certextract.infrastructure.resilience.ResilienceProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OllamaExtractionAdaptersTest {

    private static final String EICR_JSON = """
            {"certificateType":"EICR","certificateNumber":"EI-7","propertyAddress":"9 Canal St",
             "inspectionDate":"2023-05-01","expiryDate":"2028-05-01","outcome":"SATISFACTORY"}
            """;

    @Mock
    private OllamaClient ollamaClient;

    private final ExtractionPromptBuilder promptBuilder = new ExtractionPromptBuilder();
    private final ProviderResponseParser responseParser = new ProviderResponseParser(new ObjectMapper());
    private final ExtractedDataMapper dataMapper = new ExtractedDataMapper();
    private ResiliencePool resiliencePool;

    @BeforeEach
    void setUp() {
        ResilienceProperties properties = new ResilienceProperties();
        properties.getDefaults().setMaxAttempts(1);
        properties.getDefaults().setInitialDelay(Duration.ZERO);
        properties.getDefaults().setMaxDelay(Duration.ZERO);
        resiliencePool = new ResiliencePool(properties, MutableClock.atEpoch());
    }

    @AfterEach
    void tearDown() {
        resiliencePool.shutdown();
    }

    @Test
    void text_adapter_is_free_and_falls_back_behind_hosted_model() {
        when(ollamaClient.resolveTextModel()).thenReturn(Optional.of("llama3.2"));
        when(ollamaClient.generate(eq("llama3.2"), anyString(), anyString(), eq(List.of())))
                .thenReturn(new LlmCallResult(EICR_JSON, 0, 0));
        OllamaTextExtractionAdapter adapter =
                new OllamaTextExtractionAdapter(ollamaClient, promptBuilder, responseParser, resiliencePool);
        FormatAnalysis analysis = new FormatAnalysis(DocumentFormat.TXT, DocumentClassification.STRUCTURED_CERTIFICATE,
                1, true, false, false, 1.0, "Electrical Installation Condition Report", "EICR");

        AdapterResult result = adapter.extract(new AdapterInput(new byte[]{1}, "text/plain", "eicr.txt",
                analysis.textContent(), "EICR", analysis, null));

        assertThat(adapter.priority()).isGreaterThan(0);
        assertThat(result.success()).isTrue();
        assertThat(result.confidence()).isNull();
        assertThat(result.cost()).isZero();
    }

    @Test
    void vision_adapter_unconfigured_without_vision_model() {
        when(ollamaClient.resolveVisionModel()).thenReturn(Optional.empty());
        OllamaVisionExtractionAdapter adapter = new OllamaVisionExtractionAdapter(ollamaClient, promptBuilder,
                responseParser, dataMapper, new VisionPages(new PdfPageRenderer()), resiliencePool);

        assertThat(adapter.isConfigured()).isFalse();
    }

    @Test
    void vision_adapter_sends_image_and_caps_confidence() {
        when(ollamaClient.resolveVisionModel()).thenReturn(Optional.of("llava"));
        when(ollamaClient.generate(eq("llava"), anyString(), anyString(), eq(List.of("AQID"))))
                .thenReturn(new LlmCallResult("{\"certificateType\":\"EICR\",\"certificateNumber\":\"EI-7\"}", 0, 0));
        VisionPages visionPages = new VisionPages(new PdfPageRenderer());
        ReflectionTestUtils.setField(visionPages, "maxPages", 1);
        OllamaVisionExtractionAdapter adapter = new OllamaVisionExtractionAdapter(ollamaClient, promptBuilder,
                responseParser, dataMapper, visionPages, resiliencePool);
        FormatAnalysis analysis = new FormatAnalysis(DocumentFormat.IMAGE, DocumentClassification.STRUCTURED_CERTIFICATE,
                1, false, true, false, 0.0, null, null);

        AdapterResult result = adapter.extract(new AdapterInput(new byte[]{1, 2, 3}, "image/jpeg", "scan.jpg",
                null, "EICR", analysis, null));

        assertThat(result.success()).isTrue();
        assertThat(result.confidence()).isLessThan(0.85);
        assertThat(result.confidence()).isEqualTo(
                dataMapper.calculateConfidence(dataMapper.map(result.response(), "EICR")));
    }
}
