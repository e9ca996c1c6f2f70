package com.certextract.infrastructure.ai.openai;

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
import com.certextract.infrastructure.resilience.ExtractionTransportException;
import com.certextract.infrastructure.resilience.MutableClock;
import com.certextract.infrastructure.resilience.ResiliencePool;
import com.certextract.infrastructure.resilience.ResilienceProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenAiExtractionAdaptersTest {

    private static final String GAS_JSON = """
            {"certificateType":"GAS","certificateNumber":"GS-88","propertyAddress":"4 Mill Lane",
             "inspectionDate":"2024-02-01","expiryDate":"2025-02-01","outcome":"PASS"}
            """;

    @Mock
    private OpenAiExtractionClient client;

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
        properties.getDefaults().setTimeout(Duration.ofSeconds(5));
        resiliencePool = new ResiliencePool(properties, MutableClock.atEpoch());
    }

    @AfterEach
    void tearDown() {
        resiliencePool.shutdown();
    }

    private static AdapterInput textInput(String text) {
        FormatAnalysis analysis = new FormatAnalysis(DocumentFormat.PDF_NATIVE,
                DocumentClassification.STRUCTURED_CERTIFICATE, 1, true, false, false, 0.9, text, "GAS");
        return new AdapterInput(new byte[]{1}, "application/pdf", "cp12.pdf", text, "GAS", analysis, null);
    }

    private static AdapterInput imageInput() {
        FormatAnalysis analysis = new FormatAnalysis(DocumentFormat.IMAGE,
                DocumentClassification.STRUCTURED_CERTIFICATE, 1, false, true, false, 0.0, null, null);
        return new AdapterInput(new byte[]{(byte) 0x89, 'P', 'N', 'G'}, "image/png", "photo.png",
                null, "GAS", analysis, null);
    }

    @Nested
    @DisplayName("Text model")
    class TextModel {

        private OpenAiTextExtractionAdapter adapter;

        @BeforeEach
        void setUp() {
            adapter = new OpenAiTextExtractionAdapter(client, promptBuilder, responseParser, resiliencePool);
            ReflectionTestUtils.setField(adapter, "model", "gpt-4o-mini");
            ReflectionTestUtils.setField(adapter, "maxTokens", 2000);
            ReflectionTestUtils.setField(adapter, "inputCostPer1k", new BigDecimal("0.00015"));
            ReflectionTestUtils.setField(adapter, "outputCostPer1k", new BigDecimal("0.0006"));
        }

        @Test
        void parsed_response_leaves_confidence_to_mapper_and_reports_token_cost() {
            when(client.complete(eq("gpt-4o-mini"), anyString(), contains("Gas Safety Record"), eq(2000)))
                    .thenReturn(new LlmCallResult(GAS_JSON, 1000, 500));

            AdapterResult result = adapter.extract(textInput("Landlord Gas Safety Record GS-88"));

            assertThat(result.success()).isTrue();
            assertThat(result.confidence()).isNull();
            assertThat(result.cost()).isEqualByComparingTo("0.00045");
            assertThat(result.response().raw()).contains("GS-88");
        }

        @Test
        void malformed_output_is_a_failure_that_still_costs() {
            when(client.complete(anyString(), anyString(), anyString(), anyInt()))
                    .thenReturn(new LlmCallResult("Sorry, I cannot read this.", 400, 20));

            AdapterResult result = adapter.extract(textInput("Landlord Gas Safety Record"));

            assertThat(result.success()).isFalse();
            assertThat(result.error()).startsWith("Malformed response:");
            assertThat(result.cost().signum()).isPositive();
        }

        @Test
        void no_text_means_no_call() {
            AdapterResult result = adapter.extract(textInput("  "));

            assertThat(result.success()).isFalse();
            verifyNoInteractions(client);
        }

        @Test
        void transport_failure_propagates_to_the_orchestrator() {
            when(client.complete(anyString(), anyString(), anyString(), anyInt()))
                    .thenThrow(new ExtractionTransportException("HTTP 503"));

            assertThatThrownBy(() -> adapter.extract(textInput("Landlord Gas Safety Record")))
                    .isInstanceOf(RuntimeException.class);
        }

        @Test
        void configured_when_client_available() {
            when(client.isAvailable()).thenReturn(true);

            assertThat(adapter.isConfigured()).isTrue();
        }
    }

    @Nested
    @DisplayName("Vision model")
    class VisionModel {

        private OpenAiVisionExtractionAdapter adapter;

        @BeforeEach
        void setUp() {
            VisionPages visionPages = new VisionPages(new PdfPageRenderer());
            ReflectionTestUtils.setField(visionPages, "maxPages", 3);
            ReflectionTestUtils.setField(visionPages, "renderDpi", 72f);
            adapter = new OpenAiVisionExtractionAdapter(client, promptBuilder, responseParser, dataMapper,
                    visionPages, resiliencePool);
            ReflectionTestUtils.setField(adapter, "model", "gpt-4o");
            ReflectionTestUtils.setField(adapter, "maxTokens", 4000);
            ReflectionTestUtils.setField(adapter, "inputCostPer1k", new BigDecimal("0.0025"));
            ReflectionTestUtils.setField(adapter, "outputCostPer1k", new BigDecimal("0.01"));
        }

        @Test
        void image_confidence_is_capped_by_completeness_and_ceiling() {
            when(client.completeWithParts(eq("gpt-4o"), anyString(), anyList(), eq(4000)))
                    .thenReturn(new LlmCallResult(GAS_JSON, 2000, 300));

            AdapterResult result = adapter.extract(imageInput());

            double completeness = dataMapper.calculateConfidence(dataMapper.map(result.response(), "GAS"));
            assertThat(result.success()).isTrue();
            assertThat(result.confidence()).isEqualTo(Math.min(0.85, completeness));
            assertThat(result.cost()).isEqualByComparingTo("0.008");
            verify(client).completeWithParts(eq("gpt-4o"), anyString(), anyList(), eq(4000));
        }

        @Test
        void unrenderable_pdf_means_no_call() {
            FormatAnalysis analysis = new FormatAnalysis(DocumentFormat.PDF_SCANNED,
                    DocumentClassification.UNREADABLE, 0, false, true, false, 0.0, null, null);
            AdapterInput input = new AdapterInput("not a pdf".getBytes(), "application/pdf", "broken.pdf",
                    null, null, analysis, null);

            AdapterResult result = adapter.extract(input);

            assertThat(result.success()).isFalse();
            assertThat(result.error()).contains("broken.pdf");
            verifyNoInteractions(client);
        }
    }
}
