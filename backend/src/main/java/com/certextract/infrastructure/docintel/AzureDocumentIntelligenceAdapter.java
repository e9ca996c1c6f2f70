package com.certextract.infrastructure.docintel;

import com.certextract.domain.extraction.model.AdapterInput;
import com.certextract.domain.extraction.model.AdapterResult;
import com.certextract.domain.extraction.model.ExtractionTier;
import com.certextract.domain.extraction.model.ProviderResponse;
import com.certextract.domain.extraction.service.ExtractionAdapter;
import com.certextract.infrastructure.extraction.template.CertificateDates;
import com.certextract.infrastructure.resilience.ExtractionCancelledException;
import com.certextract.infrastructure.resilience.ExtractionTransportException;
import com.certextract.infrastructure.resilience.ResiliencePool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tier-2: Azure Document Intelligence layout analysis. Submits the document, polls the
 * returned operation until it completes, then reads the recognised text with light heuristics.
 */
@Slf4j
@Component
public class AzureDocumentIntelligenceAdapter implements ExtractionAdapter {

    public static final String CIRCUIT = "azure-document-intelligence";

    static final String MODEL_ID = "prebuilt-layout";
    static final String SUBSCRIPTION_HEADER = "Ocp-Apim-Subscription-Key";

    private static final Pattern CERTIFICATE_NUMBER = Pattern.compile(
            "(?:certificate|report)\\s*(?:number|no|reference|ref)\\.?[:\\s]*([A-Z0-9][A-Z0-9\\-/]*)", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("(?:date|issued)[:\\s]*(\\d{1,2}[/\\-]\\d{1,2}[/\\-]\\d{2,4})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d{1,2}[/\\-]\\d{1,2}[/\\-]\\d{2,4})"));
    private static final Pattern GAS_SAFE = Pattern.compile("gas\\s*safe[^\\d\\n]{0,20}(\\d{6,7})", Pattern.CASE_INSENSITIVE);
    private static final Pattern NICEIC = Pattern.compile("niceic[:\\s]*([A-Z0-9]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEGATIVE = Pattern.compile("unsatisfactory|\\bfail|non-compliant", Pattern.CASE_INSENSITIVE);
    private static final Pattern POSITIVE = Pattern.compile("satisfactory|\\bpass|compliant", Pattern.CASE_INSENSITIVE);

    private final RestTemplate restTemplate;
    private final ResiliencePool resiliencePool;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final String apiKey;
    private final String apiVersion;
    private final Duration pollInterval;
    private final int maxPolls;
    private final BigDecimal costPerPage;

    public AzureDocumentIntelligenceAdapter(RestTemplate restTemplate,
                                            ResiliencePool resiliencePool,
                                            ObjectMapper objectMapper,
                                            @Value("${azure.document-intelligence.endpoint:}") String endpoint,
                                            @Value("${azure.document-intelligence.key:}") String apiKey,
                                            @Value("${azure.document-intelligence.api-version:2024-11-30}") String apiVersion,
                                            @Value("${azure.document-intelligence.poll-interval:2s}") Duration pollInterval,
                                            @Value("${azure.document-intelligence.max-polls:30}") int maxPolls,
                                            @Value("${azure.document-intelligence.cost-per-page:0.0015}") BigDecimal costPerPage) {
        this.restTemplate = restTemplate;
        this.resiliencePool = resiliencePool;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint == null ? "" : endpoint.replaceAll("/+$", "");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiVersion = apiVersion;
        this.pollInterval = pollInterval;
        this.maxPolls = maxPolls;
        this.costPerPage = costPerPage;
    }

    @Override
    public String name() {
        return "azure-document-intelligence";
    }

    @Override
    public ExtractionTier tier() {
        return ExtractionTier.TIER_2;
    }

    @Override
    public boolean isConfigured() {
        return !endpoint.isBlank() && !apiKey.isBlank();
    }

    @Override
    public AdapterResult extract(AdapterInput input) {
        if (input.content() == null || input.content().length == 0) {
            return AdapterResult.nothingFound("Empty document");
        }

        JsonNode analyzeResult = resiliencePool.execute(CIRCUIT, () -> analyze(input.content(), input.mimeType()));

        String text = analyzeResult.path("content").asText("");
        int pageCount = Math.max(1, analyzeResult.path("pages").size());
        BigDecimal cost = costPerPage.multiply(BigDecimal.valueOf(pageCount));

        ObjectNode data = parseText(text, input.certificateType());
        data.putObject("additionalFields").put("pageCount", pageCount);
        double confidence = confidence(text, data);

        log.info("[DocIntel] Analysis complete - textLength: {}, pages: {}, cost: {}, confidence: {}",
                text.length(), pageCount, cost, String.format(Locale.ROOT, "%.2f", confidence));

        ProviderResponse response = new ProviderResponse.ParsedJson(data, text);
        if (text.isBlank()) {
            return AdapterResult.failure(response, cost, "No text recognised");
        }
        return AdapterResult.success(response, confidence, cost);
    }

    JsonNode analyze(byte[] content, String mimeType) {
        String analyzeUrl = endpoint + "/documentintelligence/documentModels/" + MODEL_ID
                + ":analyze?api-version=" + apiVersion;

        HttpHeaders headers = new HttpHeaders();
        headers.set(SUBSCRIPTION_HEADER, apiKey);
        headers.setContentType(mimeType == null ? MediaType.APPLICATION_PDF : MediaType.parseMediaType(mimeType));

        String operationLocation;
        try {
            ResponseEntity<Void> submitted = restTemplate.exchange(
                    analyzeUrl, HttpMethod.POST, new HttpEntity<>(content, headers), Void.class);
            operationLocation = submitted.getHeaders().getFirst("Operation-Location");
        } catch (RestClientException e) {
            throw new ExtractionTransportException("Azure analyze request failed: " + e.getMessage(), e);
        }
        if (operationLocation == null) {
            throw new ExtractionTransportException("No Operation-Location header in Azure response");
        }

        HttpHeaders pollHeaders = new HttpHeaders();
        pollHeaders.set(SUBSCRIPTION_HEADER, apiKey);
        for (int poll = 0; poll < maxPolls; poll++) {
            pause();
            JsonNode status;
            try {
                status = restTemplate.exchange(operationLocation, HttpMethod.GET,
                        new HttpEntity<>(pollHeaders), JsonNode.class).getBody();
            } catch (RestClientException e) {
                log.debug("[DocIntel] Poll {} failed: {}", poll + 1, e.getMessage());
                continue;
            }
            String state = status == null ? "" : status.path("status").asText("");
            if ("succeeded".equals(state)) {
                return status.path("analyzeResult");
            }
            if ("failed".equals(state)) {
                throw new ExtractionTransportException("Azure analysis failed: "
                        + status.path("error").path("message").asText("unknown error"));
            }
        }
        throw new ExtractionTransportException("Azure analysis did not complete after " + maxPolls + " polls");
    }

    ObjectNode parseText(String text, String certificateType) {
        ObjectNode data = objectMapper.createObjectNode();
        if (certificateType != null) {
            data.put("certificateType", certificateType);
        }
        Matcher number = CERTIFICATE_NUMBER.matcher(text);
        if (number.find()) {
            data.put("certificateNumber", number.group(1));
        }
        for (Pattern pattern : DATE_PATTERNS) {
            Matcher date = pattern.matcher(text);
            if (date.find()) {
                String iso = CertificateDates.normalize(date.group(1));
                if (iso != null) {
                    data.put("inspectionDate", iso);
                    break;
                }
            }
        }
        Matcher gasSafe = GAS_SAFE.matcher(text);
        if (gasSafe.find()) {
            data.put("engineerRegistration", gasSafe.group(1));
        }
        Matcher niceic = NICEIC.matcher(text);
        if (niceic.find()) {
            data.put("engineerRegistration", niceic.group(1));
        }
        if (NEGATIVE.matcher(text).find()) {
            data.put("outcome", "UNSATISFACTORY");
        } else if (POSITIVE.matcher(text).find()) {
            data.put("outcome", "SATISFACTORY");
        }
        return data;
    }

    static double confidence(String text, JsonNode data) {
        double confidence = 0.0;
        if (text.length() > 500) confidence += 0.3;
        else if (text.length() > 200) confidence += 0.2;
        else if (text.length() > 50) confidence += 0.1;

        if (data.hasNonNull("certificateNumber")) confidence += 0.15;
        if (data.hasNonNull("inspectionDate")) confidence += 0.15;
        if (data.hasNonNull("engineerRegistration")) confidence += 0.15;
        if (data.hasNonNull("outcome")) confidence += 0.1;
        return Math.min(confidence, 1.0);
    }

    private void pause() {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionCancelledException("Cancelled while polling Azure analysis", e);
        }
    }
}
