package com.certextract.infrastructure.extraction.qr;

import com.certextract.domain.extraction.model.AdapterInput;
import com.certextract.domain.extraction.model.AdapterResult;
import com.certextract.domain.extraction.model.ExtractionTier;
import com.certextract.domain.extraction.model.ProviderResponse;
import com.certextract.domain.extraction.service.ExtractionAdapter;
import com.certextract.infrastructure.extraction.format.PdfPageRenderer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Tier-0.5: verification QR codes and generating-software metadata. A recognised
 * verification link is strong evidence, so this tier reports a fixed high confidence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QrMetadataAdapter implements ExtractionAdapter {

    static final double VERIFIED_CONFIDENCE = 0.95;

    private final QrCodeScanner scanner;
    private final PdfPageRenderer pageRenderer;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return "qr-metadata";
    }

    @Override
    public ExtractionTier tier() {
        return ExtractionTier.TIER_0_5;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public AdapterResult extract(AdapterInput input) {
        boolean isPdf = input.analysis() != null && input.analysis().format().isPdf();
        List<String> payloads = input.isImage()
                ? scanner.scanImage(input.content())
                : isPdf ? scanner.scanPdf(input.content()) : List.of();
        Optional<String> software = isPdf ? pageRenderer.generatingSoftware(input.content()) : Optional.empty();

        List<VerificationCode> codes = new ArrayList<>();
        payloads.forEach(p -> codes.add(VerificationCode.parse(p)));

        Map<String, String> extracted = new LinkedHashMap<>();
        boolean verified = collectVerificationData(codes, extracted);
        if (software.isPresent()) {
            extracted.put("generatingSoftware", software.get());
            if (software.get().toLowerCase(Locale.ROOT).contains("gas")) {
                verified = true;
            }
        }

        log.info("[QR] {} QR code(s), verified: {}, software: {}", codes.size(), verified, software.orElse("-"));

        ObjectNode data = objectMapper.createObjectNode();
        if (input.certificateType() != null) {
            data.put("certificateType", input.certificateType());
        }
        codes.stream()
                .filter(c -> c.code() != null)
                .findFirst()
                .ifPresent(c -> data.put("certificateNumber", c.code()));
        if (extracted.containsKey("gasSafeId")) {
            data.put("engineerRegistration", extracted.get("gasSafeId"));
        }
        ObjectNode additional = data.putObject("additionalFields");
        extracted.forEach(additional::put);

        ProviderResponse response = new ProviderResponse.ParsedJson(data, String.join("\n", payloads));
        if (!verified) {
            return AdapterResult.failure(response, BigDecimal.ZERO, "No QR codes or verification data found");
        }
        return AdapterResult.success(response, VERIFIED_CONFIDENCE, BigDecimal.ZERO);
    }

    private static boolean collectVerificationData(List<VerificationCode> codes, Map<String, String> extracted) {
        boolean verified = false;
        for (VerificationCode code : codes) {
            if (code.code() != null) {
                switch (code.provider()) {
                    case GAS_SAFE -> {
                        extracted.put("gasSafeId", code.code());
                        verified = true;
                    }
                    case GAS_TAG -> {
                        extracted.put("gasTagRef", code.code());
                        verified = true;
                    }
                    case NICEIC -> {
                        extracted.put("niceicRef", code.code());
                        verified = true;
                    }
                    default -> { }
                }
            }
            if (code.url() != null) {
                extracted.put("verificationUrl", code.url());
                verified = true;
            }
        }
        return verified;
    }
}
