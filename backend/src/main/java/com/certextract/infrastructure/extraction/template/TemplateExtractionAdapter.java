package com.certextract.infrastructure.extraction.template;

import com.certextract.domain.extraction.model.AdapterInput;
import com.certextract.domain.extraction.model.AdapterResult;
import com.certextract.domain.extraction.model.CustomPatternConfig;
import com.certextract.domain.extraction.model.DefectRecord;
import com.certextract.domain.extraction.model.ExtractionTier;
import com.certextract.domain.extraction.model.ProviderResponse;
import com.certextract.domain.extraction.service.ExtractionAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Free regex extraction over the document's text layer.
 *
 * Confidence is matched / expected fields, halved when a required field is missing,
 * with a small bonus when coded defects were found.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateExtractionAdapter implements ExtractionAdapter {

    static final int MIN_MATCHED_FIELDS = 2;

    private static final Set<String> CANONICAL_FIELDS = Set.of(
            "certificateNumber", "propertyAddress", "uprn", "inspectionDate", "expiryDate",
            "nextInspectionDate", "outcome", "engineerName", "engineerRegistration",
            "contractorName", "contractorRegistration");

    private final CertificatePatternLibrary patternLibrary;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return "template";
    }

    @Override
    public ExtractionTier tier() {
        return ExtractionTier.TIER_1;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public AdapterResult extract(AdapterInput input) {
        String type = input.certificateType();
        CustomPatternConfig custom = input.customPatterns();
        if (!input.hasText()) {
            return AdapterResult.nothingFound("No text layer to match templates against");
        }
        if (type == null || !patternLibrary.supports(type, custom)) {
            return AdapterResult.nothingFound("No template patterns for certificate type " + type);
        }

        String text = input.text();
        List<CertificatePatternLibrary.FieldPattern> patterns = patternLibrary.patternsFor(type, custom);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("certificateType", type);
        ObjectNode additional = data.putObject("additionalFields");

        int matched = 0;
        int requiredMissing = 0;
        for (CertificatePatternLibrary.FieldPattern pattern : patterns) {
            String value = pattern.extract(text);
            if (value != null) {
                matched++;
                if (CANONICAL_FIELDS.contains(pattern.field())) {
                    data.put(pattern.field(), value);
                } else {
                    additional.put(pattern.field(), value);
                }
            } else if (pattern.required()) {
                requiredMissing++;
            }
        }

        List<DefectRecord> defects = patternLibrary.extractDefects(text);
        ArrayNode defectNodes = data.putArray("defects");
        for (DefectRecord defect : defects) {
            ObjectNode node = defectNodes.addObject();
            node.put("code", defect.code());
            node.put("description", defect.description());
            node.putNull("location");
            node.put("priority", defect.priority().name());
        }

        ArrayNode applianceNodes = data.putArray("appliances");
        if ("GAS".equals(type)) {
            for (String[] appliance : patternLibrary.extractGasAppliances(text)) {
                ObjectNode node = applianceNodes.addObject();
                node.put("type", "Gas Appliance");
                node.put("location", appliance[0]);
                node.put("outcome", appliance[1]);
            }
        }

        double confidence = patterns.isEmpty() ? 0.0 : (double) matched / patterns.size();
        if (requiredMissing > 0) {
            confidence *= 0.5;
        }
        if (!defects.isEmpty()) {
            confidence = Math.min(confidence + 0.1, 1.0);
        }

        log.info("[Template] {} matched {}/{} fields, requiredMissing: {}, defects: {}, confidence: {}",
                type, matched, patterns.size(), requiredMissing, defects.size(), String.format(Locale.ROOT, "%.2f", confidence));

        ProviderResponse response = new ProviderResponse.ParsedJson(data, data.toString());
        if (matched < MIN_MATCHED_FIELDS) {
            return AdapterResult.failure(response, BigDecimal.ZERO,
                    "Template matched only " + matched + " of " + patterns.size() + " fields");
        }
        return AdapterResult.success(response, confidence, BigDecimal.ZERO);
    }
}
