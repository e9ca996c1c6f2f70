package com.certextract.infrastructure.extraction.mapping;

import com.certextract.domain.extraction.model.ApplianceRecord;
import com.certextract.domain.extraction.model.CertificateOutcome;
import com.certextract.domain.extraction.model.CertificateTypes;
import com.certextract.domain.extraction.model.DefectPriority;
import com.certextract.domain.extraction.model.DefectRecord;
import com.certextract.domain.extraction.model.ExtractedCertificateData;
import com.certextract.domain.extraction.model.ProviderResponse;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Normalizes raw provider output into {@link ExtractedCertificateData} and scores its completeness.
 * Mapping never throws: anything outside the expected shape becomes null or empty.
 */
@Component
public class ExtractedDataMapper {

    static final int LOAD_BEARING_FIELDS = 7;
    private static final double MIN_CONFIDENCE = 0.1;
    private static final double MAX_CONFIDENCE = 0.95;
    private static final double COMPLETENESS_WEIGHT = 0.9;

    public ExtractedCertificateData map(ProviderResponse response, String fallbackType) {
        if (response instanceof ProviderResponse.ParsedJson parsed) {
            return map(parsed.json(), fallbackType);
        }
        return ExtractedCertificateData.empty(CertificateTypes.normalize(fallbackType));
    }

    public ExtractedCertificateData map(JsonNode raw, String fallbackType) {
        if (raw == null || !raw.isObject()) {
            return ExtractedCertificateData.empty(CertificateTypes.normalize(fallbackType));
        }

        String type = CertificateTypes.normalize(text(raw, "certificateType"));
        if (type == null) {
            type = CertificateTypes.normalize(fallbackType);
        }

        return new ExtractedCertificateData(
                type,
                text(raw, "certificateNumber"),
                text(raw, "propertyAddress"),
                text(raw, "uprn"),
                text(raw, "inspectionDate"),
                text(raw, "expiryDate"),
                text(raw, "nextInspectionDate"),
                CertificateOutcome.fromCode(text(raw, "outcome")),
                text(raw, "engineerName"),
                text(raw, "engineerRegistration"),
                text(raw, "contractorName"),
                text(raw, "contractorRegistration"),
                appliances(raw.get("appliances")),
                defects(raw.get("defects")),
                additionalFields(raw.get("additionalFields"))
        );
    }

    /**
     * Completeness of the load-bearing fields: {@code 0.1 + 0.9 * filled/7}, capped at 0.95.
     */
    public double calculateConfidence(ExtractedCertificateData data) {
        if (data == null) return MIN_CONFIDENCE;
        long filled = Stream.of(
                data.hasKnownType() ? data.certificateType() : null,
                data.certificateNumber(),
                data.propertyAddress(),
                data.inspectionDate(),
                data.expiryDate(),
                data.outcome() != null ? data.outcome().getCode() : null,
                data.engineerName() != null ? data.engineerName() : data.contractorName()
        ).filter(v -> v != null && !v.isBlank()).count();

        return Math.min(MAX_CONFIDENCE, MIN_CONFIDENCE + COMPLETENESS_WEIGHT * filled / LOAD_BEARING_FIELDS);
    }

    public int countFields(ExtractedCertificateData data) {
        if (data == null) return 0;
        int count = (int) Stream.of(
                data.certificateNumber(), data.propertyAddress(), data.uprn(),
                data.inspectionDate(), data.expiryDate(), data.nextInspectionDate(),
                data.engineerName(), data.engineerRegistration(),
                data.contractorName(), data.contractorRegistration()
        ).filter(v -> v != null && !v.isBlank()).count();
        if (data.hasKnownType()) count++;
        if (data.outcome() != null) count++;
        if (!data.appliances().isEmpty()) count++;
        if (!data.defects().isEmpty()) count++;
        return count;
    }

    private List<ApplianceRecord> appliances(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<ApplianceRecord> result = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isObject()) continue;
            result.add(new ApplianceRecord(
                    text(item, "location"),
                    text(item, "type"),
                    text(item, "make"),
                    text(item, "model"),
                    text(item, "serialNumber"),
                    CertificateOutcome.fromCode(text(item, "outcome")),
                    stringList(item.get("defects"))));
        }
        return result;
    }

    private List<DefectRecord> defects(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<DefectRecord> result = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isObject()) continue;
            result.add(new DefectRecord(
                    text(item, "code"),
                    text(item, "description"),
                    text(item, "location"),
                    DefectPriority.fromCode(text(item, "priority"))));
        }
        return result;
    }

    private Map<String, String> additionalFields(JsonNode node) {
        if (node == null || !node.isObject()) return Map.of();
        Map<String, String> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (value == null || value.isNull() || value.isMissingNode()) continue;
            result.put(entry.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return result;
    }

    private List<String> stringList(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<String> result = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.isNull()) {
                result.add(item.asText());
            }
        }
        return result;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) return null;
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
