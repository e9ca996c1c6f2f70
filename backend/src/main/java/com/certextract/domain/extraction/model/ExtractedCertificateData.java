package com.certextract.domain.extraction.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical extraction output. Unknown scalar fields are null and are still serialized,
 * so consumers can rely on every key being present.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ExtractedCertificateData(
        String certificateType,
        String certificateNumber,
        String propertyAddress,
        String uprn,
        String inspectionDate,
        String expiryDate,
        String nextInspectionDate,
        CertificateOutcome outcome,
        String engineerName,
        String engineerRegistration,
        String contractorName,
        String contractorRegistration,
        List<ApplianceRecord> appliances,
        List<DefectRecord> defects,
        Map<String, String> additionalFields
) {
    public static final String UNKNOWN_TYPE = "UNKNOWN";

    public ExtractedCertificateData {
        certificateType = certificateType == null || certificateType.isBlank() ? UNKNOWN_TYPE : certificateType;
        appliances = appliances == null ? List.of() : List.copyOf(appliances);
        defects = defects == null ? List.of() : List.copyOf(defects);
        additionalFields = additionalFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalFields));
    }

    public static ExtractedCertificateData empty(String certificateType) {
        return new ExtractedCertificateData(certificateType, null, null, null, null, null, null, null,
                null, null, null, null, List.of(), List.of(), Map.of());
    }

    public boolean hasKnownType() {
        return !UNKNOWN_TYPE.equals(certificateType);
    }
}
