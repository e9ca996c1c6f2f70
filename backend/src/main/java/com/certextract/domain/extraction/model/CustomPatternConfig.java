package com.certextract.domain.extraction.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator-supplied regex patterns for one document type. Each pattern's first capture
 * group is the field value.
 */
public record CustomPatternConfig(Map<String, List<String>> fieldPatterns, List<String> requiredFields) {

    public CustomPatternConfig {
        fieldPatterns = fieldPatterns == null ? Map.of() : new LinkedHashMap<>(fieldPatterns);
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }
}
