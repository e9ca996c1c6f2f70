package com.certextract.infrastructure.settings;

import com.certextract.domain.extraction.exception.ExtractionConfigurationException;
import com.certextract.domain.extraction.model.CustomPatternConfig;
import com.certextract.domain.extraction.model.ExtractionSettings;
import com.certextract.domain.settings.model.FactorySetting;
import com.certextract.domain.settings.repository.FactorySettingRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds an {@link ExtractionSettings} snapshot from the key/value settings store.
 *
 * A value that cannot be parsed falls back to its default with a warning. A value that
 * parses but is out of range makes the whole snapshot invalid.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionSettingsLoader {

    static final String AI_EXTRACTION_ENABLED = "AI_EXTRACTION_ENABLED";
    static final String TIER1_CONFIDENCE_THRESHOLD = "TIER1_CONFIDENCE_THRESHOLD";
    static final String TIER2_CONFIDENCE_THRESHOLD = "TIER2_CONFIDENCE_THRESHOLD";
    static final String TIER3_CONFIDENCE_THRESHOLD = "TIER3_CONFIDENCE_THRESHOLD";
    static final String MAX_COST_PER_DOCUMENT = "MAX_COST_PER_DOCUMENT";
    static final String DOCUMENT_TYPE_THRESHOLDS = "DOCUMENT_TYPE_THRESHOLDS";
    static final String CUSTOM_EXTRACTION_PATTERNS = "CUSTOM_EXTRACTION_PATTERNS";

    static final List<String> KEYS = List.of(
            AI_EXTRACTION_ENABLED, TIER1_CONFIDENCE_THRESHOLD, TIER2_CONFIDENCE_THRESHOLD,
            TIER3_CONFIDENCE_THRESHOLD, MAX_COST_PER_DOCUMENT, DOCUMENT_TYPE_THRESHOLDS,
            CUSTOM_EXTRACTION_PATTERNS);

    private final FactorySettingRepository repository;
    private final ObjectMapper objectMapper;

    public ExtractionSettings load() {
        ExtractionSettings defaults = ExtractionSettings.defaults();

        Map<String, String> values = new HashMap<>();
        try {
            for (FactorySetting setting : repository.findByKeyIn(KEYS)) {
                if (setting.getValue() != null) {
                    values.put(setting.getKey(), setting.getValue().trim());
                }
            }
        } catch (DataAccessException e) {
            log.warn("[Settings] Settings store unavailable, using defaults: {}", e.getMessage());
            return defaults;
        }

        Map<String, Double> documentTypeThresholds = new HashMap<>(ExtractionSettings.DEFAULT_DOCUMENT_TYPE_THRESHOLDS);
        documentTypeThresholds.putAll(parseThresholds(values.get(DOCUMENT_TYPE_THRESHOLDS)));

        try {
            return new ExtractionSettings(
                    parseBoolean(values, AI_EXTRACTION_ENABLED, defaults.aiEnabled()),
                    parseDouble(values, TIER1_CONFIDENCE_THRESHOLD, defaults.tier1Threshold()),
                    parseDouble(values, TIER2_CONFIDENCE_THRESHOLD, defaults.tier2Threshold()),
                    parseDouble(values, TIER3_CONFIDENCE_THRESHOLD, defaults.tier3Threshold()),
                    documentTypeThresholds,
                    parseDecimal(values, MAX_COST_PER_DOCUMENT, defaults.maxCostPerDocument()),
                    parsePatterns(values.get(CUSTOM_EXTRACTION_PATTERNS)));
        } catch (IllegalArgumentException e) {
            throw new ExtractionConfigurationException("Invalid extraction settings: " + e.getMessage(), e);
        }
    }

    private static boolean parseBoolean(Map<String, String> values, String key, boolean fallback) {
        String raw = values.get(key);
        if (raw == null || raw.isEmpty()) return fallback;
        if ("true".equalsIgnoreCase(raw)) return true;
        if ("false".equalsIgnoreCase(raw)) return false;
        log.warn("[Settings] {} is not a boolean ('{}'), using {}", key, raw, fallback);
        return fallback;
    }

    private static double parseDouble(Map<String, String> values, String key, double fallback) {
        String raw = values.get(key);
        if (raw == null || raw.isEmpty()) return fallback;
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            log.warn("[Settings] {} is not a number ('{}'), using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static BigDecimal parseDecimal(Map<String, String> values, String key, BigDecimal fallback) {
        String raw = values.get(key);
        if (raw == null || raw.isEmpty()) return fallback;
        try {
            return new BigDecimal(raw);
        } catch (NumberFormatException e) {
            log.warn("[Settings] {} is not a number ('{}'), using {}", key, raw, fallback);
            return fallback;
        }
    }

    private Map<String, Double> parseThresholds(String raw) {
        JsonNode root = readObject(DOCUMENT_TYPE_THRESHOLDS, raw);
        if (root == null) return Map.of();
        Map<String, Double> thresholds = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getValue().isNumber()) {
                thresholds.put(entry.getKey().toUpperCase(Locale.ROOT), entry.getValue().asDouble());
            } else {
                log.warn("[Settings] Ignoring non-numeric threshold for {}", entry.getKey());
            }
        }
        return thresholds;
    }

    /**
     * Expected shape: {"GAS": {"fields": {"certificateNumber": ["regex", ...]}, "requiredFields": ["certificateNumber"]}}.
     * A single regex string is accepted in place of a list.
     */
    private Map<String, CustomPatternConfig> parsePatterns(String raw) {
        JsonNode root = readObject(CUSTOM_EXTRACTION_PATTERNS, raw);
        if (root == null) return Map.of();
        Map<String, CustomPatternConfig> patterns = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> types = root.fields();
        while (types.hasNext()) {
            Map.Entry<String, JsonNode> type = types.next();
            JsonNode fieldsNode = type.getValue().path("fields");
            if (!fieldsNode.isObject()) {
                log.warn("[Settings] Custom patterns for {} have no 'fields' object", type.getKey());
                continue;
            }
            Map<String, List<String>> fieldPatterns = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = fieldsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                List<String> regexes = strings(field.getValue());
                if (!regexes.isEmpty()) {
                    fieldPatterns.put(field.getKey(), regexes);
                }
            }
            patterns.put(type.getKey().toUpperCase(Locale.ROOT),
                    new CustomPatternConfig(fieldPatterns, strings(type.getValue().path("requiredFields"))));
        }
        return patterns;
    }

    private JsonNode readObject(String key, String raw) {
        if (raw == null || raw.isEmpty()) return null;
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node != null && node.isObject()) return node;
            log.warn("[Settings] {} is not a JSON object, ignoring", key);
        } catch (JsonProcessingException e) {
            log.warn("[Settings] {} is not valid JSON, ignoring: {}", key, e.getOriginalMessage());
        }
        return null;
    }

    private static List<String> strings(JsonNode node) {
        List<String> result = new ArrayList<>();
        if (node.isTextual()) {
            result.add(node.asText());
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual()) result.add(item.asText());
            }
        }
        return result;
    }
}
