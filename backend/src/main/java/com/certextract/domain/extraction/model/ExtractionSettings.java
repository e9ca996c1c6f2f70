package com.certextract.domain.extraction.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable settings snapshot, loaded once per extraction run.
 */
public record ExtractionSettings(
        boolean aiEnabled,
        double tier1Threshold,
        double tier2Threshold,
        double tier3Threshold,
        Map<String, Double> documentTypeThresholds,
        BigDecimal maxCostPerDocument,
        Map<String, CustomPatternConfig> customPatterns
) {
    public static final double QR_THRESHOLD = 0.95;

    public static final Map<String, Double> DEFAULT_DOCUMENT_TYPE_THRESHOLDS = Map.of(
            "FRA", 0.70,
            "FIRE_RISK_ASSESSMENT", 0.70,
            "BSC", 0.70,
            "BUILDING_SAFETY", 0.70,
            "FRAEW", 0.70,
            "ASB", 0.75,
            "ASBESTOS", 0.75
    );

    public ExtractionSettings {
        requireProbability("tier1Threshold", tier1Threshold);
        requireProbability("tier2Threshold", tier2Threshold);
        requireProbability("tier3Threshold", tier3Threshold);
        if (maxCostPerDocument == null || maxCostPerDocument.signum() < 0) {
            throw new IllegalArgumentException("maxCostPerDocument must be zero or positive: " + maxCostPerDocument);
        }
        documentTypeThresholds = documentTypeThresholds == null ? Map.of() : Map.copyOf(documentTypeThresholds);
        documentTypeThresholds.forEach((type, value) -> requireProbability("documentTypeThresholds." + type, value));
        customPatterns = customPatterns == null ? Map.of() : Map.copyOf(customPatterns);
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(false, 0.85, 0.80, 0.70,
                DEFAULT_DOCUMENT_TYPE_THRESHOLDS, new BigDecimal("0.05"), Map.of());
    }

    public double tierThreshold(ExtractionTier tier) {
        return switch (tier) {
            case TIER_0_5 -> QR_THRESHOLD;
            case TIER_1, TIER_1_5 -> tier1Threshold;
            case TIER_2 -> tier2Threshold;
            case TIER_3 -> tier3Threshold;
            case TIER_0, TIER_4 -> 0.0;
        };
    }

    /**
     * Document-type override when one exists, otherwise the tier's own threshold.
     */
    public double effectiveThreshold(ExtractionTier tier, String certificateType) {
        if (certificateType != null) {
            Double override = documentTypeThresholds.get(certificateType.toUpperCase(Locale.ROOT));
            if (override != null) {
                return override;
            }
        }
        return tierThreshold(tier);
    }

    public CustomPatternConfig customPatternsFor(String certificateType) {
        if (certificateType == null) return null;
        return customPatterns.get(certificateType.toUpperCase(Locale.ROOT));
    }

    private static void requireProbability(String name, Double value) {
        if (value == null || value.isNaN() || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1]: " + value);
        }
    }
}
