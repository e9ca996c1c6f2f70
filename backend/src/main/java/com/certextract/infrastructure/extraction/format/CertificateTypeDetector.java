package com.certextract.infrastructure.extraction.format;

import com.certextract.domain.extraction.model.DocumentClassification;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword rules that guess a certificate type from document text, and the resulting
 * document classification. Rules are checked in order; the first match wins.
 */
@Component
public class CertificateTypeDetector {

    private record TypeRule(String type, List<Pattern> anyOf) {
        boolean matches(String upperText) {
            return anyOf.stream().anyMatch(p -> p.matcher(upperText).find());
        }
    }

    private static final List<TypeRule> RULES = List.of(
            rule("GAS", "LANDLORD GAS SAFETY", "GAS SAFETY RECORD", "\\bCP12\\b", "\\bLGSR\\b",
                    "GAS SAFE[\\s\\S]*APPLIANCE"),
            rule("EICR", "ELECTRICAL INSTALLATION CONDITION REPORT", "\\bEICR\\b", "PERIODIC INSPECTION",
                    "BS ?7671[\\s\\S]*ELECTRICAL"),
            rule("EPC", "ENERGY PERFORMANCE CERTIFICATE", "\\bEPC\\b", "ENERGY EFFICIENCY RATING"),
            rule("FRA", "FIRE RISK ASSESSMENT", "\\bFRA\\b", "PAS ?79", "REGULATORY REFORM"),
            rule("PAT", "PORTABLE APPLIANCE", "PAT TEST", "ELECTRICAL EQUIPMENT TEST"),
            rule("LEGIONELLA", "LEGIONELLA", "WATER HYGIENE", "\\bL8\\b"),
            rule("ASBESTOS", "ASBESTOS", "HSG ?264", "MANAGEMENT SURVEY"),
            rule("LIFT", "\\bLIFT\\b", "\\bLOLER\\b", "LIFTING EQUIPMENT"),
            rule("EMLT", "EMERGENCY LIGHTING", "BS ?5266"),
            rule("FIRE_ALARM", "FIRE ALARM", "BS ?5839"),
            rule("SMOKE_CO", "SMOKE ALARM", "\\bCO ALARM", "CARBON MONOXIDE"),
            rule("FIRE_DOOR", "FIRE DOOR", "DOOR INSPECTION"),
            rule("OIL_TANK", "OIL TANK", "\\bOFTEC\\b"),
            rule("OIL", "\\bOIL\\b[\\s\\S]*(HEATING|BOILER)", "(HEATING|BOILER)[\\s\\S]*\\bOIL\\b"),
            rule("LPG", "\\bLPG\\b"),
            rule("SOLID", "SOLID FUEL", "\\bHETAS\\b"),
            rule("ASHP", "HEAT PUMP", "\\bASHP\\b"),
            rule("GSHP", "GROUND SOURCE")
    );

    private static final Set<String> STRUCTURED_TYPES = Set.of("GAS", "EICR", "EPC", "PAT", "EMLT", "FIRE_ALARM", "SMOKE_CO");
    private static final Set<String> COMPLEX_TYPES = Set.of("FRA", "ASBESTOS", "LEGIONELLA");
    private static final List<String> HANDWRITING_INDICATORS = List.of("HANDWRITTEN", "MANUSCRIPT", "SIGNATURE:");

    /**
     * @return the detected type code, or null when no rule matches
     */
    public String detect(String text) {
        if (text == null || text.isBlank()) return null;
        String upper = text.toUpperCase(Locale.ROOT);
        return RULES.stream()
                .filter(r -> r.matches(upper))
                .map(TypeRule::type)
                .findFirst()
                .orElse(null);
    }

    /**
     * Filename hints such as "cp12_flat3.pdf" or "EICR-2024.pdf".
     */
    public String detectFromFilename(String filename) {
        if (filename == null) return null;
        String normalized = filename.replaceAll("[_\\-.]+", " ");
        return detect(normalized);
    }

    public DocumentClassification classify(String text, String certificateType) {
        if (certificateType != null && STRUCTURED_TYPES.contains(certificateType)) {
            return DocumentClassification.STRUCTURED_CERTIFICATE;
        }
        if (certificateType != null && COMPLEX_TYPES.contains(certificateType)) {
            return DocumentClassification.COMPLEX_DOCUMENT;
        }
        if (text != null) {
            String upper = text.toUpperCase(Locale.ROOT);
            if (HANDWRITING_INDICATORS.stream().anyMatch(upper::contains)) {
                return DocumentClassification.HANDWRITTEN_CONTENT;
            }
        }
        return DocumentClassification.UNKNOWN;
    }

    private static TypeRule rule(String type, String... patterns) {
        return new TypeRule(type, Arrays.stream(patterns).map(Pattern::compile).toList());
    }
}
