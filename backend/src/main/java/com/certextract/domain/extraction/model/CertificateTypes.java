package com.certextract.domain.extraction.model;

import java.util.Locale;
import java.util.Set;

/**
 * Certificate type codes the extraction pipeline recognises.
 */
public final class CertificateTypes {

    public static final Set<String> KNOWN = Set.of(
            "GAS", "GAS_SVC", "EICR", "EPC", "PAT", "EMLT", "FIRE_ALARM", "SMOKE_CO", "FIRE_DOOR",
            "FRA", "FIRE_RISK_ASSESSMENT", "FRAEW", "BSC", "BUILDING_SAFETY",
            "ASBESTOS", "ASB", "LEGIONELLA", "LIFT", "LOLER",
            "OIL", "OIL_TANK", "LPG", "SOLID", "ASHP", "GSHP", "SPRINKLER", "AOV", "WATER_TANK"
    );

    private CertificateTypes() {
    }

    /**
     * @return the upper-cased code when recognised, otherwise null
     */
    public static String normalize(String code) {
        if (code == null || code.isBlank()) return null;
        String upper = code.trim().toUpperCase(Locale.ROOT);
        return KNOWN.contains(upper) ? upper : null;
    }
}
