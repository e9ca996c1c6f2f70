package com.certextract.domain.extraction.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of outcomes a certificate can state. Anything else is treated as unknown.
 */
public enum CertificateOutcome {
    PASS("PASS"),
    FAIL("FAIL"),
    SATISFACTORY("SATISFACTORY"),
    UNSATISFACTORY("UNSATISFACTORY"),
    NOT_APPLICABLE("N/A");

    private final String code;

    CertificateOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @return the matching outcome, or null when the value is not one of the closed set
     */
    public static CertificateOutcome fromCode(String value) {
        if (value == null) return null;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CertificateOutcome outcome : values()) {
            if (outcome.code.equals(normalized)) {
                return outcome;
            }
        }
        return null;
    }
}
