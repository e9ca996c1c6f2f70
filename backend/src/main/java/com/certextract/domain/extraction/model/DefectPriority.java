package com.certextract.domain.extraction.model;

import java.util.Locale;

public enum DefectPriority {
    IMMEDIATE,
    URGENT,
    ADVISORY,
    ROUTINE;

    public static DefectPriority fromCode(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
