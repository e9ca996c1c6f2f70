package com.certextract.domain.extraction.model;

public enum DocumentFormat {
    PDF_NATIVE,
    PDF_SCANNED,
    PDF_HYBRID,
    DOCX,
    XLSX,
    CSV,
    HTML,
    TXT,
    EMAIL,
    IMAGE;

    public boolean isPdf() {
        return this == PDF_NATIVE || this == PDF_SCANNED || this == PDF_HYBRID;
    }
}
