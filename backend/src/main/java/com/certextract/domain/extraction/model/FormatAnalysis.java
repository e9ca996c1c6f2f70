package com.certextract.domain.extraction.model;

/**
 * Result of local format analysis. textContent is null when no text could be read.
 */
public record FormatAnalysis(
        DocumentFormat format,
        DocumentClassification classification,
        int pageCount,
        boolean hasTextLayer,
        boolean isScanned,
        boolean isHybrid,
        double textQuality,
        String textContent,
        String detectedCertificateType
) {
    public boolean isUnreadable() {
        return classification == DocumentClassification.UNREADABLE;
    }

    public boolean hasUsableText() {
        return hasTextLayer && textContent != null && !textContent.isBlank();
    }
}
