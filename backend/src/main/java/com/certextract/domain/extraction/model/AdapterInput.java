package com.certextract.domain.extraction.model;

/**
 * Normalized input handed to every adapter. Adapters pick the representation they need:
 * extracted text, or the original bytes with their mime type.
 */
public record AdapterInput(
        byte[] content,
        String mimeType,
        String filename,
        String text,
        String certificateType,
        FormatAnalysis analysis,
        CustomPatternConfig customPatterns
) {
    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean isImage() {
        return analysis != null && analysis.format() == DocumentFormat.IMAGE;
    }
}
