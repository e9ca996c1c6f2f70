package com.certextract.domain.extraction.model;

import java.util.Objects;

/**
 * A single document to extract.
 *
 * @param declaredCertificateType type code supplied by the uploader; null when unknown
 */
public record ExtractionRequest(
        String certificateId,
        byte[] content,
        String mimeType,
        String filename,
        String declaredCertificateType,
        ExtractionOptions options
) {
    public ExtractionRequest {
        Objects.requireNonNull(certificateId, "certificateId");
        content = content == null ? new byte[0] : content;
        options = options == null ? ExtractionOptions.defaults() : options;
    }

    public static ExtractionRequest of(String certificateId, byte[] content, String mimeType,
                                       String filename, String declaredCertificateType) {
        return new ExtractionRequest(certificateId, content, mimeType, filename,
                declaredCertificateType, ExtractionOptions.defaults());
    }
}
