package com.certextract.domain.extraction.model;

public enum DocumentClassification {
    STRUCTURED_CERTIFICATE,
    COMPLEX_DOCUMENT,
    HANDWRITTEN_CONTENT,
    SPREADSHEET,
    UNKNOWN,
    UNREADABLE
}
