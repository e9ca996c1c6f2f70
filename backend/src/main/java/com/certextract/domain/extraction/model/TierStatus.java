package com.certextract.domain.extraction.model;

public enum TierStatus {
    SUCCESS,
    LOW_CONFIDENCE,
    FAILED,
    SKIPPED
}
