package com.certextract.domain.extraction.model;

import java.math.BigDecimal;

/**
 * Outcome of one tier attempt within a run.
 */
public record TierAttemptResult(
        ExtractionTier tier,
        TierStatus status,
        String adapterName,
        double confidence,
        long durationMs,
        int fieldCount,
        BigDecimal cost,
        String escalationReason,
        String rawOutput,
        ExtractedCertificateData data
) {
    public static TierAttemptResult skipped(ExtractionTier tier, String reason) {
        return new TierAttemptResult(tier, TierStatus.SKIPPED, null, 0.0, 0L, 0,
                BigDecimal.ZERO, reason, null, null);
    }

    public boolean hasData() {
        return data != null && confidence > 0.0
                && (status == TierStatus.SUCCESS || status == TierStatus.LOW_CONFIDENCE);
    }
}
