package com.certextract.domain.extraction.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Final result of one extraction run.
 *
 * @param tierReached how far escalation went; TIER_4 when the document was routed to manual review
 * @param attempts    one entry per attempted or skipped tier, in tier order
 */
public record ExtractionResult(
        String runId,
        String certificateId,
        boolean success,
        ExtractedCertificateData data,
        double confidence,
        ExtractionTier tierReached,
        TierStatus status,
        StopReason stopReason,
        boolean requiresReview,
        BigDecimal totalCost,
        long totalProcessingTimeMs,
        FormatAnalysis formatAnalysis,
        List<TierAttemptResult> attempts,
        List<String> warnings
) {
    public enum StopReason {
        ACCEPTED,
        BUDGET_EXHAUSTED,
        MANUAL_REVIEW
    }

    public ExtractionResult {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
