package com.certextract.application.extraction;

import com.certextract.domain.extraction.model.DocumentFormat;
import com.certextract.domain.extraction.model.ExtractionOptions;
import com.certextract.domain.extraction.model.ExtractionSettings;
import com.certextract.domain.extraction.model.ExtractionTier;
import com.certextract.domain.extraction.model.FormatAnalysis;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Pure decision rules for the tier traversal: which tiers apply to a document, whether the
 * next tier fits the cost ceiling, and whether a confidence clears the bar.
 */
@Component
public class EscalationPolicy {

    /**
     * Tiers that can produce an extraction, in escalation order. TIER_0 (format analysis)
     * runs before them and TIER_4 (manual review) after.
     */
    public static final List<ExtractionTier> ESCALATION_ORDER = List.of(
            ExtractionTier.TIER_0_5,
            ExtractionTier.TIER_1,
            ExtractionTier.TIER_1_5,
            ExtractionTier.TIER_2,
            ExtractionTier.TIER_3
    );

    public record Decision(boolean accepted, double threshold, String reason) {}

    public boolean isApplicable(ExtractionTier tier, FormatAnalysis analysis, ExtractionOptions options) {
        if (options.skipTiers().contains(tier)) return false;
        if (options.forceAi() && tier.isFreeTier()) return false;
        // nothing cheap can read an unreadable document
        if (analysis.isUnreadable()) return tier == ExtractionTier.TIER_3;

        return switch (tier) {
            case TIER_0_5 -> analysis.isScanned() || analysis.format() == DocumentFormat.IMAGE;
            case TIER_1, TIER_1_5 -> analysis.hasUsableText();
            case TIER_2, TIER_3 -> true;
            case TIER_0, TIER_4 -> false;
        };
    }

    /**
     * Uses the static per-tier estimate, not measured spend.
     */
    public boolean exceedsBudget(BigDecimal projectedSoFar, ExtractionTier next, BigDecimal maxCostPerDocument) {
        BigDecimal cost = next.getEstimatedCost();
        return cost.signum() > 0 && projectedSoFar.add(cost).compareTo(maxCostPerDocument) > 0;
    }

    public Decision evaluate(ExtractionTier tier, double confidence, ExtractionSettings settings, String certificateType) {
        double threshold = settings.effectiveThreshold(tier, certificateType);
        if (confidence >= threshold) {
            return new Decision(true, threshold, null);
        }
        String reason = String.format(Locale.ROOT, "confidence %.2f below threshold %.2f for %s",
                confidence, threshold, certificateType == null ? "UNKNOWN" : certificateType);
        return new Decision(false, threshold, reason);
    }
}
