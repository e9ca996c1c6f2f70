package com.certextract.domain.extraction.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-request overrides of the escalation path.
 *
 * @param forceAi   skip the free tiers and start at the first AI tier
 * @param skipTiers tiers never attempted for this request
 */
public record ExtractionOptions(boolean forceAi, Set<ExtractionTier> skipTiers) {

    public ExtractionOptions {
        skipTiers = skipTiers == null || skipTiers.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(skipTiers));
    }

    public static ExtractionOptions defaults() {
        return new ExtractionOptions(false, Set.of());
    }
}
