package com.certextract.domain.extraction.model;

import java.math.BigDecimal;

/**
 * Extraction strategies in their fixed, cost-ascending escalation order.
 *
 * TIER_0 is format analysis and is never an extraction attempt. TIER_4 is the terminal
 * manual-review state.
 */
public enum ExtractionTier {

    TIER_0("tier-0", 0, "0"),
    TIER_0_5("tier-0.5", 1, "0"),
    TIER_1("tier-1", 2, "0"),
    TIER_1_5("tier-1.5", 3, "0.003"),
    TIER_2("tier-2", 4, "0.0015"),
    TIER_3("tier-3", 5, "0.01"),
    TIER_4("tier-4", 6, "0");

    private final String code;
    private final int order;
    private final BigDecimal estimatedCost;

    ExtractionTier(String code, int order, String estimatedCost) {
        this.code = code;
        this.order = order;
        this.estimatedCost = new BigDecimal(estimatedCost);
    }

    public String getCode() {
        return code;
    }

    public int getOrder() {
        return order;
    }

    public BigDecimal getEstimatedCost() {
        return estimatedCost;
    }

    public boolean isAiTier() {
        return this == TIER_1_5 || this == TIER_2 || this == TIER_3;
    }

    public boolean isFreeTier() {
        return this == TIER_0_5 || this == TIER_1;
    }
}
