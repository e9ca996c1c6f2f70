package com.certextract.domain.extraction.model;

import java.math.BigDecimal;

/**
 * Uniform adapter output.
 *
 * @param confidence provider-reported confidence, or null to let the mapping layer score completeness
 * @param cost       actual cost reported by the provider call
 */
public record AdapterResult(
        boolean success,
        ProviderResponse response,
        Double confidence,
        BigDecimal cost,
        String error
) {
    public AdapterResult {
        cost = cost == null ? BigDecimal.ZERO : cost;
    }

    public static AdapterResult success(ProviderResponse response, Double confidence, BigDecimal cost) {
        return new AdapterResult(true, response, confidence, cost, null);
    }

    public static AdapterResult failure(ProviderResponse response, BigDecimal cost, String error) {
        return new AdapterResult(false, response, 0.0, cost, error);
    }

    public static AdapterResult nothingFound(String error) {
        return new AdapterResult(false, null, 0.0, BigDecimal.ZERO, error);
    }
}
