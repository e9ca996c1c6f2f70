package com.certextract.infrastructure.ai;

import java.math.BigDecimal;

/**
 * Result of a model call including token usage for cost tracking.
 */
public record LlmCallResult(String content, long promptTokens, long completionTokens) {

    public BigDecimal cost(BigDecimal inputCostPer1k, BigDecimal outputCostPer1k) {
        return inputCostPer1k.multiply(BigDecimal.valueOf(promptTokens))
                .add(outputCostPer1k.multiply(BigDecimal.valueOf(completionTokens)))
                .movePointLeft(3);
    }
}
