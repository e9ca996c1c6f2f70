package com.certextract.infrastructure.resilience;

import lombok.Getter;

@Getter
public class CircuitOpenException extends RuntimeException {

    private final String circuitName;
    private final long retryAfterMs;

    public CircuitOpenException(String circuitName, long retryAfterMs) {
        super("Circuit breaker " + circuitName + " is OPEN, retry after " + retryAfterMs + "ms");
        this.circuitName = circuitName;
        this.retryAfterMs = retryAfterMs;
    }
}
