package com.certextract.infrastructure.resilience;

import java.time.Duration;

public record CircuitBreakerConfig(int failureThreshold, Duration resetTimeout, int halfOpenRequests) {

    public CircuitBreakerConfig {
        if (failureThreshold < 1 || halfOpenRequests < 1) {
            throw new IllegalArgumentException("failureThreshold and halfOpenRequests must be at least 1");
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be zero or positive");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, Duration.ofSeconds(60), 3);
    }
}
