package com.certextract.infrastructure.resilience;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Resilience defaults plus per-circuit overrides. Unset override fields fall back to the defaults.
 */
@Component
@ConfigurationProperties(prefix = "resilience")
@Data
public class ResilienceProperties {

    private Policy defaults = Policy.withDefaults();
    private Map<String, Policy> circuits = new HashMap<>();

    @Data
    public static class Policy {
        private Integer failureThreshold;
        private Duration resetTimeout;
        private Integer halfOpenRequests;
        private Duration timeout;
        private Integer maxAttempts;
        private Duration initialDelay;
        private Duration maxDelay;
        private Double backoffMultiplier;

        static Policy withDefaults() {
            Policy policy = new Policy();
            policy.setFailureThreshold(5);
            policy.setResetTimeout(Duration.ofSeconds(60));
            policy.setHalfOpenRequests(3);
            policy.setTimeout(Duration.ofSeconds(30));
            policy.setMaxAttempts(3);
            policy.setInitialDelay(Duration.ofSeconds(1));
            policy.setMaxDelay(Duration.ofSeconds(30));
            policy.setBackoffMultiplier(2.0);
            return policy;
        }
    }

    public record ResolvedPolicy(CircuitBreakerConfig circuitBreaker, BackoffPolicy backoff, Duration timeout) {}

    public ResolvedPolicy resolve(String circuitName) {
        Policy override = circuits.getOrDefault(circuitName, new Policy());
        Policy base = defaults;
        CircuitBreakerConfig breaker = new CircuitBreakerConfig(
                pick(override.getFailureThreshold(), base.getFailureThreshold(), 5),
                pick(override.getResetTimeout(), base.getResetTimeout(), Duration.ofSeconds(60)),
                pick(override.getHalfOpenRequests(), base.getHalfOpenRequests(), 3));
        BackoffPolicy backoff = new BackoffPolicy(
                pick(override.getMaxAttempts(), base.getMaxAttempts(), 3),
                pick(override.getInitialDelay(), base.getInitialDelay(), Duration.ofSeconds(1)),
                pick(override.getMaxDelay(), base.getMaxDelay(), Duration.ofSeconds(30)),
                pick(override.getBackoffMultiplier(), base.getBackoffMultiplier(), 2.0));
        Duration timeout = pick(override.getTimeout(), base.getTimeout(), Duration.ofSeconds(30));
        return new ResolvedPolicy(breaker, backoff, timeout);
    }

    private static <T> T pick(T override, T base, T fallback) {
        if (override != null) return override;
        return base != null ? base : fallback;
    }
}
