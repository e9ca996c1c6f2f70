package com.certextract.infrastructure.resilience;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Exponential backoff schedule. {@link #nextDelay(int)} is pure, so the policy can be
 * reasoned about without sleeping.
 */
public record BackoffPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1: " + multiplier);
        }
        if (initialDelay == null || initialDelay.isNegative() || maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must be zero or positive");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);
    }

    /**
     * Delay to wait after the given failed attempt (1-based), capped at maxDelay.
     */
    public Duration nextDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based: " + attempt);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * The same schedule as a Resilience4j interval function. Zero or inverted delays, which the
     * library's exponential backoff rejects, fall back to {@link #nextDelay(int)} directly.
     */
    public IntervalFunction toIntervalFunction() {
        if (initialDelay.toMillis() >= 1 && maxDelay.compareTo(initialDelay) >= 0) {
            return IntervalFunction.ofExponentialBackoff(initialDelay, multiplier, maxDelay);
        }
        return attempt -> nextDelay(attempt).toMillis();
    }
}
