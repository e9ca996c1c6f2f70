package com.certextract.infrastructure.resilience;

/**
 * Immutable snapshot of one named circuit. Transitions return a new snapshot so they can be
 * applied with a single compare-and-set.
 */
public record CircuitState(Phase phase, int consecutiveFailures, int halfOpenSuccesses, long lastFailureAtMillis) {

    public enum Phase {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    public static CircuitState closed() {
        return new CircuitState(Phase.CLOSED, 0, 0, 0L);
    }

    CircuitState toHalfOpen() {
        return new CircuitState(Phase.HALF_OPEN, consecutiveFailures, 0, lastFailureAtMillis);
    }

    CircuitState afterSuccess(int halfOpenRequests) {
        return switch (phase) {
            case HALF_OPEN -> halfOpenSuccesses + 1 >= halfOpenRequests
                    ? new CircuitState(Phase.CLOSED, 0, 0, lastFailureAtMillis)
                    : new CircuitState(Phase.HALF_OPEN, consecutiveFailures, halfOpenSuccesses + 1, lastFailureAtMillis);
            case CLOSED -> consecutiveFailures == 0
                    ? this
                    : new CircuitState(Phase.CLOSED, 0, 0, lastFailureAtMillis);
            // a call admitted before the circuit opened; the open period still runs its course
            case OPEN -> this;
        };
    }

    CircuitState afterFailure(long nowMillis, int failureThreshold) {
        int failures = consecutiveFailures + 1;
        return switch (phase) {
            case HALF_OPEN, OPEN -> new CircuitState(Phase.OPEN, failures, 0, nowMillis);
            case CLOSED -> failures >= failureThreshold
                    ? new CircuitState(Phase.OPEN, failures, 0, nowMillis)
                    : new CircuitState(Phase.CLOSED, failures, 0, nowMillis);
        };
    }
}
