package com.certextract.infrastructure.resilience;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Breaker for one named dependency. State lives in a single {@link AtomicReference} and every
 * transition is a compare-and-set, so concurrent callers share the circuit without a lock.
 */
@Slf4j
public class CircuitBreaker {

    @Getter
    private final String name;
    @Getter
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final AtomicReference<CircuitState> state = new AtomicReference<>(CircuitState.closed());

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    public CircuitState getState() {
        return state.get();
    }

    public <T> T execute(Supplier<T> operation) {
        acquirePermission();
        try {
            T result = operation.get();
            onSuccess();
            return result;
        } catch (ExtractionCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            onFailure(e);
            throw e;
        }
    }

    public void reset() {
        CircuitState previous = state.getAndSet(CircuitState.closed());
        if (previous.phase() != CircuitState.Phase.CLOSED) {
            log.info("[Circuit] {}: manually reset from {}", name, previous.phase());
        }
    }

    private void acquirePermission() {
        while (true) {
            CircuitState current = state.get();
            if (current.phase() != CircuitState.Phase.OPEN) {
                return;
            }
            long elapsed = clock.millis() - current.lastFailureAtMillis();
            long resetMillis = config.resetTimeout().toMillis();
            if (elapsed < resetMillis) {
                throw new CircuitOpenException(name, resetMillis - elapsed);
            }
            if (state.compareAndSet(current, current.toHalfOpen())) {
                log.info("[Circuit] {}: OPEN -> HALF_OPEN after {}ms", name, elapsed);
                return;
            }
        }
    }

    private void onSuccess() {
        CircuitState previous = state.getAndUpdate(s -> s.afterSuccess(config.halfOpenRequests()));
        if (previous.phase() == CircuitState.Phase.HALF_OPEN
                && previous.halfOpenSuccesses() + 1 >= config.halfOpenRequests()) {
            log.info("[Circuit] {}: HALF_OPEN -> CLOSED", name);
        }
    }

    private void onFailure(RuntimeException error) {
        long now = clock.millis();
        CircuitState previous = state.getAndUpdate(s -> s.afterFailure(now, config.failureThreshold()));
        CircuitState next = previous.afterFailure(now, config.failureThreshold());
        if (previous.phase() != CircuitState.Phase.OPEN && next.phase() == CircuitState.Phase.OPEN) {
            log.warn("[Circuit] {}: {} -> OPEN after {} consecutive failures (last: {})",
                    name, previous.phase(), next.consecutiveFailures(), error.getMessage());
        }
    }
}
