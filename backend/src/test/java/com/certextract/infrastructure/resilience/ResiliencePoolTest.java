package com.certextract.infrastructure.resilience;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResiliencePoolTest {

    private static final BackoffPolicy NO_WAIT = new BackoffPolicy(3, Duration.ZERO, Duration.ZERO, 2.0);

    private MutableClock clock;
    private ResilienceProperties properties;
    private ResiliencePool pool;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        properties = new ResilienceProperties();
        properties.getDefaults().setInitialDelay(Duration.ZERO);
        properties.getDefaults().setMaxDelay(Duration.ZERO);
        properties.getDefaults().setTimeout(Duration.ofSeconds(5));

        ResilienceProperties.Policy vision = new ResilienceProperties.Policy();
        vision.setFailureThreshold(2);
        vision.setMaxAttempts(1);
        properties.setCircuits(Map.of("openai-vision", vision));

        pool = new ResiliencePool(properties, clock);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Nested
    @DisplayName("withRetry")
    class Retry {

        @Test
        void returns_first_success() {
            AtomicInteger calls = new AtomicInteger();

            String result = pool.withRetry(() -> {
                if (calls.incrementAndGet() < 3) throw new ExtractionTransportException("HTTP 502");
                return "ok";
            }, NO_WAIT, ResiliencePool.RetryListener.noop());

            assertThat(result).isEqualTo("ok");
            assertThat(calls).hasValue(3);
        }

        @Test
        void rethrows_last_error_and_notifies_listener_between_attempts() {
            List<Integer> retried = new ArrayList<>();
            AtomicInteger calls = new AtomicInteger();

            assertThatThrownBy(() -> pool.withRetry(() -> {
                throw new ExtractionTransportException("HTTP 500 #" + calls.incrementAndGet());
            }, NO_WAIT, (error, attempt) -> retried.add(attempt)))
                    .isInstanceOf(ExtractionTransportException.class)
                    .hasMessage("HTTP 500 #3");
            assertThat(retried).containsExactly(1, 2);
        }

        @Test
        void wraps_checked_exceptions() {
            assertThatThrownBy(() -> pool.withRetry(() -> {
                throw new IOException("connection reset");
            }, new BackoffPolicy(1, Duration.ZERO, Duration.ZERO, 1.0), ResiliencePool.RetryListener.noop()))
                    .isInstanceOf(ExtractionTransportException.class)
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        void stops_when_the_caller_is_interrupted() {
            Thread.currentThread().interrupt();
            try {
                assertThatThrownBy(() -> pool.withRetry(() -> "never", NO_WAIT, ResiliencePool.RetryListener.noop()))
                        .isInstanceOf(ExtractionCancelledException.class);
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        void interrupt_during_backoff_cancels_instead_of_retrying() {
            AtomicInteger calls = new AtomicInteger();
            BackoffPolicy slow = new BackoffPolicy(3, Duration.ofSeconds(5), Duration.ofSeconds(5), 2.0);
            Thread caller = Thread.currentThread();
            try {
                assertThatThrownBy(() -> pool.withRetry(() -> {
                    calls.incrementAndGet();
                    caller.interrupt();
                    throw new ExtractionTransportException("HTTP 502");
                }, slow, ResiliencePool.RetryListener.noop()))
                        .isInstanceOf(ExtractionCancelledException.class)
                        .hasCauseInstanceOf(ExtractionTransportException.class);
                assertThat(calls).hasValue(1);
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        void cancellation_is_never_retried() {
            AtomicInteger calls = new AtomicInteger();

            assertThatThrownBy(() -> pool.withRetry(() -> {
                calls.incrementAndGet();
                throw new ExtractionCancelledException("stopped");
            }, NO_WAIT, ResiliencePool.RetryListener.noop()))
                    .isInstanceOf(ExtractionCancelledException.class);
            assertThat(calls).hasValue(1);
        }
    }

    @Nested
    @DisplayName("withTimeout")
    class Timeout {

        @Test
        void returns_value_within_timeout() {
            assertThat(pool.withTimeout(() -> 42, Duration.ofSeconds(1))).isEqualTo(42);
        }

        @Test
        void abandons_a_slow_call() throws InterruptedException {
            CountDownLatch interrupted = new CountDownLatch(1);

            assertThatThrownBy(() -> pool.withTimeout(() -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                }
                return "late";
            }, Duration.ofMillis(50)))
                    .isInstanceOf(ExtractionTimeoutException.class);
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        void propagates_the_call_error() {
            assertThatThrownBy(() -> pool.withTimeout(() -> {
                throw new ExtractionTransportException("HTTP 401");
            }, Duration.ofSeconds(1)))
                    .isInstanceOf(ExtractionTransportException.class)
                    .hasMessage("HTTP 401");
        }
    }

    @Nested
    @DisplayName("execute")
    class Execute {

        @Test
        void exhausted_retries_count_as_one_circuit_failure() {
            assertThatThrownBy(() -> pool.execute("azure-document-intelligence", () -> {
                throw new ExtractionTransportException("HTTP 503");
            })).isInstanceOf(ExtractionTransportException.class);

            assertThat(pool.circuitStates().get("azure-document-intelligence").consecutiveFailures()).isEqualTo(1);
        }

        @Test
        void per_circuit_overrides_apply() {
            AtomicInteger calls = new AtomicInteger();
            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> pool.execute("openai-vision", () -> {
                    calls.incrementAndGet();
                    throw new ExtractionTransportException("HTTP 500");
                })).isInstanceOf(ExtractionTransportException.class);
            }

            assertThat(calls).hasValue(2);
            assertThat(pool.circuit("openai-vision").getState().phase()).isEqualTo(CircuitState.Phase.OPEN);
            assertThatThrownBy(() -> pool.execute("openai-vision", () -> "x"))
                    .isInstanceOf(CircuitOpenException.class);
        }

        @Test
        void circuits_are_independent() {
            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> pool.execute("openai-vision", () -> {
                    throw new ExtractionTransportException("HTTP 500");
                })).isInstanceOf(ExtractionTransportException.class);
            }

            assertThat(pool.execute("openai-text", () -> "fine")).isEqualTo("fine");
        }

        @Test
        void reset_reopens_for_traffic() {
            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> pool.execute("openai-vision", () -> {
                    throw new ExtractionTransportException("HTTP 500");
                })).isInstanceOf(ExtractionTransportException.class);
            }

            pool.reset("openai-vision");

            assertThat(pool.execute("openai-vision", () -> "ok")).isEqualTo("ok");
        }
    }

    @Test
    void resolves_defaults_for_unknown_circuits() {
        ResilienceProperties.ResolvedPolicy policy = properties.resolve("ollama");

        assertThat(policy.circuitBreaker().failureThreshold()).isEqualTo(5);
        assertThat(policy.backoff().maxAttempts()).isEqualTo(3);
        assertThat(policy.timeout()).isEqualTo(Duration.ofSeconds(5));
    }
}
