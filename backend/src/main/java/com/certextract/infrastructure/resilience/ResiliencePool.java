package com.certextract.infrastructure.resilience;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Process-wide home of the named circuit breakers and the retry / timeout primitives that
 * network-backed adapters compose:
 *
 *   circuit(name) -> retry(backoff) -> timeout(call)
 *
 * Retry and timeout are Resilience4j {@link Retry} and {@link TimeLimiter} instances built from
 * each circuit's resolved policy. Circuits and their retries are created lazily on first use and
 * live as long as the pool. An exhausted retry counts as a single circuit failure.
 */
@Slf4j
@Component
public class ResiliencePool {

    /**
     * Hook invoked before each backoff sleep.
     */
    @FunctionalInterface
    public interface RetryListener {
        void onRetry(RuntimeException error, int attempt);

        static RetryListener noop() {
            return (error, attempt) -> {};
        }
    }

    private final ResilienceProperties properties;
    private final Clock clock;
    private final ConcurrentHashMap<String, CircuitBreaker> circuits = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Retry> retries = new ConcurrentHashMap<>();
    private final ExecutorService ioExecutor = Executors.newCachedThreadPool(daemonThreads("extraction-io-"));

    public ResiliencePool(ResilienceProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs a network call under the named circuit with that circuit's retry and timeout policy.
     */
    public <T> T execute(String circuitName, Callable<T> call) {
        ResilienceProperties.ResolvedPolicy policy = properties.resolve(circuitName);
        Retry retry = retries.computeIfAbsent(circuitName, name -> {
            Retry created = Retry.of(name, retryConfig(policy.backoff()));
            created.getEventPublisher().onRetry(event -> log.warn("[Resilience] {} attempt {}/{} failed: {}",
                    name, event.getNumberOfRetryAttempts(), policy.backoff().maxAttempts(),
                    event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));
            return created;
        });
        return circuit(circuitName).execute(() -> retrying(retry, () -> withTimeout(call, policy.timeout())));
    }

    public CircuitBreaker circuit(String name) {
        return circuits.computeIfAbsent(name,
                n -> new CircuitBreaker(n, properties.resolve(n).circuitBreaker(), clock));
    }

    public Map<String, CircuitState> circuitStates() {
        Map<String, CircuitState> states = new TreeMap<>();
        circuits.forEach((name, breaker) -> states.put(name, breaker.getState()));
        return Collections.unmodifiableMap(states);
    }

    public void reset(String name) {
        CircuitBreaker breaker = circuits.get(name);
        if (breaker != null) {
            breaker.reset();
        }
    }

    /**
     * Waits at most {@code timeout} for the operation. On expiry or caller interruption the
     * operation is cancelled and abandoned; its result is never used.
     */
    public <T> T withTimeout(Callable<T> operation, Duration timeout) {
        TimeLimiter limiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
        AtomicReference<Future<T>> submitted = new AtomicReference<>();
        try {
            return limiter.executeFutureSupplier(() -> {
                Future<T> future = ioExecutor.submit(operation);
                submitted.set(future);
                return future;
            });
        } catch (TimeoutException e) {
            throw new ExtractionTimeoutException(timeout);
        } catch (InterruptedException e) {
            cancel(submitted.get());
            Thread.currentThread().interrupt();
            throw new ExtractionCancelledException("Extraction cancelled while waiting for provider", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw unwrap(e);
        }
    }

    /**
     * Retries any failure except on the final attempt and re-throws the last error.
     * Cancellation is checked before every attempt and interrupts the backoff sleep.
     */
    public <T> T withRetry(Callable<T> operation, BackoffPolicy policy, RetryListener listener) {
        Retry retry = Retry.of("extraction-call", retryConfig(policy));
        retry.getEventPublisher().onRetry(event -> listener.onRetry(
                asRuntime(event.getLastThrowable()), event.getNumberOfRetryAttempts()));
        return retrying(retry, operation);
    }

    @PreDestroy
    public void shutdown() {
        ioExecutor.shutdownNow();
    }

    private static RetryConfig retryConfig(BackoffPolicy policy) {
        return RetryConfig.custom()
                .maxAttempts(policy.maxAttempts())
                .intervalFunction(policy.toIntervalFunction())
                .ignoreExceptions(ExtractionCancelledException.class)
                .build();
    }

    private static <T> T retrying(Retry retry, Callable<T> operation) {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<T> attempt = () -> {
            if (Thread.currentThread().isInterrupted()) {
                throw new ExtractionCancelledException("Extraction cancelled before attempt " + (attempts.get() + 1));
            }
            attempts.incrementAndGet();
            return invoke(operation);
        };
        try {
            return Retry.decorateSupplier(retry, attempt).get();
        } catch (ExtractionCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            // an interrupted backoff sleep rethrows the last error with the interrupt flag restored
            if (Thread.currentThread().isInterrupted()) {
                throw new ExtractionCancelledException("Extraction cancelled during retry backoff", e);
            }
            throw e;
        }
    }

    private static <T> T invoke(Callable<T> operation) {
        try {
            return operation.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionCancelledException("Extraction cancelled", e);
        } catch (Exception e) {
            throw new ExtractionTransportException(e.getMessage(), e);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof InterruptedException) {
            return new ExtractionCancelledException("Provider call interrupted", cause);
        }
        return new ExtractionTransportException(cause.getMessage(), cause);
    }

    private static RuntimeException asRuntime(Throwable error) {
        return error instanceof RuntimeException runtime
                ? runtime
                : new ExtractionTransportException(String.valueOf(error), error);
    }

    private static void cancel(Future<?> future) {
        if (future != null) {
            future.cancel(true);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
