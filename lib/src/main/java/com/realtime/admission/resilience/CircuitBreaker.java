package com.realtime.admission.resilience;

import com.realtime.admission.config.CircuitBreakerConfig;
import com.realtime.admission.model.CircuitBreakerState;
import com.realtime.admission.model.CircuitBreakerStatus;
import com.realtime.admission.observability.HealthEventPublisher;
import com.realtime.admission.observability.MetricsCollector;
import com.realtime.admission.resilience.ResilienceException.CircuitOpenException;
import com.realtime.admission.resilience.ResilienceException.OperationTimeoutException;
import com.realtime.admission.scheduling.AsyncScheduler;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Circuit breaker with retries and exponential backoff for one operation domain,
 * for example {@code "websocket_connect"}.
 *
 * <p>A call is attempted up to {@code maxRetryAttempts} times, each attempt bounded by
 * {@code timeout}. Only the outcome of the whole call counts against the circuit: a call
 * that exhausts its attempts records one failure, a call that succeeds on any attempt
 * records one success.</p>
 *
 * <pre>
 *     CLOSED --(failures &gt;= failureThreshold)--&gt; OPEN
 *        ^                                          |
 *   (successes &gt;= successThreshold)        (recoveryTimeout elapsed)
 *        |                                          v
 *        +--------------- HALF_OPEN &lt;---------------+
 *                            |
 *                        (failure) --&gt; OPEN
 * </pre>
 *
 * <p>In CLOSED state a success forgives one earlier failure instead of resetting the count.
 * HALF_OPEN lets every caller through; it does not restrict probing to a single call.</p>
 *
 * <p>All state transitions happen under one lock, so counts and transitions are
 * linearizable across concurrent callers.</p>
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final AsyncScheduler scheduler;
    private final HealthEventPublisher eventPublisher;
    private final MetricsCollector metricsCollector;
    private final IntervalFunction backoff;

    private final Object lock = new Object();
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private final Map<String, Long> failureHistory = new LinkedHashMap<>();

    public CircuitBreaker(String name, CircuitBreakerConfig config, AsyncScheduler scheduler) {
        this(name, config, scheduler, new HealthEventPublisher(), new MetricsCollector());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, AsyncScheduler scheduler,
                          HealthEventPublisher eventPublisher, MetricsCollector metricsCollector) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
        this.metricsCollector = Objects.requireNonNull(metricsCollector, "metricsCollector must not be null");
        this.backoff = IntervalFunction.ofExponentialBackoff(
            config.getBaseDelay().toMillis(), 2.0, config.getMaxDelay().toMillis());

        logger.info("Circuit breaker '{}' created with {}", name, config);
    }

    /**
     * Whether a call may proceed now. An OPEN circuit whose recovery timeout has elapsed
     * moves to HALF_OPEN as a side effect.
     */
    public boolean isCallAllowed() {
        synchronized (lock) {
            if (state != CircuitBreakerState.OPEN) {
                return true;
            }
            if (elapsedSinceLastFailure().compareTo(config.getRecoveryTimeout()) < 0) {
                return false;
            }
            state = CircuitBreakerState.HALF_OPEN;
            successCount = 0;
        }
        onTransition(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN);
        return true;
    }

    public void recordSuccess() {
        boolean closed = false;
        synchronized (lock) {
            if (state == CircuitBreakerState.HALF_OPEN) {
                successCount++;
                if (successCount >= config.getSuccessThreshold()) {
                    state = CircuitBreakerState.CLOSED;
                    failureCount = 0;
                    closed = true;
                }
            } else if (state == CircuitBreakerState.CLOSED) {
                failureCount = Math.max(0, failureCount - 1);
            }
        }
        if (closed) {
            onTransition(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED);
        }
    }

    /**
     * Records a failed call of the given kind.
     *
     * @param kind label used for per-kind failure statistics
     */
    public void recordFailure(String kind) {
        CircuitBreakerState previous;
        int failures;
        boolean opened = false;
        synchronized (lock) {
            previous = state;
            failures = ++failureCount;
            failureHistory.merge(kind, 1L, Long::sum);
            lastFailureTime = scheduler.now();

            if (state == CircuitBreakerState.HALF_OPEN
                    || (state == CircuitBreakerState.CLOSED && failureCount >= config.getFailureThreshold())) {
                state = CircuitBreakerState.OPEN;
                successCount = 0;
                opened = true;
            }
        }
        if (opened) {
            logger.warn("Circuit breaker '{}' opened after {} failure(s), last kind '{}'", name, failures, kind);
            onTransition(previous, CircuitBreakerState.OPEN);
        }
    }

    /**
     * Runs the operation through the circuit breaker.
     *
     * <p>The returned future completes with the first successful result. It completes
     * exceptionally with {@link CircuitOpenException} if the circuit rejects the call (no attempt
     * is made and no count changes), with {@link OperationTimeoutException} if the last attempt
     * timed out, or with the operation's own error if the last attempt failed.</p>
     *
     * @param operation supplier starting one attempt
     * @param kind label recorded in the failure history if the call fails
     */
    public <T> CompletableFuture<T> call(Supplier<? extends CompletionStage<T>> operation, String kind) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(kind, "kind must not be null");

        if (!isCallAllowed()) {
            metricsCollector.recordCircuitCall(name, "rejected");
            logger.debug("Circuit breaker '{}' rejected '{}' call", name, kind);
            return CompletableFuture.failedFuture(new CircuitOpenException(name, remainingOpenTime()));
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, kind, 0, result);
        return result;
    }

    /**
     * Blocking form of {@link #call}. Errors are rethrown unwrapped; checked errors from the
     * operation are wrapped in a {@link CompletionException}.
     */
    public <T> T execute(Supplier<? extends CompletionStage<T>> operation, String kind) {
        try {
            return call(operation, kind).join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    /**
     * Reactive form of {@link #call}. The operation is subscribed once per attempt.
     */
    public <T> Mono<T> callReactive(Mono<T> operation, String kind) {
        Objects.requireNonNull(operation, "operation must not be null");
        return Mono.fromFuture(() -> this.<T>call(operation::toFuture, kind))
            .onErrorMap(CompletionException.class, CircuitBreaker::unwrap);
    }

    private <T> void attempt(Supplier<? extends CompletionStage<T>> operation, String kind,
                             int attempt, CompletableFuture<T> result) {
        if (result.isDone()) {
            return;
        }

        scheduler.runWithTimeout(operation, config.getTimeout()).whenComplete((value, error) -> {
            if (error == null) {
                recordSuccess();
                metricsCollector.recordCircuitCall(name, "success");
                if (attempt > 0) {
                    logger.info("Circuit breaker '{}': '{}' succeeded on attempt {}", name, kind, attempt + 1);
                }
                result.complete(value);
                return;
            }

            Throwable failure = translate(unwrap(error), kind);
            int attemptsMade = attempt + 1;
            if (attemptsMade >= config.getMaxRetryAttempts()) {
                logger.warn("Circuit breaker '{}': '{}' failed after {} attempt(s): {}",
                           name, kind, attemptsMade, failure.getMessage());
                recordFailure(kind);
                metricsCollector.recordCircuitCall(name, "failure");
                result.completeExceptionally(failure);
                return;
            }

            Duration delay = backoffDelay(attempt);
            logger.debug("Circuit breaker '{}': '{}' attempt {}/{} failed ({}), retrying in {}ms",
                        name, kind, attemptsMade, config.getMaxRetryAttempts(), failure.getMessage(), delay.toMillis());
            scheduler.sleep(delay).whenComplete((ignored, sleepError) -> {
                if (sleepError != null) {
                    result.completeExceptionally(unwrap(sleepError));
                } else {
                    attempt(operation, kind, attemptsMade, result);
                }
            });
        });
    }

    /**
     * Delay before retrying after the given zero-based attempt:
     * {@code min(baseDelay * 2^attempt, maxDelay)}.
     */
    public Duration backoffDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative, got " + attempt);
        }
        return Duration.ofMillis(backoff.apply(attempt + 1));
    }

    /**
     * Returns the breaker to CLOSED with zero counts. Failure history is kept.
     */
    public void reset() {
        CircuitBreakerState previous;
        synchronized (lock) {
            previous = state;
            state = CircuitBreakerState.CLOSED;
            failureCount = 0;
            successCount = 0;
            lastFailureTime = null;
        }
        logger.info("Circuit breaker '{}' has been reset", name);
        if (previous != CircuitBreakerState.CLOSED) {
            onTransition(previous, CircuitBreakerState.CLOSED);
        }
    }

    public CircuitBreakerState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public CircuitBreakerStatus getStatus() {
        synchronized (lock) {
            return new CircuitBreakerStatus(name, state, failureCount, successCount,
                                            lastFailureTime, failureHistory, config);
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private Duration elapsedSinceLastFailure() {
        return lastFailureTime == null ? config.getRecoveryTimeout()
                                       : Duration.between(lastFailureTime, scheduler.now());
    }

    private Duration remainingOpenTime() {
        synchronized (lock) {
            Duration remaining = config.getRecoveryTimeout().minus(elapsedSinceLastFailure());
            return remaining.isNegative() ? Duration.ZERO : remaining;
        }
    }

    private void onTransition(CircuitBreakerState from, CircuitBreakerState to) {
        logger.info("Circuit breaker '{}' state transition: {} -> {}", name, from, to);
        metricsCollector.recordCircuitTransition(name, to);
        eventPublisher.publishCircuitStateChange(name, from, to, scheduler.now());
    }

    private Throwable translate(Throwable error, String kind) {
        if (error instanceof TimeoutException) {
            return new OperationTimeoutException(name, kind, config.getTimeout(), error);
        }
        return error;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{name='" + name + "', state=" + getState() + "}";
    }
}
