package com.realtime.admission.scheduling;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Time source and asynchronous execution primitives used by the circuit breaker and the
 * availability manager. Injected rather than global so tests can substitute a manual clock.
 */
public interface AsyncScheduler {
    
    /**
     * Current time.
     */
    Instant now();
    
    /**
     * Returns a future that completes after the given delay.
     */
    CompletableFuture<Void> sleep(Duration delay);
    
    /**
     * Starts the operation and bounds it by the timeout. If the operation has not completed
     * when the timeout elapses, the returned future completes exceptionally with a
     * {@link java.util.concurrent.TimeoutException} and the operation's own future is cancelled.
     * An operation that throws while starting completes the returned future exceptionally.
     *
     * @param operation supplier starting the asynchronous operation
     * @param timeout upper bound for the operation
     * @return future with the operation's outcome
     */
    <T> CompletableFuture<T> runWithTimeout(Supplier<? extends CompletionStage<T>> operation, Duration timeout);
}
