package com.realtime.admission.scheduling;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Wall-clock scheduler. Operations start on a worker pool so a probe that blocks while
 * starting cannot hold up the others, and are time-boxed with Resilience4j time limiters
 * (one per distinct timeout, cancelling the running future on expiry).
 *
 * <p>The timer thread only fires deadlines. Returned futures are completed from the worker
 * pool, so caller continuations never run on the timer.
 */
public class DefaultAsyncScheduler implements AsyncScheduler, AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(DefaultAsyncScheduler.class);
    
    private final Clock clock;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final Executor handoff;
    
    public DefaultAsyncScheduler() {
        this(Clock.systemUTC());
    }
    
    public DefaultAsyncScheduler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.workers = Executors.newCachedThreadPool(daemonThreads("admission-worker"));
        this.timer = Executors.newScheduledThreadPool(1, daemonThreads("admission-timer"));
        this.timeLimiterRegistry = TimeLimiterRegistry.of(TimeLimiterConfig.custom()
                .cancelRunningFuture(true)
                .build());
        this.handoff = this::executeOnWorker;
    }
    
    @Override
    public Instant now() {
        return clock.instant();
    }
    
    @Override
    public CompletableFuture<Void> sleep(Duration delay) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        ScheduledFuture<?> task = timer.schedule(
            () -> handoff.execute(() -> future.complete(null)), delay.toMillis(), TimeUnit.MILLISECONDS);
        future.whenComplete((ignored, error) -> {
            if (error != null) {
                task.cancel(false);
            }
        });
        return future;
    }
    
    @Override
    public <T> CompletableFuture<T> runWithTimeout(Supplier<? extends CompletionStage<T>> operation, Duration timeout) {
        Objects.requireNonNull(operation, "operation must not be null");
        
        CompletableFuture<T> outcome = new CompletableFuture<>();
        AtomicReference<CompletionStage<T>> running = new AtomicReference<>();
        CompletableFuture<T> started = CompletableFuture.<CompletionStage<T>>supplyAsync(() -> {
                    CompletionStage<T> stage = operation.get();
                    running.set(stage);
                    if (outcome.isCompletedExceptionally()) {
                        cancel(stage);
                    }
                    return stage;
                }, workers)
                .thenCompose(Function.identity());
        
        CompletableFuture<T> result = timeLimiter(timeout)
                .executeCompletionStage(timer, () -> started)
                .toCompletableFuture();
        
        result.whenCompleteAsync((value, error) -> {
            if (error != null) {
                outcome.completeExceptionally(error);
            } else {
                outcome.complete(value);
            }
        }, handoff);
        outcome.whenComplete((value, error) -> {
            if (error != null) {
                result.cancel(true);
                cancel(running.get());
            }
        });
        return outcome;
    }
    
    private void executeOnWorker(Runnable command) {
        try {
            workers.execute(command);
        } catch (RejectedExecutionException e) {
            // Pool already shut down: finish the future on the calling thread.
            logger.debug("Worker pool rejected completion, running inline");
            command.run();
        }
    }
    
    private TimeLimiter timeLimiter(Duration timeout) {
        String name = "timeout-" + timeout.toMillis() + "ms";
        return timeLimiterRegistry.timeLimiter(name, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }
    
    private static void cancel(CompletionStage<?> stage) {
        if (stage instanceof Future && !((Future<?>) stage).isDone()) {
            ((Future<?>) stage).cancel(true);
        }
    }
    
    @Override
    public void close() {
        timer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.debug("Async scheduler stopped");
    }
    
    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
