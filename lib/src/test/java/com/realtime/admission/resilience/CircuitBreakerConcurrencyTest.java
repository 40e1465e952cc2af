package com.realtime.admission.resilience;

import com.realtime.admission.config.CircuitBreakerConfig;
import com.realtime.admission.model.CircuitBreakerState;
import com.realtime.admission.observability.HealthEventPublisher;
import com.realtime.admission.observability.HealthEventPublisher.CircuitStateChangeEvent;
import com.realtime.admission.observability.MetricsCollector;
import com.realtime.admission.scheduling.ManualAsyncScheduler;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class CircuitBreakerConcurrencyTest {

    private static final int THREADS = 16;

    @Test
    public void testCountsEveryConcurrentFailure() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("db_query", CircuitBreakerConfig.builder()
            .failureThreshold(10_000)
            .build(), new ManualAsyncScheduler());
        int perThread = 250;

        runConcurrently(() -> {
            for (int i = 0; i < perThread; i++) {
                breaker.recordFailure(i % 2 == 0 ? "timeout" : "refused");
            }
        });

        assertEquals(THREADS * perThread, breaker.getStatus().getFailureCount());
        long historyTotal = breaker.getStatus().getFailureHistory().values().stream().mapToLong(Long::longValue).sum();
        assertEquals(THREADS * perThread, historyTotal);
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
    }

    @RepeatedTest(5)
    public void testSingleOpenTransitionUnderContention() throws Exception {
        HealthEventPublisher publisher = new HealthEventPublisher();
        List<CircuitStateChangeEvent> events = new CopyOnWriteArrayList<>();
        Disposable subscription = publisher.subscribeToCircuitChanges(events::add);

        ManualAsyncScheduler scheduler = new ManualAsyncScheduler();
        CircuitBreaker breaker = new CircuitBreaker("websocket_connect", CircuitBreakerConfig.builder()
            .failureThreshold(5)
            .recoveryTimeout(Duration.ofSeconds(30))
            .build(), scheduler, publisher, new MetricsCollector());

        runConcurrently(() -> breaker.recordFailure("connect"));
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());

        scheduler.advance(Duration.ofSeconds(30));
        AtomicInteger admitted = new AtomicInteger();
        runConcurrently(() -> {
            if (breaker.isCallAllowed()) {
                admitted.incrementAndGet();
            }
        });
        subscription.dispose();

        assertEquals(THREADS, admitted.get());
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());
        assertEquals(1, events.stream().filter(e -> e.getToState() == CircuitBreakerState.OPEN).count());
        assertEquals(1, events.stream().filter(e -> e.getToState() == CircuitBreakerState.HALF_OPEN).count());
    }

    @Test
    public void testConcurrentCallsKeepCountsConsistent() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("tool_dispatch", CircuitBreakerConfig.builder()
            .failureThreshold(10_000)
            .maxRetryAttempts(1)
            .build(), new ManualAsyncScheduler());
        AtomicInteger failed = new AtomicInteger();

        runConcurrently(() -> {
            for (int i = 0; i < 100; i++) {
                CompletableFuture<String> future = breaker.call(
                    () -> CompletableFuture.failedFuture(new IllegalStateException("down")), "dispatch");
                if (future.isCompletedExceptionally()) {
                    failed.incrementAndGet();
                }
            }
        });

        assertEquals(THREADS * 100, failed.get());
        assertEquals(THREADS * 100, breaker.getStatus().getFailureCount());
    }

    private static void runConcurrently(Runnable task) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(THREADS);
        try {
            for (int i = 0; i < THREADS; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        task.run();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(10, TimeUnit.SECONDS), "workers did not finish");
        } finally {
            executor.shutdownNow();
        }
    }
}
