package com.realtime.admission.availability;

import com.realtime.admission.config.AvailabilityConfig;
import com.realtime.admission.model.ProbeResult;
import com.realtime.admission.model.ServiceHealthInfo;
import com.realtime.admission.model.ServiceStatus;
import com.realtime.admission.model.ServiceType;
import com.realtime.admission.observability.HealthEventPublisher;
import com.realtime.admission.observability.HealthEventPublisher.ServiceHealthChangeEvent;
import com.realtime.admission.observability.MetricsCollector;
import com.realtime.admission.scheduling.DefaultAsyncScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the manager on the wall-clock scheduler to cover concurrent probes and racing callers.
 */
public class ServiceAvailabilityManagerConcurrencyTest {

    private static final int THREADS = 16;

    private DefaultAsyncScheduler scheduler;
    private HealthEventPublisher eventPublisher;
    private ServiceAvailabilityManager manager;

    @BeforeEach
    public void setUp() {
        scheduler = new DefaultAsyncScheduler();
        eventPublisher = new HealthEventPublisher();
    }

    @AfterEach
    public void tearDown() {
        if (manager != null) {
            manager.close();
        }
        scheduler.close();
    }

    private ServiceAvailabilityManager newManager(Duration probeTimeout) {
        AvailabilityConfig config = AvailabilityConfig.builder()
            .healthCheckInterval(Duration.ofSeconds(30))
            .probeTimeout(probeTimeout)
            .maxConsecutiveFailures(3)
            .circuitBreakerTimeout(Duration.ofSeconds(60))
            .build();
        return new ServiceAvailabilityManager(config, scheduler, eventPublisher, new MetricsCollector());
    }

    @Test
    public void testProbesRunConcurrently() throws Exception {
        manager = newManager(Duration.ofMillis(800));
        manager.registerProbe(ServiceType.AUTH_SERVICE, this::slowHealthy);
        manager.registerProbe(ServiceType.DATABASE, this::slowHealthy);
        manager.registerProbe(ServiceType.REDIS, this::slowHealthy);
        // These block the calling thread before returning.
        manager.registerProbe(ServiceType.WEBSOCKET_BRIDGE, ServiceAvailabilityManagerConcurrencyTest::blockingHealthy);
        manager.registerProbe(ServiceType.AGENT_SUPERVISOR, ServiceAvailabilityManagerConcurrencyTest::blockingHealthy);
        manager.registerProbe(ServiceType.TOOL_DISPATCHER, ServiceAvailabilityManagerConcurrencyTest::blockingHealthy);
        manager.registerProbe(ServiceType.THREAD_SERVICE, CompletableFuture::new);

        long start = System.nanoTime();
        Map<ServiceType, ServiceHealthInfo> health = manager.checkAllServices().get(5, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Run one after another these would take 6 x 300ms + 800ms.
        assertTrue(elapsedMs < 1600, "check took " + elapsedMs + "ms");
        assertEquals(ServiceStatus.FAILED, health.get(ServiceType.THREAD_SERVICE).getStatus());
        assertEquals("Health check timed out after 800ms",
                     health.get(ServiceType.THREAD_SERVICE).getErrorMessage().orElseThrow());
        for (ServiceType type : ServiceType.values()) {
            if (type != ServiceType.THREAD_SERVICE) {
                assertEquals(ServiceStatus.HEALTHY, health.get(type).getStatus(), type.id());
            }
        }
    }

    @Test
    public void testRacingChecksAndUpdatesKeepRecordsWhole() throws Exception {
        manager = newManager(Duration.ofSeconds(2));
        manager.registerProbe(ServiceType.AUTH_SERVICE, () -> CompletableFuture.completedFuture(ProbeResult.healthy()));
        manager.registerProbe(ServiceType.DATABASE, () -> CompletableFuture.completedFuture(ProbeResult.healthy()));
        List<ServiceHealthChangeEvent> events = new CopyOnWriteArrayList<>();
        Disposable subscription = eventPublisher.subscribeToHealthChanges(events::add);
        AtomicInteger tornReads = new AtomicInteger();
        int perThread = 60;

        runConcurrently(() -> {
            for (int i = 0; i < perThread; i++) {
                switch (i % 3) {
                    case 0 -> manager.checkAllServices().join();
                    case 1 -> manager.updateServiceHealth(ServiceType.REDIS, ServiceStatus.FAILED, "refused", null);
                    default -> {
                        Map<ServiceType, ServiceHealthInfo> snapshot = manager.getAllServiceHealth();
                        if (!snapshot.get(ServiceType.AUTH_SERVICE).getLastCheck()
                                .equals(snapshot.get(ServiceType.DATABASE).getLastCheck())) {
                            tornReads.incrementAndGet();
                        }
                    }
                }
            }
        });
        subscription.dispose();

        ServiceHealthInfo redis = manager.getServiceHealth(ServiceType.REDIS).orElseThrow();
        assertEquals(THREADS * perThread / 3, redis.getConsecutiveFailures());
        assertTrue(redis.isCircuitBreakerOpen());
        assertEquals(0, tornReads.get());
        assertEquals(2, events.stream().filter(e -> e.getService() == ServiceType.REDIS).count());
        assertEquals(1, events.stream().filter(e -> e.getService() == ServiceType.AUTH_SERVICE).count());
        assertEquals(1, events.stream().filter(e -> e.getService() == ServiceType.DATABASE).count());
    }

    @Test
    public void testStopDoesNotWaitForHangingMonitorCheck() throws Exception {
        manager = newManager(Duration.ofSeconds(30));
        CompletableFuture<ProbeResult> pending = new CompletableFuture<>();
        CountDownLatch probed = new CountDownLatch(1);
        manager.registerProbe(ServiceType.AUTH_SERVICE, () -> {
            probed.countDown();
            return pending;
        });

        manager.startMonitoring();
        assertTrue(probed.await(5, TimeUnit.SECONDS));

        long start = System.nanoTime();
        manager.stop();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs < 2000, "stop took " + elapsedMs + "ms");
        assertFalse(manager.isMonitoring());
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(1);
        while (!pending.isCancelled() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(pending.isCancelled());
        assertFalse(manager.getLastCheck().isPresent());
    }

    private CompletableFuture<ProbeResult> slowHealthy() {
        return scheduler.sleep(Duration.ofMillis(300)).thenApply(ignored -> ProbeResult.healthy());
    }

    private static CompletableFuture<ProbeResult> blockingHealthy() {
        try {
            Thread.sleep(300);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return CompletableFuture.completedFuture(ProbeResult.healthy());
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
            assertTrue(done.await(20, TimeUnit.SECONDS), "workers did not finish");
        } finally {
            executor.shutdownNow();
        }
    }
}
