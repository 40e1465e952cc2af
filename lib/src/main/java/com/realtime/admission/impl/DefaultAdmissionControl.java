package com.realtime.admission.impl;

import com.realtime.admission.AdmissionControl;
import com.realtime.admission.availability.ServiceAvailabilityManager;
import com.realtime.admission.availability.ServiceHealthProbe;
import com.realtime.admission.config.AvailabilityConfig;
import com.realtime.admission.config.CircuitBreakerConfig;
import com.realtime.admission.model.AdmissionDecision;
import com.realtime.admission.model.CircuitBreakerStatus;
import com.realtime.admission.model.HealthReport;
import com.realtime.admission.model.ServiceType;
import com.realtime.admission.observability.HealthEventPublisher;
import com.realtime.admission.observability.HealthEventPublisher.CircuitStateChangeEvent;
import com.realtime.admission.observability.HealthEventPublisher.ServiceHealthChangeEvent;
import com.realtime.admission.observability.MetricsCollector;
import com.realtime.admission.resilience.CircuitBreaker;
import com.realtime.admission.scheduling.AsyncScheduler;
import com.realtime.admission.scheduling.DefaultAsyncScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Default implementation of {@link AdmissionControl}. Wires one scheduler, event publisher and
 * metrics collector into the availability manager and every circuit breaker it creates.
 */
public class DefaultAdmissionControl implements AdmissionControl {

    private static final Logger logger = LoggerFactory.getLogger(DefaultAdmissionControl.class);

    private final CircuitBreakerConfig circuitBreakerConfig;
    private final AsyncScheduler scheduler;
    private final DefaultAsyncScheduler ownedScheduler;
    private final HealthEventPublisher eventPublisher;
    private final MetricsCollector metricsCollector;
    private final ServiceAvailabilityManager availabilityManager;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param scheduler externally managed scheduler, or null to create and own a default one
     */
    public DefaultAdmissionControl(CircuitBreakerConfig circuitBreakerConfig,
                                   AvailabilityConfig availabilityConfig,
                                   AsyncScheduler scheduler,
                                   MeterRegistry meterRegistry,
                                   Map<ServiceType, ServiceHealthProbe> probes,
                                   boolean startMonitoring) {
        this.circuitBreakerConfig = Objects.requireNonNull(circuitBreakerConfig, "circuitBreakerConfig must not be null");
        Objects.requireNonNull(availabilityConfig, "availabilityConfig must not be null");
        Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");

        if (scheduler != null) {
            this.ownedScheduler = null;
            this.scheduler = scheduler;
        } else {
            this.ownedScheduler = new DefaultAsyncScheduler();
            this.scheduler = ownedScheduler;
        }

        this.eventPublisher = new HealthEventPublisher();
        this.metricsCollector = new MetricsCollector(meterRegistry);
        this.availabilityManager = new ServiceAvailabilityManager(
            availabilityConfig, this.scheduler, eventPublisher, metricsCollector);

        probes.forEach(availabilityManager::registerProbe);

        if (startMonitoring) {
            availabilityManager.startMonitoring();
        }

        logger.info("Admission control initialized with {} probe(s), breaker defaults {}",
                   probes.size(), circuitBreakerConfig);
    }

    @Override
    public CompletableFuture<AdmissionDecision> shouldAllowConnection() {
        checkNotClosed();
        return availabilityManager.shouldAllowConnection();
    }

    @Override
    public CompletableFuture<HealthReport> getHealthReport() {
        checkNotClosed();
        return availabilityManager.getHealthReport();
    }

    @Override
    public void registerProbe(ServiceType serviceType, ServiceHealthProbe probe) {
        checkNotClosed();
        availabilityManager.registerProbe(serviceType, probe);
    }

    @Override
    public CircuitBreaker circuitBreaker(String domain) {
        return getOrCreateBreaker(domain, circuitBreakerConfig);
    }

    @Override
    public CircuitBreaker circuitBreaker(String domain, CircuitBreakerConfig config) {
        CircuitBreaker breaker = getOrCreateBreaker(domain, config);
        if (!breaker.getConfig().equals(config)) {
            logger.warn("Circuit breaker '{}' already exists with {}, ignoring requested {}",
                       domain, breaker.getConfig(), config);
        }
        return breaker;
    }

    private CircuitBreaker getOrCreateBreaker(String domain, CircuitBreakerConfig config) {
        checkNotClosed();
        Objects.requireNonNull(domain, "domain must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return circuitBreakers.computeIfAbsent(domain,
            name -> new CircuitBreaker(name, config, scheduler, eventPublisher, metricsCollector));
    }

    @Override
    public Map<String, CircuitBreakerStatus> getCircuitBreakerStatuses() {
        Map<String, CircuitBreakerStatus> statuses = new TreeMap<>();
        circuitBreakers.forEach((name, breaker) -> statuses.put(name, breaker.getStatus()));
        return Collections.unmodifiableMap(statuses);
    }

    @Override
    public ServiceAvailabilityManager availability() {
        return availabilityManager;
    }

    @Override
    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return circuitBreakerConfig;
    }

    @Override
    public Disposable subscribeToHealthChanges(Consumer<ServiceHealthChangeEvent> listener) {
        checkNotClosed();
        return eventPublisher.subscribeToHealthChanges(listener);
    }

    @Override
    public Disposable subscribeToCircuitChanges(Consumer<CircuitStateChangeEvent> listener) {
        checkNotClosed();
        return eventPublisher.subscribeToCircuitChanges(listener);
    }

    @Override
    public MeterRegistry getMeterRegistry() {
        return metricsCollector.getMeterRegistry();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.info("Closing admission control...");
            try {
                availabilityManager.close();
                if (ownedScheduler != null) {
                    ownedScheduler.close();
                }
            } catch (Exception e) {
                logger.error("Error during admission control shutdown", e);
            } finally {
                eventPublisher.close();
            }
            logger.info("Admission control closed");
        }
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Admission control has been closed");
        }
    }
}
