package com.realtime.admission;

import com.realtime.admission.availability.ServiceAvailabilityManager;
import com.realtime.admission.availability.ServiceHealthProbe;
import com.realtime.admission.config.CircuitBreakerConfig;
import com.realtime.admission.model.AdmissionDecision;
import com.realtime.admission.model.CircuitBreakerStatus;
import com.realtime.admission.model.HealthReport;
import com.realtime.admission.model.ServiceType;
import com.realtime.admission.observability.HealthEventPublisher.CircuitStateChangeEvent;
import com.realtime.admission.observability.HealthEventPublisher.ServiceHealthChangeEvent;
import com.realtime.admission.resilience.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import reactor.core.Disposable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Entry point for connection admission. Owns the availability manager, the named circuit
 * breakers guarding outbound operations, and the shared event and metrics plumbing.
 * Build one instance at process start with {@link #builder()} and close it on shutdown.
 */
public interface AdmissionControl extends AutoCloseable {

    static AdmissionControlBuilder builder() {
        return new AdmissionControlBuilder();
    }

    /**
     * Decides whether a new realtime connection is admitted, refreshing service health first
     * if it is stale.
     * @return future with the decision; never completes exceptionally because of a probe
     */
    CompletableFuture<AdmissionDecision> shouldAllowConnection();

    /**
     * Health report for monitoring endpoints, refreshed first if stale.
     */
    CompletableFuture<HealthReport> getHealthReport();

    /**
     * Register or replace the health probe of a service.
     */
    void registerProbe(ServiceType serviceType, ServiceHealthProbe probe);

    /**
     * Get the circuit breaker for an operation domain such as {@code "websocket_connect"},
     * creating it with the configured breaker settings on first use.
     */
    CircuitBreaker circuitBreaker(String domain);

    /**
     * Get the circuit breaker for an operation domain, creating it with the given settings on
     * first use. An existing breaker keeps its original settings.
     */
    CircuitBreaker circuitBreaker(String domain, CircuitBreakerConfig config);

    /**
     * Status of every circuit breaker created so far, keyed by domain.
     */
    Map<String, CircuitBreakerStatus> getCircuitBreakerStatuses();

    ServiceAvailabilityManager availability();

    /**
     * Settings used for breakers created without explicit settings.
     */
    CircuitBreakerConfig getCircuitBreakerConfig();

    Disposable subscribeToHealthChanges(Consumer<ServiceHealthChangeEvent> listener);

    Disposable subscribeToCircuitChanges(Consumer<CircuitStateChangeEvent> listener);

    MeterRegistry getMeterRegistry();

    /**
     * Stops monitoring and releases owned executors. Further calls fail with
     * {@link IllegalStateException}.
     */
    @Override
    void close();
}
