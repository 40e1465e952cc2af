package com.realtime.admission.observability;

import com.realtime.admission.model.CircuitBreakerState;
import com.realtime.admission.model.ServiceStatus;
import com.realtime.admission.model.ServiceType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Micrometer metrics for circuit breakers, health probes and admission decisions.
 */
public class MetricsCollector {
    
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);
    
    public static final String CIRCUIT_CALLS = "admission.circuit.calls";
    public static final String CIRCUIT_TRANSITIONS = "admission.circuit.transitions";
    public static final String DECISIONS = "admission.decisions";
    public static final String PROBE_LATENCY = "admission.probe.latency";
    public static final String PROBE_FAILURES = "admission.probe.failures";
    public static final String SERVICE_AVAILABLE = "admission.service.available";
    
    private final MeterRegistry meterRegistry;
    private final Counter allowedConnections;
    private final Counter deniedConnections;
    
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }
    
    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        this.allowedConnections = Counter.builder(DECISIONS)
            .tag("allowed", "true")
            .description("Admission decisions")
            .register(meterRegistry);
        
        this.deniedConnections = Counter.builder(DECISIONS)
            .tag("allowed", "false")
            .description("Admission decisions")
            .register(meterRegistry);
        
        logger.debug("Metrics collector initialized with {}", meterRegistry.getClass().getSimpleName());
    }
    
    /**
     * Records the outcome of a circuit breaker call: {@code success}, {@code failure} or {@code rejected}.
     */
    public void recordCircuitCall(String circuitName, String outcome) {
        Counter.builder(CIRCUIT_CALLS)
            .tag("breaker", circuitName)
            .tag("outcome", outcome)
            .description("Calls made through a circuit breaker")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordCircuitTransition(String circuitName, CircuitBreakerState toState) {
        Counter.builder(CIRCUIT_TRANSITIONS)
            .tag("breaker", circuitName)
            .tag("to", toState.name().toLowerCase())
            .description("Circuit breaker state transitions")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordAdmissionDecision(boolean allowed) {
        if (allowed) {
            allowedConnections.increment();
        } else {
            deniedConnections.increment();
        }
    }
    
    public void recordProbe(ServiceType service, Duration latency, ServiceStatus status) {
        Timer.builder(PROBE_LATENCY)
            .tag("service", service.id())
            .description("Health probe latency")
            .register(meterRegistry)
            .record(latency);
        
        if (status == ServiceStatus.FAILED) {
            Counter.builder(PROBE_FAILURES)
                .tag("service", service.id())
                .description("Failed health probes")
                .register(meterRegistry)
                .increment();
        }
    }
    
    /**
     * Registers a 1/0 gauge reporting whether the service is currently available.
     * One availability source per service and registry: if the gauge already exists it is
     * left in place and nothing is registered.
     *
     * @return the new gauge, to be passed to {@link #remove(Meter)} when its source goes away
     */
    public Optional<Gauge> registerServiceAvailability(ServiceType service, BooleanSupplier available) {
        Gauge existing = meterRegistry.find(SERVICE_AVAILABLE).tag("service", service.id()).gauge();
        if (existing != null) {
            logger.warn("Availability gauge for {} is already registered, keeping the existing one", service);
            return Optional.empty();
        }
        return Optional.of(Gauge.builder(SERVICE_AVAILABLE, () -> available.getAsBoolean() ? 1 : 0)
            .tag("service", service.id())
            .description("Service availability (1 available, 0 unavailable)")
            .register(meterRegistry));
    }
    
    public void remove(Meter meter) {
        meterRegistry.remove(meter);
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
