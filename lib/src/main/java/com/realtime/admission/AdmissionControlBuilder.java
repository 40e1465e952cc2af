package com.realtime.admission;

import com.realtime.admission.availability.ServiceHealthProbe;
import com.realtime.admission.config.AvailabilityConfig;
import com.realtime.admission.config.CircuitBreakerConfig;
import com.realtime.admission.config.DeploymentEnvironment;
import com.realtime.admission.impl.DefaultAdmissionControl;
import com.realtime.admission.model.ServiceType;
import com.realtime.admission.scheduling.AsyncScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builder for {@link AdmissionControl} instances.
 *
 * <p>Circuit breaker settings come from, in order: an explicit
 * {@link #circuitBreakerConfig(CircuitBreakerConfig)}, the preset of an explicit
 * {@link #environment(DeploymentEnvironment)}, or the preset of
 * {@link DeploymentEnvironment#current()}.</p>
 */
public class AdmissionControlBuilder {

    private DeploymentEnvironment environment;
    private CircuitBreakerConfig circuitBreakerConfig;
    private AvailabilityConfig availabilityConfig = AvailabilityConfig.defaultConfig();
    private AsyncScheduler scheduler;
    private MeterRegistry meterRegistry;
    private final Map<ServiceType, ServiceHealthProbe> probes = new EnumMap<>(ServiceType.class);
    private boolean startMonitoring = false;

    AdmissionControlBuilder() {
    }

    public AdmissionControlBuilder environment(DeploymentEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        return this;
    }

    public AdmissionControlBuilder environment(String environmentTag) {
        return environment(DeploymentEnvironment.fromTag(environmentTag));
    }

    public AdmissionControlBuilder circuitBreakerConfig(CircuitBreakerConfig config) {
        this.circuitBreakerConfig = Objects.requireNonNull(config, "config must not be null");
        return this;
    }

    public AdmissionControlBuilder availabilityConfig(AvailabilityConfig config) {
        this.availabilityConfig = Objects.requireNonNull(config, "config must not be null");
        return this;
    }

    /**
     * Use an externally managed scheduler. It is not closed with the admission control.
     * Without one, a {@link com.realtime.admission.scheduling.DefaultAsyncScheduler} is created
     * and owned.
     */
    public AdmissionControlBuilder scheduler(AsyncScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        return this;
    }

    public AdmissionControlBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        return this;
    }

    public AdmissionControlBuilder probe(ServiceType serviceType, ServiceHealthProbe probe) {
        probes.put(Objects.requireNonNull(serviceType, "serviceType must not be null"),
                   Objects.requireNonNull(probe, "probe must not be null"));
        return this;
    }

    /**
     * Start periodic health checks as soon as the instance is built.
     */
    public AdmissionControlBuilder startMonitoring(boolean startMonitoring) {
        this.startMonitoring = startMonitoring;
        return this;
    }

    CircuitBreakerConfig resolveCircuitBreakerConfig() {
        if (circuitBreakerConfig != null) {
            return circuitBreakerConfig;
        }
        DeploymentEnvironment resolved = environment != null ? environment : DeploymentEnvironment.current();
        return CircuitBreakerConfig.forEnvironment(resolved);
    }

    public AdmissionControl build() {
        return new DefaultAdmissionControl(
            resolveCircuitBreakerConfig(),
            availabilityConfig,
            scheduler,
            meterRegistry != null ? meterRegistry : new SimpleMeterRegistry(),
            probes,
            startMonitoring
        );
    }
}
