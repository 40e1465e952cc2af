package com.realtime.admission.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the service availability manager: probe cadence and timeouts,
 * the per-service failure-streak breaker, and the admission policy.
 */
public class AvailabilityConfig {
    
    private final Duration healthCheckInterval;
    private final Duration probeTimeout;
    private final int maxConsecutiveFailures;
    private final Duration circuitBreakerTimeout;
    private final int degradedServiceThreshold;
    private final ServiceDependencyMap dependencyMap;
    
    private AvailabilityConfig(Builder builder) {
        this.healthCheckInterval = builder.healthCheckInterval;
        this.probeTimeout = builder.probeTimeout;
        this.maxConsecutiveFailures = builder.maxConsecutiveFailures;
        this.circuitBreakerTimeout = builder.circuitBreakerTimeout;
        this.degradedServiceThreshold = builder.degradedServiceThreshold;
        this.dependencyMap = builder.dependencyMap;
    }
    
    /**
     * Maximum age of cached health before an admission check or report triggers a new check.
     */
    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }
    
    public Duration getProbeTimeout() {
        return probeTimeout;
    }
    
    public int getMaxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }
    
    public Duration getCircuitBreakerTimeout() {
        return circuitBreakerTimeout;
    }
    
    /**
     * Number of degraded services at which connections are denied.
     */
    public int getDegradedServiceThreshold() {
        return degradedServiceThreshold;
    }
    
    public ServiceDependencyMap getDependencyMap() {
        return dependencyMap;
    }
    
    public static AvailabilityConfig defaultConfig() {
        return builder().build();
    }
    
    @Override
    public String toString() {
        return String.format("AvailabilityConfig{healthCheckInterval=%s, probeTimeout=%s, maxConsecutiveFailures=%d, " +
                           "circuitBreakerTimeout=%s, degradedServiceThreshold=%d, dependencyMap=%s}",
            healthCheckInterval, probeTimeout, maxConsecutiveFailures, circuitBreakerTimeout,
            degradedServiceThreshold, dependencyMap);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration probeTimeout = Duration.ofSeconds(5);
        private int maxConsecutiveFailures = 3;
        private Duration circuitBreakerTimeout = Duration.ofSeconds(60);
        private int degradedServiceThreshold = 3;
        private ServiceDependencyMap dependencyMap = ServiceDependencyMap.defaultMap();
        
        public Builder healthCheckInterval(Duration interval) {
            this.healthCheckInterval = interval;
            return this;
        }
        
        public Builder probeTimeout(Duration timeout) {
            this.probeTimeout = timeout;
            return this;
        }
        
        public Builder maxConsecutiveFailures(int failures) {
            this.maxConsecutiveFailures = failures;
            return this;
        }
        
        public Builder circuitBreakerTimeout(Duration timeout) {
            this.circuitBreakerTimeout = timeout;
            return this;
        }
        
        public Builder degradedServiceThreshold(int threshold) {
            this.degradedServiceThreshold = threshold;
            return this;
        }
        
        public Builder dependencyMap(ServiceDependencyMap dependencyMap) {
            this.dependencyMap = dependencyMap;
            return this;
        }
        
        public AvailabilityConfig build() {
            Objects.requireNonNull(dependencyMap, "dependencyMap must not be null");
            requirePositive("healthCheckInterval", healthCheckInterval);
            requirePositive("probeTimeout", probeTimeout);
            requirePositive("circuitBreakerTimeout", circuitBreakerTimeout);
            if (maxConsecutiveFailures <= 0) {
                throw new IllegalArgumentException("maxConsecutiveFailures must be positive, got " + maxConsecutiveFailures);
            }
            if (degradedServiceThreshold <= 0) {
                throw new IllegalArgumentException("degradedServiceThreshold must be positive, got " + degradedServiceThreshold);
            }
            return new AvailabilityConfig(this);
        }
        
        private static void requirePositive(String name, Duration value) {
            Objects.requireNonNull(value, name + " must not be null");
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }
    }
}
