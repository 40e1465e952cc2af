package com.realtime.admission.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Health record for one monitored service, including the failure-streak breaker
 * the availability manager keeps per service. Instances are immutable; the manager
 * replaces a record on every update.
 */
public final class ServiceHealthInfo {
    
    private final ServiceType serviceType;
    private final ServiceStatus status;
    private final Instant lastCheck;
    private final String errorMessage;
    private final Duration responseTime;
    private final int consecutiveFailures;
    private final boolean circuitBreakerOpen;
    private final Instant circuitBreakerUntil;
    
    private ServiceHealthInfo(Builder builder) {
        this.serviceType = Objects.requireNonNull(builder.serviceType, "serviceType must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.lastCheck = builder.lastCheck;
        this.errorMessage = builder.errorMessage;
        this.responseTime = builder.responseTime;
        this.consecutiveFailures = builder.consecutiveFailures;
        this.circuitBreakerOpen = builder.circuitBreakerOpen;
        this.circuitBreakerUntil = builder.circuitBreakerUntil;
    }
    
    /**
     * Initial record for a service that has not been checked yet.
     */
    public static ServiceHealthInfo unknown(ServiceType serviceType) {
        return builder(serviceType).build();
    }
    
    public ServiceType getServiceType() {
        return serviceType;
    }
    
    public ServiceStatus getStatus() {
        return status;
    }
    
    public Optional<Instant> getLastCheck() {
        return Optional.ofNullable(lastCheck);
    }
    
    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }
    
    public Optional<Duration> getResponseTime() {
        return Optional.ofNullable(responseTime);
    }
    
    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
    
    public boolean isCircuitBreakerOpen() {
        return circuitBreakerOpen;
    }
    
    public Optional<Instant> getCircuitBreakerUntil() {
        return Optional.ofNullable(circuitBreakerUntil);
    }
    
    public Builder toBuilder() {
        return builder(serviceType)
            .status(status)
            .lastCheck(lastCheck)
            .errorMessage(errorMessage)
            .responseTime(responseTime)
            .consecutiveFailures(consecutiveFailures)
            .circuitBreakerOpen(circuitBreakerOpen)
            .circuitBreakerUntil(circuitBreakerUntil);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServiceHealthInfo)) return false;
        ServiceHealthInfo that = (ServiceHealthInfo) o;
        return consecutiveFailures == that.consecutiveFailures
            && circuitBreakerOpen == that.circuitBreakerOpen
            && serviceType == that.serviceType
            && status == that.status
            && Objects.equals(lastCheck, that.lastCheck)
            && Objects.equals(errorMessage, that.errorMessage)
            && Objects.equals(responseTime, that.responseTime)
            && Objects.equals(circuitBreakerUntil, that.circuitBreakerUntil);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(serviceType, status, lastCheck, errorMessage, responseTime,
                            consecutiveFailures, circuitBreakerOpen, circuitBreakerUntil);
    }
    
    @Override
    public String toString() {
        return String.format("ServiceHealthInfo{service=%s, status=%s, lastCheck=%s, error='%s', " +
                           "responseTime=%s, consecutiveFailures=%d, circuitBreakerOpen=%s, until=%s}",
            serviceType, status, lastCheck, errorMessage, responseTime, 
            consecutiveFailures, circuitBreakerOpen, circuitBreakerUntil);
    }
    
    public static Builder builder(ServiceType serviceType) {
        return new Builder(serviceType);
    }
    
    public static class Builder {
        private final ServiceType serviceType;
        private ServiceStatus status = ServiceStatus.UNKNOWN;
        private Instant lastCheck;
        private String errorMessage;
        private Duration responseTime;
        private int consecutiveFailures = 0;
        private boolean circuitBreakerOpen = false;
        private Instant circuitBreakerUntil;
        
        private Builder(ServiceType serviceType) {
            this.serviceType = serviceType;
        }
        
        public Builder status(ServiceStatus status) {
            this.status = status;
            return this;
        }
        
        public Builder lastCheck(Instant lastCheck) {
            this.lastCheck = lastCheck;
            return this;
        }
        
        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }
        
        public Builder responseTime(Duration responseTime) {
            this.responseTime = responseTime;
            return this;
        }
        
        public Builder consecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
            return this;
        }
        
        public Builder circuitBreakerOpen(boolean circuitBreakerOpen) {
            this.circuitBreakerOpen = circuitBreakerOpen;
            return this;
        }
        
        public Builder circuitBreakerUntil(Instant circuitBreakerUntil) {
            this.circuitBreakerUntil = circuitBreakerUntil;
            return this;
        }
        
        public ServiceHealthInfo build() {
            return new ServiceHealthInfo(this);
        }
    }
}
