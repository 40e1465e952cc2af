package com.realtime.admission.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Point-in-time snapshot of dependency health and the admission decision derived from it.
 * Consumed by health and monitoring endpoints; {@link #toMap()} gives the serializable shape.
 */
public final class HealthReport {
    
    /**
     * Aggregate status over all services.
     */
    public enum OverallStatus {
        /** Every service is healthy. */
        HEALTHY,
        /** Connections are admitted but at least one service is not healthy. */
        DEGRADED,
        /** Connections are denied. */
        UNHEALTHY;
        
        public String id() {
            return name().toLowerCase();
        }
    }
    
    private final OverallStatus overallStatus;
    private final AdmissionDecision decision;
    private final Instant lastCheck;
    private final Map<ServiceType, ServiceDetail> criticalServices;
    private final Map<ServiceType, ServiceDetail> optionalServices;
    private final Summary summary;
    
    public HealthReport(OverallStatus overallStatus, AdmissionDecision decision, Instant lastCheck,
                        Map<ServiceType, ServiceDetail> criticalServices,
                        Map<ServiceType, ServiceDetail> optionalServices,
                        Summary summary) {
        this.overallStatus = Objects.requireNonNull(overallStatus, "overallStatus must not be null");
        this.decision = Objects.requireNonNull(decision, "decision must not be null");
        this.lastCheck = lastCheck;
        this.criticalServices = Collections.unmodifiableMap(new LinkedHashMap<>(criticalServices));
        this.optionalServices = Collections.unmodifiableMap(new LinkedHashMap<>(optionalServices));
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
    }
    
    public OverallStatus getOverallStatus() {
        return overallStatus;
    }
    
    public boolean isAllowConnections() {
        return decision.isAllowed();
    }
    
    public String getDenialReason() {
        return decision.getReason().orElse(null);
    }
    
    public AdmissionDecision getDecision() {
        return decision;
    }
    
    /**
     * Time of the last completed global check, or null if none has completed.
     */
    public Instant getLastCheck() {
        return lastCheck;
    }
    
    public Map<ServiceType, ServiceDetail> getCriticalServices() {
        return criticalServices;
    }
    
    public Map<ServiceType, ServiceDetail> getOptionalServices() {
        return optionalServices;
    }
    
    public Summary getSummary() {
        return summary;
    }
    
    /**
     * Renders the report as nested maps and lists keyed the way monitoring endpoints expect.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("overallStatus", overallStatus.id());
        map.put("allowConnections", isAllowConnections());
        map.put("denialReason", getDenialReason());
        map.put("lastCheck", lastCheck != null ? lastCheck.toString() : null);
        map.put("criticalServices", detailsToMap(criticalServices));
        map.put("optionalServices", detailsToMap(optionalServices));
        map.put("summary", summary.toMap());
        return map;
    }
    
    private static Map<String, Object> detailsToMap(Map<ServiceType, ServiceDetail> details) {
        Map<String, Object> map = new LinkedHashMap<>();
        details.forEach((type, detail) -> map.put(type.id(), detail.toMap()));
        return map;
    }
    
    @Override
    public String toString() {
        return String.format("HealthReport{overall=%s, allowConnections=%s, reason='%s', lastCheck=%s, summary=%s}",
            overallStatus, isAllowConnections(), getDenialReason(), lastCheck, summary);
    }
    
    /**
     * Per-service entry of the report.
     */
    public static final class ServiceDetail {
        private final boolean available;
        private final ServiceStatus status;
        private final Instant lastCheck;
        private final String error;
        private final Duration responseTime;
        private final boolean circuitBreakerOpen;
        
        public ServiceDetail(boolean available, ServiceHealthInfo info) {
            this.available = available;
            this.status = info.getStatus();
            this.lastCheck = info.getLastCheck().orElse(null);
            this.error = info.getErrorMessage().orElse(null);
            this.responseTime = info.getResponseTime().orElse(null);
            this.circuitBreakerOpen = info.isCircuitBreakerOpen();
        }
        
        public boolean isAvailable() {
            return available;
        }
        
        public ServiceStatus getStatus() {
            return status;
        }
        
        public Instant getLastCheck() {
            return lastCheck;
        }
        
        public String getError() {
            return error;
        }
        
        public Duration getResponseTime() {
            return responseTime;
        }
        
        public boolean isCircuitBreakerOpen() {
            return circuitBreakerOpen;
        }
        
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("available", available);
            map.put("status", status.id());
            map.put("lastCheck", lastCheck != null ? lastCheck.toString() : null);
            map.put("error", error);
            map.put("responseTime", responseTime != null ? responseTime.toMillis() / 1000.0 : null);
            map.put("circuitBreakerOpen", circuitBreakerOpen);
            return map;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ServiceDetail)) return false;
            ServiceDetail that = (ServiceDetail) o;
            return available == that.available && circuitBreakerOpen == that.circuitBreakerOpen
                && status == that.status && Objects.equals(lastCheck, that.lastCheck)
                && Objects.equals(error, that.error) && Objects.equals(responseTime, that.responseTime);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(available, status, lastCheck, error, responseTime, circuitBreakerOpen);
        }
    }
    
    /**
     * Counts across all services.
     */
    public static final class Summary {
        private final int totalServices;
        private final int criticalCount;
        private final int optionalCount;
        private final int healthyCount;
        private final int unknownCount;
        private final List<ServiceType> degradedServices;
        private final List<ServiceType> failedServices;
        
        public Summary(int totalServices, int criticalCount, int optionalCount, int healthyCount,
                       int unknownCount, List<ServiceType> degradedServices, List<ServiceType> failedServices) {
            this.totalServices = totalServices;
            this.criticalCount = criticalCount;
            this.optionalCount = optionalCount;
            this.healthyCount = healthyCount;
            this.unknownCount = unknownCount;
            this.degradedServices = List.copyOf(degradedServices);
            this.failedServices = List.copyOf(failedServices);
        }
        
        public int getTotalServices() {
            return totalServices;
        }
        
        public int getCriticalCount() {
            return criticalCount;
        }
        
        public int getOptionalCount() {
            return optionalCount;
        }
        
        public int getHealthyCount() {
            return healthyCount;
        }
        
        public int getDegradedCount() {
            return degradedServices.size();
        }
        
        public int getFailedCount() {
            return failedServices.size();
        }
        
        public int getUnknownCount() {
            return unknownCount;
        }
        
        public List<ServiceType> getDegradedServices() {
            return degradedServices;
        }
        
        public List<ServiceType> getFailedServices() {
            return failedServices;
        }
        
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("totalServices", totalServices);
            map.put("criticalCount", criticalCount);
            map.put("optionalCount", optionalCount);
            map.put("healthyCount", healthyCount);
            map.put("degradedCount", getDegradedCount());
            map.put("failedCount", getFailedCount());
            map.put("unknownCount", unknownCount);
            map.put("degradedServices", ids(degradedServices));
            map.put("failedServices", ids(failedServices));
            return map;
        }
        
        private static List<String> ids(List<ServiceType> services) {
            return services.stream().map(ServiceType::id).collect(Collectors.toList());
        }
        
        @Override
        public String toString() {
            return String.format("Summary{total=%d, healthy=%d, degraded=%s, failed=%s, unknown=%d}",
                totalServices, healthyCount, degradedServices, failedServices, unknownCount);
        }
    }
}
