package com.realtime.admission.model;

/**
 * Health status of a monitored dependency.
 */
public enum ServiceStatus {
    
    /**
     * Never probed, or no probe is registered for the service.
     */
    UNKNOWN,
    
    HEALTHY,
    
    /**
     * Reachable but impaired. Still counts as available for admission.
     */
    DEGRADED,
    
    FAILED;
    
    public boolean isUsable() {
        return this == HEALTHY || this == DEGRADED;
    }
    
    public String id() {
        return name().toLowerCase();
    }
}
