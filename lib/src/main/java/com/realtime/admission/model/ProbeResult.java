package com.realtime.admission.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result reported by a single health probe.
 */
public final class ProbeResult {
    
    private final ServiceStatus status;
    private final String message;
    
    private ProbeResult(ServiceStatus status, String message) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        if (status == ServiceStatus.UNKNOWN) {
            throw new IllegalArgumentException("A probe must report HEALTHY, DEGRADED or FAILED");
        }
        this.message = message;
    }
    
    public static ProbeResult healthy() {
        return new ProbeResult(ServiceStatus.HEALTHY, null);
    }
    
    public static ProbeResult degraded(String message) {
        return new ProbeResult(ServiceStatus.DEGRADED, message);
    }
    
    public static ProbeResult failed(String message) {
        return new ProbeResult(ServiceStatus.FAILED, message);
    }
    
    public ServiceStatus getStatus() {
        return status;
    }
    
    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }
    
    @Override
    public String toString() {
        return message == null ? "ProbeResult{" + status + "}" 
                               : String.format("ProbeResult{%s, '%s'}", status, message);
    }
}
