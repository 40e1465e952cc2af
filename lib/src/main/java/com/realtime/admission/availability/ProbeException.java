package com.realtime.admission.availability;

import com.realtime.admission.model.ServiceType;

/**
 * Raised inside a health probe when the dependency is unreachable or misbehaving.
 * Always contained by the availability manager and recorded as a FAILED status.
 */
public class ProbeException extends RuntimeException {
    
    private final ServiceType serviceType;
    
    public ProbeException(ServiceType serviceType, String message) {
        super(message);
        this.serviceType = serviceType;
    }
    
    public ProbeException(ServiceType serviceType, String message, Throwable cause) {
        super(message, cause);
        this.serviceType = serviceType;
    }
    
    public ServiceType getServiceType() {
        return serviceType;
    }
}
