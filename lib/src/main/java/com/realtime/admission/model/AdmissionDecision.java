package com.realtime.admission.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an admission check. A denial always carries a reason the gateway
 * can hand back to the client when it closes the connection.
 */
public final class AdmissionDecision {
    
    private static final AdmissionDecision ALLOW = new AdmissionDecision(true, null);
    
    private final boolean allowed;
    private final String reason;
    
    private AdmissionDecision(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason = reason;
    }
    
    public static AdmissionDecision allow() {
        return ALLOW;
    }
    
    public static AdmissionDecision deny(String reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        if (reason.isBlank()) {
            throw new IllegalArgumentException("A denial must carry a reason");
        }
        return new AdmissionDecision(false, reason);
    }
    
    public boolean isAllowed() {
        return allowed;
    }
    
    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AdmissionDecision)) return false;
        AdmissionDecision that = (AdmissionDecision) o;
        return allowed == that.allowed && Objects.equals(reason, that.reason);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(allowed, reason);
    }
    
    @Override
    public String toString() {
        return allowed ? "AdmissionDecision{allowed}" 
                       : String.format("AdmissionDecision{denied, reason='%s'}", reason);
    }
}
