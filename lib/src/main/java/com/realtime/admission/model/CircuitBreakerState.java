package com.realtime.admission.model;

/**
 * State of a {@link com.realtime.admission.resilience.CircuitBreaker}.
 */
public enum CircuitBreakerState {
    
    /**
     * Calls flow through; failures are counted against the threshold.
     */
    CLOSED,
    
    /**
     * Calls are rejected without being attempted until the recovery timeout elapses.
     */
    OPEN,
    
    /**
     * Probation after recovery - calls are let through and a single failure reopens the circuit.
     */
    HALF_OPEN
}
