package com.realtime.admission.model;

import com.realtime.admission.config.CircuitBreakerConfig;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Diagnostic snapshot of a circuit breaker.
 */
public final class CircuitBreakerStatus {
    
    private final String name;
    private final CircuitBreakerState state;
    private final int failureCount;
    private final int successCount;
    private final Instant lastFailureTime;
    private final Map<String, Long> failureHistory;
    private final CircuitBreakerConfig config;
    
    public CircuitBreakerStatus(String name, CircuitBreakerState state, int failureCount, int successCount,
                                Instant lastFailureTime, Map<String, Long> failureHistory,
                                CircuitBreakerConfig config) {
        this.name = name;
        this.state = state;
        this.failureCount = failureCount;
        this.successCount = successCount;
        this.lastFailureTime = lastFailureTime;
        this.failureHistory = Collections.unmodifiableMap(new LinkedHashMap<>(failureHistory));
        this.config = config;
    }
    
    public String getName() {
        return name;
    }
    
    public CircuitBreakerState getState() {
        return state;
    }
    
    public int getFailureCount() {
        return failureCount;
    }
    
    public int getSuccessCount() {
        return successCount;
    }
    
    public Optional<Instant> getLastFailureTime() {
        return Optional.ofNullable(lastFailureTime);
    }
    
    /**
     * Failures recorded per operation kind since the breaker was created.
     */
    public Map<String, Long> getFailureHistory() {
        return failureHistory;
    }
    
    public CircuitBreakerConfig getConfig() {
        return config;
    }
    
    @Override
    public String toString() {
        return String.format("CircuitBreakerStatus{name='%s', state=%s, failures=%d, successes=%d, " +
                           "lastFailure=%s, history=%s}",
            name, state, failureCount, successCount, lastFailureTime, failureHistory);
    }
}
