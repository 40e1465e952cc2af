package com.realtime.admission.resilience;

import java.time.Duration;

/**
 * Base exception for failures raised by the circuit breaker itself, as opposed to
 * errors thrown by the protected operation, which propagate unchanged.
 */
public class ResilienceException extends RuntimeException {
    
    public ResilienceException(String message) {
        super(message);
    }
    
    public ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * The circuit is open and the call was rejected without being attempted.
     * Never retried; callers should switch to their fallback path.
     */
    public static class CircuitOpenException extends ResilienceException {
        private final String circuitName;
        private final Duration retryAfter;
        
        public CircuitOpenException(String circuitName, Duration retryAfter) {
            super(String.format("Circuit breaker '%s' is OPEN, call rejected (retry after %dms)", 
                               circuitName, retryAfter.toMillis()));
            this.circuitName = circuitName;
            this.retryAfter = retryAfter;
        }
        
        public String getCircuitName() {
            return circuitName;
        }
        
        /**
         * Time until the circuit admits a probe call.
         */
        public Duration getRetryAfter() {
            return retryAfter;
        }
    }
    
    /**
     * A single attempt did not complete within the configured timeout.
     */
    public static class OperationTimeoutException extends ResilienceException {
        private final String operationKind;
        private final Duration timeout;
        
        public OperationTimeoutException(String circuitName, String operationKind, Duration timeout, Throwable cause) {
            super(String.format("Operation '%s' on circuit '%s' timed out after %dms", 
                               operationKind, circuitName, timeout.toMillis()), cause);
            this.operationKind = operationKind;
            this.timeout = timeout;
        }
        
        public String getOperationKind() {
            return operationKind;
        }
        
        public Duration getTimeout() {
            return timeout;
        }
    }
}
